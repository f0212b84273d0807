package com.taxprep.fdg.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.taxprep.fdg.model.ValidatedInformation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads validated input snapshots from JSON. */
public final class InformationReader {
    private InformationReader() {
        // Utility class
    }

    public static ValidatedInformation read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return Json.mapper().readValue(in, ValidatedInformation.class);
        }
    }

    /** Reads a snapshot bundled on the classpath. */
    public static ValidatedInformation readResource(String resource) throws IOException {
        try (InputStream in = InformationReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return Json.mapper().readValue(in, ValidatedInformation.class);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid snapshot
     */
    public static ValidatedInformation parse(String json) {
        try {
            return Json.mapper().readValue(json, ValidatedInformation.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid input snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
