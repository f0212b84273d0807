package com.taxprep.fdg.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.taxprep.fdg.scenario.Scenario;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/** Scenario export and import as a JSON array. */
@Log4j2
public final class ScenarioFiles {
    private static final TypeReference<List<Scenario>> SCENARIO_LIST = new TypeReference<>() {
    };

    private ScenarioFiles() {
        // Utility class
    }

    public static void write(Path path, List<Scenario> scenarios) throws IOException {
        Files.writeString(path, Json.writePretty(scenarios));
        log.info("Exported {} scenarios to {}", scenarios.size(), path);
    }

    public static List<Scenario> read(Path path) throws IOException {
        List<Scenario> scenarios = Json.mapper().readValue(Files.readString(path), SCENARIO_LIST);
        log.info("Read {} scenarios from {}", scenarios.size(), path);
        return scenarios;
    }
}
