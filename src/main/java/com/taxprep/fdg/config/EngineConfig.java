package com.taxprep.fdg.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.taxprep.fdg.io.Json;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Engine settings, bound from {@code form-graph.json} on the classpath. Every
 * property has an in-code default.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public static final String DEFAULT_RESOURCE = "form-graph.json";

    private int taxYear = 2025;
    private int maxEvaluationDepth = 256;
    private int selectionLimit = 3;
    private boolean verifyFieldLayout = true;
    /** Must be a power of two. */
    private int ringBufferSize = 1024;
    private int apiPort = 7070;

    public static EngineConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static EngineConfig load(String resource) {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("{} not found on classpath, using defaults", resource);
                return new EngineConfig();
            }
            EngineConfig config = Json.mapper().readValue(in, EngineConfig.class);
            config.validate();
            log.info("Loaded engine config from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable engine config " + resource, e);
        }
    }

    /** @throws IllegalArgumentException on an out-of-range setting */
    public void validate() {
        if (maxEvaluationDepth < 1)
            throw new IllegalArgumentException("maxEvaluationDepth must be positive: " + maxEvaluationDepth);
        if (selectionLimit < 1)
            throw new IllegalArgumentException("selectionLimit must be positive: " + selectionLimit);
        if (Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of two: " + ringBufferSize);
        if (apiPort < 0 || apiPort > 65535)
            throw new IllegalArgumentException("apiPort out of range: " + apiPort);
    }
}
