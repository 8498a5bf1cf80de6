package com.netmotif.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Tunables for the compilation pipeline.
 *
 * <p>
 * Read from the classpath resource {@value #RESOURCE} when it exists; any
 * field missing from the file keeps its default.
 *
 * <pre>
 * {
 *   "maxNodeCount": 1000000,
 *   "maxEdgeCount": 5000000,
 *   "warnOnRebinding": true,
 *   "prettyPrint": true
 * }
 * </pre>
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelineConfig {
    public static final String RESOURCE = "netmotif.json";

    /** Upper bound for {@code maxNodeCount}; graph storage is int-indexed. */
    public static final int NODE_LIMIT_CEILING = Integer.MAX_VALUE - 8;

    /** Upper bound for {@code maxEdgeCount}; adjacency holds two ints per edge. */
    public static final int EDGE_LIMIT_CEILING = NODE_LIMIT_CEILING / 2;

    /** Largest graph, in nodes, that a program may build. */
    private int maxNodeCount = 1_000_000;

    /** Largest graph, in edges, that a program may build. */
    private int maxEdgeCount = 5_000_000;

    /** Log a warning when a {@code let} rebinds an existing name. */
    private boolean warnOnRebinding = true;

    /** Indent JSON written by {@link JsonResultWriter}. */
    private boolean prettyPrint = true;

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    /** Loads {@value #RESOURCE} from the classpath, or returns defaults if absent. */
    public static PipelineConfig load() {
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE);
                return defaults();
            }
            PipelineConfig config = new ObjectMapper().readValue(in, PipelineConfig.class).validate();
            log.debug("Loaded pipeline config from {}: {}", RESOURCE, config);
            return config;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid " + RESOURCE + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /** Parses a JSON config document. */
    public static PipelineConfig fromJson(String json) {
        try {
            return new ObjectMapper().readValue(json, PipelineConfig.class).validate();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid pipeline config: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Checks that both limits are positive and small enough for int-indexed
     * graphs.
     *
     * @return this config
     * @throws IllegalArgumentException on a limit outside its range.
     */
    public PipelineConfig validate() {
        if (maxNodeCount <= 0 || maxNodeCount > NODE_LIMIT_CEILING)
            throw new IllegalArgumentException("maxNodeCount must be in 1.." + NODE_LIMIT_CEILING
                    + ", got " + maxNodeCount);
        if (maxEdgeCount <= 0 || maxEdgeCount > EDGE_LIMIT_CEILING)
            throw new IllegalArgumentException("maxEdgeCount must be in 1.." + EDGE_LIMIT_CEILING
                    + ", got " + maxEdgeCount);
        return this;
    }
}
