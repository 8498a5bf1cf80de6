package com.netmotif.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * POJO representation of a program outcome: either the bindings (and
 * optional result) of a successful run, or a single error.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "bindings", "result", "error" })
public final class ResultDocument {
    private List<ValueDef> bindings;
    private ValueDef result;
    private ErrorDef error;

    /** A graph or node set, named when it is a binding. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "name", "type", "node_count", "edges", "nodes" })
    public static final class ValueDef {
        private String name, type;
        @JsonProperty("node_count")
        private Integer nodeCount;
        private List<int[]> edges;
        private List<Integer> nodes;
    }

    /** The first error reported by the pipeline. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "kind", "message", "line", "column" })
    public static final class ErrorDef {
        private String kind, message;
        private Integer line, column;
    }
}
