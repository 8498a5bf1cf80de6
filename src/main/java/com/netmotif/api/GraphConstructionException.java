package com.netmotif.api;

/**
 * Thrown when a {@link Graph} would be built with an invalid node count or
 * edge.
 */
public class GraphConstructionException extends IllegalArgumentException {
    public GraphConstructionException(String message) {
        super(message);
    }
}
