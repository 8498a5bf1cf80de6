package com.netmotif.api;

/**
 * A value that can be bound to a name in a program environment.
 */
public interface Value {

    enum Kind {
        GRAPH("Graph"),
        NODE_SET("NodeSet");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    Kind kind();
}
