package com.dagflow.core.model;

/**
 * Directed dependency edge: {@code to} depends on {@code from}.
 */
public record Edge(String from, String to) {

    public static Edge of(String from, String to) {
        return new Edge(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
