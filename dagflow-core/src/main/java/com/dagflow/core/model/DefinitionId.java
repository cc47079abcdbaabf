package com.dagflow.core.model;

import java.util.Objects;

/**
 * Identity of a registered workflow definition: name plus version.
 * Version 0 is only meaningful before registration and means "assign the next version".
 */
public record DefinitionId(String name, int version) {

    public DefinitionId {
        Objects.requireNonNull(name, "name");
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
    }

    public static DefinitionId of(String name, int version) {
        return new DefinitionId(name, version);
    }

    /**
     * Parse the {@code name:version} form produced by {@link #toString()}.
     */
    public static DefinitionId parse(String value) {
        int idx = value == null ? -1 : value.lastIndexOf(':');
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Malformed definition id: " + value);
        }
        try {
            return new DefinitionId(value.substring(0, idx), Integer.parseInt(value.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed definition id: " + value, e);
        }
    }

    @Override
    public String toString() {
        return name + ":" + version;
    }
}
