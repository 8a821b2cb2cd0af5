package com.gt.linker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

// Server-assigned identity. Only the remote store ever creates one of these.
public record CompositeKnowledgePointId(@JsonProperty("user_id") long ownerId,
                                        @JsonProperty("sequence_id") long sequenceId) {

    private static final String SEPARATOR = ":";

    public String canonical() {
        return ownerId + SEPARATOR + sequenceId;
    }

    public static CompositeKnowledgePointId parse(String canonical) {
        if (canonical == null) {
            throw new IllegalArgumentException("Composite id cannot be null");
        }

        String[] parts = canonical.split(SEPARATOR);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid composite id: " + canonical);
        }

        try {
            return new CompositeKnowledgePointId(Long.parseLong(parts[0]), Long.parseLong(parts[1]));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid composite id: " + canonical, ex);
        }
    }

    public static boolean isCanonical(String value) {
        return value != null && value.matches("^-?\\d+:-?\\d+$");
    }

    @Override
    public String toString() {
        return canonical();
    }
}
