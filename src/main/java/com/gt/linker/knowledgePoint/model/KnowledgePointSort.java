package com.gt.linker.knowledgePoint.model;

public enum KnowledgePointSort {
    Mastery("mastery"),
    Category("category"),
    NextReview("next_review");

    private final String code;

    KnowledgePointSort(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static KnowledgePointSort fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Mastery;
        }

        for (KnowledgePointSort sort : values()) {
            if (sort.code.equalsIgnoreCase(code) || sort.name().equalsIgnoreCase(code)) {
                return sort;
            }
        }
        throw new IllegalArgumentException("Unknown sort order " + code);
    }
}
