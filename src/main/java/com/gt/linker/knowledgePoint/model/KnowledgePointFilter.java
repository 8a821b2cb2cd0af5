package com.gt.linker.knowledgePoint.model;

import com.gt.linker.model.MasteryTier;

// null tier or category means no restriction
public record KnowledgePointFilter(MasteryTier tier, String category, KnowledgePointSort sort) {

    public static KnowledgePointFilter none() {
        return new KnowledgePointFilter(null, null, KnowledgePointSort.Mastery);
    }

    public KnowledgePointSort sortOrDefault() {
        return sort == null ? KnowledgePointSort.Mastery : sort;
    }
}
