package com.gt.linker.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.linker.serialization.MasteryTierSerializer;

@JsonSerialize(using = MasteryTierSerializer.class)
public enum MasteryTier {
    Weak("weak", 0.0),
    Medium("medium", 1.5),
    Strong("strong", 3.5);

    public static final double MIN_LEVEL = 0.0;
    public static final double MAX_LEVEL = 5.0;

    private final String code;
    private final double lowerBound;

    MasteryTier(String code, double lowerBound) {
        this.code = code;
        this.lowerBound = lowerBound;
    }

    public String getCode() {
        return code;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static MasteryTier of(double masteryLevel) {
        if (Double.isNaN(masteryLevel) || masteryLevel < Medium.lowerBound) {
            return Weak;
        } else if (masteryLevel < Strong.lowerBound) {
            return Medium;
        }
        return Strong;
    }

    public static MasteryTier fromCode(String code) {
        for (MasteryTier tier : values()) {
            if (tier.code.equalsIgnoreCase(code) || tier.name().equalsIgnoreCase(code)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown mastery tier " + code);
    }
}
