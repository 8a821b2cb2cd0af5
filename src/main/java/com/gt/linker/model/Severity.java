package com.gt.linker.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.linker.serialization.SeverityDeserializer;
import com.gt.linker.serialization.SeveritySerializer;

@JsonSerialize(using = SeveritySerializer.class)
@JsonDeserialize(using = SeverityDeserializer.class)
public enum Severity {
    Low("low"),
    Medium("medium"),
    High("high"),
    Critical("critical");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Severity fromCode(String code) {
        for (Severity severity : values()) {
            if (severity.code.equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity " + code);
    }
}
