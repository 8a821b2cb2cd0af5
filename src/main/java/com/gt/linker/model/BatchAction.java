package com.gt.linker.model;

public enum BatchAction {
    Archive("archive"),
    Unarchive("unarchive"),
    Delete("delete");

    private final String code;

    BatchAction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static BatchAction fromCode(String code) {
        for (BatchAction action : values()) {
            if (action.code.equalsIgnoreCase(code)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown batch action " + code);
    }
}
