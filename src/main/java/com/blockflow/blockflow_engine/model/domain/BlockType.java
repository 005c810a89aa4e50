package com.blockflow.blockflow_engine.model.domain;

public enum BlockType {
    STARTER("starter"),
    FUNCTION("function"),
    ROUTER("router"),
    CONDITION("condition"),
    LOOP("loop"),
    TOOL(null);     // any other kind: a named external tool

    private final String kind;

    BlockType(String kind) {
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }

    public boolean isDecision() {
        return this == ROUTER || this == CONDITION;
    }

    /** Built-in kinds match case-insensitively; anything else is treated as a tool kind. */
    public static BlockType fromKind(String kind) {
        if (kind == null) return TOOL;
        for (BlockType type : values()) {
            if (type.kind != null && type.kind.equalsIgnoreCase(kind.trim())) {
                return type;
            }
        }
        return TOOL;
    }

    public static boolean isBuiltIn(String kind) {
        return fromKind(kind) != TOOL;
    }
}
