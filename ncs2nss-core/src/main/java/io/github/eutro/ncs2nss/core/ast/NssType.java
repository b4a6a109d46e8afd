package io.github.eutro.ncs2nss.core.ast;

import org.jetbrains.annotations.Nullable;

/**
 * The value types of NWScript, with their size in stack cells.
 */
public enum NssType {
    VOID("void", 0),
    INT("int", 1),
    FLOAT("float", 1),
    STRING("string", 1),
    OBJECT("object", 1),
    VECTOR("vector", 3),
    /**
     * A deferred action argument; it is saved by {@code STORE_STATE} rather than pushed.
     */
    ACTION("action", 0),
    EFFECT("effect", 1),
    EVENT("event", 1),
    LOCATION("location", 1),
    TALENT("talent", 1),
    ITEMPROPERTY("itemproperty", 1),
    STRUCT("struct", 1),
    /**
     * The placeholder for a type that could not be inferred, or was inferred inconsistently.
     */
    ANY("int", 1),
    ;

    private final String sourceName;
    private final int cells;

    NssType(String sourceName, int cells) {
        this.sourceName = sourceName;
        this.cells = cells;
    }

    /**
     * Get the name to declare a variable of this type with.
     *
     * @return The type name.
     */
    public String getSourceName() {
        return sourceName;
    }

    /**
     * Get the name to use in a function signature. Unresolved types are written as {@code unknown},
     * for the signature repair to settle.
     *
     * @return The type name.
     */
    public String getSignatureName() {
        return this == ANY ? "unknown" : sourceName;
    }

    public int getCells() {
        return cells;
    }

    public boolean isKnown() {
        return this != ANY;
    }

    /**
     * Look up a type by its NWScript name.
     *
     * @param name The name.
     * @return The type, or null if the name is not a type.
     */
    @Nullable
    public static NssType fromName(String name) {
        for (NssType type : values()) {
            if (type != ANY && type.sourceName.equals(name)) return type;
        }
        return null;
    }
}
