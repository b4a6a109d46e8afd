package io.github.eutro.ncs2nss.core.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A variable identity, recovered from a stack cell.
 * <p>
 * The type is inferred from the first definition and checked on later uses. A conflict widens
 * it to {@link NssType#ANY} for good.
 */
public final class LocalSlot {
    public enum Kind {
        LOCAL,
        PARAM,
        GLOBAL,
        /**
         * The cell a subroutine writes its return value to.
         */
        RETURN,
        /**
         * Padding for a stack that was shallower than expected.
         */
        PLACEHOLDER,
    }

    @NotNull
    public final Kind kind;
    /**
     * The offset of the instruction that created the slot.
     */
    public final int definedAt;
    @NotNull
    private NssType type;
    private boolean conflicted;
    private boolean cancelled;
    @Nullable
    private String name;
    @Nullable
    private LocalSlot aliasOf;
    private int component;

    public LocalSlot(@NotNull Kind kind, @NotNull NssType type, int definedAt) {
        this.kind = kind;
        this.type = type;
        this.definedAt = definedAt;
    }

    @NotNull
    public NssType getType() {
        return type;
    }

    public boolean isConflicted() {
        return conflicted;
    }

    /**
     * Record a definition or use at a type.
     *
     * @param used The type.
     * @return False if this conflicts with the type already inferred.
     */
    public boolean unify(NssType used) {
        if (conflicted || used == NssType.ANY || used == type) return true;
        if (type == NssType.ANY) {
            type = used;
            return true;
        }
        type = NssType.ANY;
        conflicted = true;
        return false;
    }

    /**
     * Whether the slot turned out to hold a call's return value rather than a variable,
     * so its declaration must not be emitted.
     *
     * @return Whether the slot is cancelled.
     */
    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
    }

    @NotNull
    public String getName() {
        if (aliasOf != null) return aliasOf.getName();
        return name == null ? "slot" + definedAt : name;
    }

    public boolean isNamed() {
        return name != null;
    }

    public void setName(@NotNull String name) {
        this.name = name;
    }

    /**
     * Get the vector this slot is a component of, if it was merged into one.
     *
     * @return The vector slot, or null.
     */
    @Nullable
    public LocalSlot getAliasOf() {
        return aliasOf;
    }

    public int getComponent() {
        return component;
    }

    public void aliasTo(@NotNull LocalSlot vector, int component) {
        this.aliasOf = vector;
        this.component = component;
        this.cancelled = true;
    }

    public void retype(@NotNull NssType type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return getName() + ":" + type;
    }
}
