package io.github.eutro.ncs2nss.core.cfg;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A directed edge to a block, by index.
 */
public final class Edge {
    @NotNull
    public final EdgeKind kind;
    public final int target;

    public Edge(@NotNull EdgeKind kind, int target) {
        this.kind = kind;
        this.target = target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return target == edge.target && kind == edge.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, target);
    }

    @Override
    public String toString() {
        return kind + "->" + (target == BasicBlock.EXIT ? "exit" : "b" + target);
    }
}
