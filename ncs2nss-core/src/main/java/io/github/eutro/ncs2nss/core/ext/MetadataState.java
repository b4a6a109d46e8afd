package io.github.eutro.ncs2nss.core.ext;

import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.passes.IRPass;
import io.github.eutro.ncs2nss.core.passes.meta.ComputeDoms;
import io.github.eutro.ncs2nss.core.passes.meta.ComputePostDoms;
import io.github.eutro.ncs2nss.core.passes.meta.ComputePreds;
import io.github.eutro.ncs2nss.core.passes.meta.FindLoops;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which analyses of a {@link Subroutine} are up to date.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity can be tracked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return id;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Metadata that also knows the passes that compute it.
     *
     * @param <T> The type the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException(pass + " is not in-place");
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Subroutine>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            LOOPS = new ComputableMetaKind<>("LOOPS", FindLoops.INSTANCE),
            POST_DOMS = new ComputableMetaKind<>("POST_DOMS", ComputePostDoms.INSTANCE);

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute any of the given metadata that is not valid.
     *
     * @param t     The thing to run passes on.
     * @param first The first metadata kind.
     * @param kinds The rest.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.clear(kind.id);
        }
    }

    /**
     * Invalidate everything derived from the subroutine's edges.
     */
    public void graphChanged() {
        invalidate(PREDS, DOMS, LOOPS, POST_DOMS);
    }
}
