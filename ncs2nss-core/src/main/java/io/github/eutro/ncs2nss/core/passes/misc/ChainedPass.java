package io.github.eutro.ncs2nss.core.passes.misc;

import io.github.eutro.ncs2nss.core.passes.IRPass;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Two passes run one after the other, the second receiving the first's result.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> first;
    private final IRPass<B, C> second;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> second) {
        this.first = first;
        this.second = second;
    }

    @Override
    public boolean isInPlace() {
        return first.isInPlace() && second.isInPlace();
    }

    // flattens left-nested chains, so long chains don't recurse deeply
    @SuppressWarnings("unchecked")
    private Deque<IRPass<Object, Object>> flatten() {
        Deque<IRPass<Object, Object>> passes = new ArrayDeque<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
            passes.addFirst((IRPass<Object, Object>) chained.second);
            pass = chained.first;
        }
        passes.addFirst((IRPass<Object, Object>) pass);
        return passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        int i = 0;
        for (IRPass<Object, Object> pass : flatten()) {
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("in pass " + i + " of chain: " + pass.getClass().getSimpleName()));
                throw e;
            }
            i++;
        }
        return (C) acc;
    }
}
