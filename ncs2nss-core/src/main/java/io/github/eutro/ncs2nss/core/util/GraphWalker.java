package io.github.eutro.ncs2nss.core.util;

import io.github.eutro.ncs2nss.core.cfg.Subroutine;

import java.util.*;

/**
 * Walks a graph depth-first, yielding nodes in pre- or post-order.
 *
 * @param <T> The node type.
 */
public class GraphWalker<T> {
    private final T root;
    private final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a walker.
     * <p>
     * Children yielded later by the successor function are visited first.
     *
     * @param root        The root node.
     * @param getChildren The successor function.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Walk the blocks of a subroutine by local index, starting at its entry.
     * <p>
     * Successors are visited in reverse edge order, so the reverse post-order lists
     * the fallthrough side of a branch before its jump target.
     *
     * @param sub The subroutine.
     * @return The walker.
     */
    public static GraphWalker<Integer> localWalker(Subroutine sub) {
        int[][] succs = sub.successors();
        return new GraphWalker<>(0, i -> {
            int[] ss = succs[i];
            List<Integer> ret = new ArrayList<>(ss.length);
            for (int j = ss.length - 1; j >= 0; j--) ret.add(ss[j]);
            return ret;
        });
    }

    /**
     * Compute the reverse post-order of a subroutine's reachable blocks.
     *
     * @param sub The subroutine.
     * @return Local block indices in reverse post-order.
     */
    public static List<Integer> reversePostOrder(Subroutine sub) {
        List<Integer> order = localWalker(sub).postOrder().toList();
        Collections.reverse(order);
        return order;
    }

    /**
     * An order over a graph.
     *
     * @param <T> The node type.
     */
    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.push(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.pop();
            for (T child : getChildren.apply(top)) {
                if (seen.add(child)) stack.push(child);
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        // frames hold a node and an iterator over its remaining children
        private final Deque<Map.Entry<T, Iterator<? extends T>>> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            seen.add(root);
            stack.push(new AbstractMap.SimpleEntry<>(root, getChildren.apply(root).iterator()));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Map.Entry<T, Iterator<? extends T>> top = stack.peek();
                Iterator<? extends T> it = top.getValue();
                boolean descended = false;
                while (it.hasNext()) {
                    T child = it.next();
                    if (seen.add(child)) {
                        stack.push(new AbstractMap.SimpleEntry<>(child, getChildren.apply(child).iterator()));
                        descended = true;
                        break;
                    }
                }
                if (!descended) {
                    stack.pop();
                    return top.getKey();
                }
            }
        }
    }
}
