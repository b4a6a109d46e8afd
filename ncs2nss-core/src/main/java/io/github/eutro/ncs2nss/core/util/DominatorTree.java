package io.github.eutro.ncs2nss.core.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Immediate dominators of a graph given as successor arrays over dense indices.
 */
public final class DominatorTree {
    private DominatorTree() {
    }

    /**
     * Compute immediate dominators.
     *
     * @param succ The successors of each node.
     * @param root The root node.
     * @return For each node, its immediate dominator; {@code -1} for the root and for unreachable nodes.
     */
    public static int[] compute(int[][] succ, int root) {
        int count = succ.length;
        Runner r = new Runner(count);
        for (int v = 0; v < count; v++) {
            r.succ[v + 1] = new int[succ[v].length];
            for (int j = 0; j < succ[v].length; j++) {
                r.succ[v + 1][j] = succ[v][j] + 1;
            }
        }
        r.run(root + 1);
        int[] idom = new int[count];
        for (int v = 0; v < count; v++) {
            idom[v] = r.semi[v + 1] == 0 || v == root ? -1 : r.dom[v + 1] - 1;
        }
        return idom;
    }

    /**
     * Whether {@code a} dominates {@code b}, by walking up the tree.
     *
     * @param idom The immediate dominators.
     * @param a    The candidate dominator.
     * @param b    The node.
     * @return Whether every path from the root to {@code b} passes {@code a}.
     */
    public static boolean dominates(int[] idom, int a, int b) {
        for (int v = b; v != -1; v = idom[v]) {
            if (v == a) return true;
        }
        return false;
    }

    // 1-based, with 0 as the "none" sentinel, as in the paper
    private static final class Runner {
        final int[][] succ;
        final int[] dom, parent, ancestor, child, vertex, label, semi, size;
        final List<List<Integer>> pred = new ArrayList<>(), bucket = new ArrayList<>();
        int n;

        Runner(int count) {
            int len = count + 1;
            succ = new int[len][];
            dom = new int[len];
            parent = new int[len];
            ancestor = new int[len];
            child = new int[len];
            vertex = new int[len];
            label = new int[len];
            semi = new int[len];
            size = new int[len];
            for (int i = 0; i < len; i++) {
                pred.add(new ArrayList<>());
                bucket.add(new ArrayList<>());
            }
            succ[0] = new int[0];
        }

        void dfs(int v) {
            semi[v] = ++n;
            vertex[n] = label[v] = v;
            ancestor[v] = child[v] = 0;
            size[v] = 1;
            for (int w : succ[v]) {
                if (semi[w] == 0) {
                    parent[w] = v;
                    dfs(w);
                }
                pred.get(w).add(v);
            }
        }

        void compress(int v) {
            if (ancestor[ancestor[v]] != 0) {
                compress(ancestor[v]);
                if (semi[label[ancestor[v]]] < semi[label[v]]) {
                    label[v] = label[ancestor[v]];
                }
                ancestor[v] = ancestor[ancestor[v]];
            }
        }

        int eval(int v) {
            if (ancestor[v] == 0) return label[v];
            compress(v);
            return semi[label[ancestor[v]]] >= semi[label[v]] ? label[v] : label[ancestor[v]];
        }

        void link(int v, int w) {
            int s = w;
            while (semi[label[w]] < semi[label[child[s]]]) {
                if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                    ancestor[child[s]] = s;
                    child[s] = child[child[s]];
                } else {
                    size[child[s]] = size[s];
                    s = ancestor[s] = child[s];
                }
            }
            label[s] = label[w];
            size[v] += size[w];
            if (size[v] < 2 * size[w]) {
                int t = s;
                s = child[v];
                child[v] = t;
            }
            while (s != 0) {
                ancestor[s] = v;
                s = child[s];
            }
        }

        void run(int root) {
            Arrays.fill(semi, 0);
            n = 0;
            dfs(root);
            size[0] = label[0] = semi[0] = 0;
            for (int i = n; i >= 2; i--) {
                int w = vertex[i];
                for (int v : pred.get(w)) {
                    int u = eval(v);
                    if (semi[u] < semi[w]) semi[w] = semi[u];
                }
                bucket.get(vertex[semi[w]]).add(w);
                link(parent[w], w);
                List<Integer> bk = bucket.get(parent[w]);
                for (int v : bk) {
                    int u = eval(v);
                    dom[v] = semi[u] < semi[v] ? u : parent[w];
                }
                bk.clear();
            }
            for (int i = 2; i <= n; i++) {
                int w = vertex[i];
                if (dom[w] != vertex[semi[w]]) dom[w] = dom[dom[w]];
            }
            dom[root] = 0;
        }
    }
}
