package io.github.eutro.ncs2nss.core.passes.meta;

import io.github.eutro.ncs2nss.core.cfg.Loop;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;
import io.github.eutro.ncs2nss.core.util.DominatorTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link CommonExts#IPDOM} for a subroutine: the block where the paths from a branch meet again.
 * <p>
 * Post-dominators are computed on the acyclic graph the structurer sees: back edges and edges
 * leaving a loop are removed, each loop header instead gets an edge to the loop's follow, and blocks
 * left without successors flow to a virtual exit.
 */
public class ComputePostDoms implements InPlaceIRPass<Subroutine> {
    public static final ComputePostDoms INSTANCE = new ComputePostDoms();

    @Override
    public void runInPlace(Subroutine sub) {
        MetadataState ms = sub.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(sub, MetadataState.PREDS, MetadataState.DOMS, MetadataState.LOOPS);
        int[][] succs = sub.successors();
        int[] idom = sub.getExtOrThrow(CommonExts.IDOM);
        Map<Integer, Loop> loops = sub.getExtOrThrow(CommonExts.LOOPS);
        int n = succs.length;
        int exit = n;

        List<List<Integer>> reduced = new ArrayList<>(n + 1);
        for (int u = 0; u <= n; u++) reduced.add(new ArrayList<>());
        for (int u = 0; u < n; u++) {
            edges:
            for (int s : succs[u]) {
                if (DominatorTree.dominates(idom, s, u)) continue;
                for (Loop loop : loops.values()) {
                    if (loop.contains(u) && !loop.contains(s)) continue edges;
                }
                addEdge(reduced, u, s);
            }
        }
        for (Loop loop : loops.values()) {
            if (loop.follow != -1) addEdge(reduced, loop.header, loop.follow);
        }
        for (int u = 0; u < n; u++) {
            if (reduced.get(u).isEmpty()) addEdge(reduced, u, exit);
        }

        // post-dominators are the dominators of the reversed graph, rooted at the exit
        List<List<Integer>> reversed = new ArrayList<>(n + 1);
        for (int u = 0; u <= n; u++) reversed.add(new ArrayList<>());
        for (int u = 0; u <= n; u++) {
            for (int s : reduced.get(u)) reversed.get(s).add(u);
        }
        int[][] rev = new int[n + 1][];
        for (int u = 0; u <= n; u++) {
            rev[u] = reversed.get(u).stream().mapToInt(Integer::intValue).toArray();
        }
        int[] ipdom = DominatorTree.compute(rev, exit);
        int[] result = new int[n];
        for (int u = 0; u < n; u++) {
            result[u] = ipdom[u] == exit ? -1 : ipdom[u];
        }
        sub.attachExt(CommonExts.IPDOM, result);
        ms.validate(MetadataState.POST_DOMS);
    }

    private static void addEdge(List<List<Integer>> graph, int from, int to) {
        if (!graph.get(from).contains(to)) graph.get(from).add(to);
    }
}
