package io.github.eutro.ncs2nss.core.passes.meta;

import io.github.eutro.ncs2nss.core.cfg.Loop;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;
import io.github.eutro.ncs2nss.core.util.DominatorTree;

import java.util.*;

/**
 * Finds the natural loops of a subroutine, and attaches them as {@link CommonExts#LOOPS}.
 * <p>
 * A back edge is an edge to a block that dominates its source. Back edges to the same header
 * form one loop. The loop's follow is the first exit of the header if it has one, then the
 * first exit of a latch, then the exit with the lowest index.
 */
public class FindLoops implements InPlaceIRPass<Subroutine> {
    public static final FindLoops INSTANCE = new FindLoops();

    @Override
    public void runInPlace(Subroutine sub) {
        MetadataState ms = sub.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(sub, MetadataState.PREDS, MetadataState.DOMS);
        int[] idom = sub.getExtOrThrow(CommonExts.IDOM);
        int[][] preds = sub.getExtOrThrow(CommonExts.PREDS);
        int[][] succs = sub.successors();

        Map<Integer, List<Integer>> latchesByHeader = new TreeMap<>();
        for (int u = 0; u < succs.length; u++) {
            if (u != 0 && idom[u] == -1) continue;
            for (int h : succs[u]) {
                if (DominatorTree.dominates(idom, h, u)) {
                    latchesByHeader.computeIfAbsent(h, k -> new ArrayList<>()).add(u);
                }
            }
        }

        Map<Integer, Loop> loops = new TreeMap<>();
        for (Map.Entry<Integer, List<Integer>> entry : latchesByHeader.entrySet()) {
            int h = entry.getKey();
            List<Integer> latches = entry.getValue();
            Collections.sort(latches);
            BitSet body = new BitSet();
            body.set(h);
            Deque<Integer> work = new ArrayDeque<>();
            for (int latch : latches) {
                if (!body.get(latch)) {
                    body.set(latch);
                    work.push(latch);
                }
            }
            while (!work.isEmpty()) {
                int n = work.pop();
                for (int p : preds[n]) {
                    if (!body.get(p)) {
                        body.set(p);
                        work.push(p);
                    }
                }
            }
            loops.put(h, new Loop(h, body, latches, chooseFollow(succs, h, latches, body)));
        }
        sub.attachExt(CommonExts.LOOPS, Collections.unmodifiableMap(loops));
        ms.validate(MetadataState.LOOPS);
    }

    private static int chooseFollow(int[][] succs, int header, List<Integer> latches, BitSet body) {
        for (int s : succs[header]) {
            if (!body.get(s)) return s;
        }
        for (int latch : latches) {
            for (int s : succs[latch]) {
                if (!body.get(s)) return s;
            }
        }
        int best = -1;
        for (int n = body.nextSetBit(0); n >= 0; n = body.nextSetBit(n + 1)) {
            for (int s : succs[n]) {
                if (!body.get(s) && (best == -1 || s < best)) best = s;
            }
        }
        return best;
    }
}
