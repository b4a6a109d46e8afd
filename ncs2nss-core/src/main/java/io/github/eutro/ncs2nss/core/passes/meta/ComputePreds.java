package io.github.eutro.ncs2nss.core.passes.meta;

import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CommonExts#PREDS} for a subroutine. Predecessors are listed in ascending local index.
 */
public class ComputePreds implements InPlaceIRPass<Subroutine> {
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Subroutine sub) {
        int[][] succs = sub.successors();
        List<List<Integer>> preds = new ArrayList<>(succs.length);
        for (int i = 0; i < succs.length; i++) preds.add(new ArrayList<>());
        for (int i = 0; i < succs.length; i++) {
            for (int s : succs[i]) {
                if (!preds.get(s).contains(i)) preds.get(s).add(i);
            }
        }
        int[][] arr = new int[succs.length][];
        for (int i = 0; i < succs.length; i++) {
            arr[i] = preds.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        sub.attachExt(CommonExts.PREDS, arr);
        sub.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.PREDS);
    }
}
