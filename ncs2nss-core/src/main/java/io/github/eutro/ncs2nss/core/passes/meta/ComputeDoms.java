package io.github.eutro.ncs2nss.core.passes.meta;

import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;
import io.github.eutro.ncs2nss.core.util.DominatorTree;

/**
 * Computes {@link CommonExts#IDOM} for a subroutine, rooted at its entry.
 */
public class ComputeDoms implements InPlaceIRPass<Subroutine> {
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Subroutine sub) {
        sub.attachExt(CommonExts.IDOM, DominatorTree.compute(sub.successors(), 0));
        sub.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.DOMS);
    }
}
