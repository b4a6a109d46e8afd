package io.github.eutro.ncs2nss.core.cfg;

import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * A natural loop of a subroutine, by local block index.
 */
public final class Loop {
    public final int header;
    /**
     * The blocks of the loop, including its header.
     */
    public final BitSet body;
    /**
     * The sources of the back edges to the header, in ascending order.
     */
    public final List<Integer> latches;
    /**
     * The block control reaches when the loop exits, or -1 if it never exits normally.
     */
    public final int follow;

    public Loop(int header, BitSet body, List<Integer> latches, int follow) {
        this.header = header;
        this.body = body;
        this.latches = Collections.unmodifiableList(latches);
        this.follow = follow;
    }

    public boolean contains(int local) {
        return local >= 0 && body.get(local);
    }

    /**
     * Get the single back edge source, if there is only one.
     *
     * @return The latch, or -1.
     */
    public int singleLatch() {
        return latches.size() == 1 ? latches.get(0) : -1;
    }
}
