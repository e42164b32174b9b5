package io.postrelay.model;

/**
 * Block height on the counterparty chain, split by revision. A zero height disables the height
 * based timeout of a packet.
 */
public record Height(long revisionNumber, long revisionHeight) implements Comparable<Height> {
    public static final Height ZERO = new Height(0L, 0L);

    public boolean isZero() {
        return revisionNumber == 0L && revisionHeight == 0L;
    }

    public Height increment(long blocks) {
        return new Height(revisionNumber, revisionHeight + blocks);
    }

    @Override
    public int compareTo(Height other) {
        int byRevision = Long.compareUnsigned(revisionNumber, other.revisionNumber);
        if (byRevision != 0) {
            return byRevision;
        }
        return Long.compareUnsigned(revisionHeight, other.revisionHeight);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(revisionNumber) + "-" + Long.toUnsignedString(revisionHeight);
    }
}
