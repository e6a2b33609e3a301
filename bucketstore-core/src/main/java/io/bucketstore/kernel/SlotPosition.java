package io.bucketstore.kernel;

/**
 * 64-bit composite slot position.
 * Layout: [sign bit, always 0][39 bits bucket sequence][24 bits slot].
 * <p>
 * Ordering follows bucket creation order, then ascending slot index.
 * {@link #END} sorts after every real position.
 */
public final class SlotPosition implements Comparable<SlotPosition> {
    private static final int SLOT_BITS = 24;
    private static final int SEQUENCE_BITS = 39;
    private static final long SLOT_MASK = (1L << SLOT_BITS) - 1;

    /**
     * Largest bucket sequence a position can carry. The top sequence is
     * reserved so that no real position packs to {@link #END}.
     */
    public static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 2;

    /**
     * Largest slot index a position can carry.
     */
    public static final int MAX_SLOT = (int) SLOT_MASK;

    /**
     * Past-the-end position.
     */
    public static final SlotPosition END = new SlotPosition(Long.MAX_VALUE);

    private final long value;

    public SlotPosition(long sequence, int slot) {
        this.value = pack(sequence, slot);
    }

    private SlotPosition(long value) {
        this.value = value;
    }

    /**
     * Pack a sequence and slot into an order key without allocating.
     *
     * @param sequence bucket creation sequence
     * @param slot     slot index within the bucket
     * @return the packed key
     */
    public static long pack(long sequence, int slot) {
        if (sequence < 0 || sequence > MAX_SEQUENCE) {
            throw new IllegalArgumentException("sequence out of range: " + sequence);
        }
        if (slot < 0 || (slot & ~SLOT_MASK) != 0) {
            throw new IllegalArgumentException("slot out of range: " + slot);
        }
        return (sequence << SLOT_BITS) | (slot & SLOT_MASK);
    }

    public long value() {
        return value;
    }

    public long sequence() {
        return value >>> SLOT_BITS;
    }

    public int slot() {
        return (int) (value & SLOT_MASK);
    }

    public boolean isEnd() {
        return value == Long.MAX_VALUE;
    }

    public static SlotPosition fromLong(long value) {
        return value == Long.MAX_VALUE ? END : new SlotPosition(value);
    }

    @Override
    public int compareTo(SlotPosition other) {
        return Long.compare(this.value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SlotPosition position = (SlotPosition) obj;
        return value == position.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        if (isEnd()) {
            return "SlotPosition{end}";
        }
        return "SlotPosition{sequence=" + sequence() + ", slot=" + slot() + "}";
    }
}
