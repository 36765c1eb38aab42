package dev.newsroom.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-ordered 64-bit id generator.
 * <pre>
 * | 1 bit unused | 41 bits millis since 2025-01-01 | 10 bits node | 12 bits sequence |
 * </pre>
 * Ids from one node are strictly increasing, which keeps newer tasks and audit
 * rows sorted after older ones even when their timestamps tie.
 */
public final class SnowflakeId {

    private static final long EPOCH = 1735689600000L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    public static final long MAX_NODE_ID = (1L << NODE_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_BITS;

    /** Backwards clock drift tolerated before refusing to issue ids. */
    private static final long MAX_DRIFT_MS = 5;

    private final long nodeId;
    private final AtomicLong lastState = new AtomicLong(0);

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException("Node id must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * Lock-free: state is (timestamp, sequence) packed into one long and advanced by CAS.
     */
    public long nextId() {
        while (true) {
            long now = currentMillis();
            long oldState = lastState.get();
            long lastMillis = oldState >>> SEQUENCE_BITS;
            long lastSequence = oldState & MAX_SEQUENCE;

            long millis;
            long sequence;
            if (now > lastMillis) {
                millis = now;
                sequence = 0;
            } else if (lastMillis - now <= MAX_DRIFT_MS) {
                sequence = (lastSequence + 1) & MAX_SEQUENCE;
                millis = sequence == 0 ? lastMillis + 1 : lastMillis;
            } else {
                throw new IllegalStateException(
                        "Clock moved backwards by " + (lastMillis - now) + "ms, refusing to generate id");
            }

            long newState = (millis << SEQUENCE_BITS) | sequence;
            if (lastState.compareAndSet(oldState, newState)) {
                return (millis << TIMESTAMP_SHIFT) | (nodeId << NODE_SHIFT) | sequence;
            }
        }
    }

    public long nodeId() {
        return nodeId;
    }

    public static Instant createdAt(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + EPOCH);
    }

    public static int nodeOf(long id) {
        return (int) ((id >>> NODE_SHIFT) & MAX_NODE_ID);
    }

    private long currentMillis() {
        return System.currentTimeMillis() - EPOCH;
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
