package com.hiring.refnet.disruptor;

/**
 * A mutable holder for a proposed referral, used within the LMAX Disruptor
 * RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated when the ring buffer is
 * built and reused for its whole lifetime.
 */
public final class ReferralEvent {
    private String referrer;
    private String candidate;
    private long sequenceId;

    public void set(String referrer, String candidate, long seqId) {
        this.referrer = referrer;
        this.candidate = candidate;
        this.sequenceId = seqId;
    }

    public String referrer() {
        return referrer;
    }

    public String candidate() {
        return candidate;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        referrer = null;
        candidate = null;
        sequenceId = 0;
    }
}
