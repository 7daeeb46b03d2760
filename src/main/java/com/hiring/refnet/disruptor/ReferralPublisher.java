package com.hiring.refnet.disruptor;

import com.hiring.refnet.api.Referral;
import com.hiring.refnet.api.Result;
import com.hiring.refnet.engine.ReferralGraph;
import com.lmax.disruptor.EventHandler;

/**
 * Disruptor EventHandler that applies {@link ReferralEvent}s to a graph.
 *
 * <p>
 * This is the bridge between the ring buffer and {@link ReferralGraph}. It runs
 * on the single consumer thread, which makes that thread the only writer of the
 * graph: the graph's check-then-insert sequence needs no lock.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Producers (any thread) claim a slot and write a referral into it.</li>
 * <li>The Disruptor sequences the slots.</li>
 * <li>This handler calls {@link ReferralGraph#addReferral} for each event in
 * sequence order. Rejections are counted and reported through the graph's
 * listener; they never stop the consumer.</li>
 * <li>At the end of each batch the optional {@link PostBatchCallback} fires.</li>
 * </ol>
 */
public final class ReferralPublisher implements EventHandler<ReferralEvent> {
    private final ReferralGraph graph;

    private long accepted;
    private long rejected;
    private long batchAccepted;
    private long batchRejected;

    private volatile PostBatchCallback postBatch;
    private volatile long processedSequence = -1L;

    public ReferralPublisher(ReferralGraph graph) {
        this.graph = graph;
    }

    public void setPostBatchCallback(PostBatchCallback cb) {
        this.postBatch = cb;
    }

    @Override
    public void onEvent(ReferralEvent event, long sequence, boolean endOfBatch) {
        try {
            Result<Referral> result = graph.addReferral(event.referrer(), event.candidate());
            if (result.isOk()) {
                accepted++;
                batchAccepted++;
            } else {
                rejected++;
                batchRejected++;
            }
            event.clear();

            if (endOfBatch) {
                PostBatchCallback cb = postBatch;
                if (cb != null)
                    cb.onBatch(sequence, batchAccepted, batchRejected);
                batchAccepted = 0;
                batchRejected = 0;
            }
        } finally {
            processedSequence = sequence;
        }
    }

    /**
     * Sequence of the last event this handler finished with, whether or not it
     * threw; -1 before the first. Counts read after observing a value are at
     * least as recent as that event.
     */
    public long processedSequence() {
        return processedSequence;
    }

    /** Total accepted so far. Exact from other threads only after shutdown. */
    public long acceptedCount() {
        return accepted;
    }

    /** Total rejected so far. Exact from other threads only after shutdown. */
    public long rejectedCount() {
        return rejected;
    }

    /**
     * Callback invoked on the consumer thread after each batch.
     */
    @FunctionalInterface
    public interface PostBatchCallback {
        /**
         * @param sequence Sequence of the last event in the batch.
         * @param accepted Referrals accepted in this batch.
         * @param rejected Referrals rejected in this batch.
         */
        void onBatch(long sequence, long accepted, long rejected);
    }
}
