package com.hiring.refnet.api;

/**
 * Observability interface for mutations of a referral graph.
 *
 * Implementations are registered with the graph and are called synchronously on
 * the writer's thread, after the graph has decided whether to accept the
 * referral. Keep them lightweight; they run inside every insertion.
 */
public interface ReferralListener {

    /**
     * Called after a referral has been stored.
     *
     * @param referral      The accepted edge.
     * @param referralCount Number of edges in the graph after the insertion.
     */
    void onReferralAccepted(Referral referral, int referralCount);

    /**
     * Called when a referral is rejected. The graph is unchanged.
     *
     * @param referrer  The proposed referrer (may be null or empty).
     * @param candidate The proposed candidate (may be null or empty).
     * @param error     Why the referral was rejected.
     * @param message   Human-readable detail.
     */
    void onReferralRejected(String referrer, String candidate, ReferralError error, String message);
}
