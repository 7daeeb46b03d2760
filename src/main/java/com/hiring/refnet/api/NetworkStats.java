package com.hiring.refnet.api;

/**
 * Aggregate counts over the current state of a referral graph.
 *
 * @param totalUsers      distinct users seen in accepted referrals
 * @param totalReferrals  accepted referral edges
 * @param activeReferrers users whose total (direct + indirect) reach is non-zero
 */
public record NetworkStats(int totalUsers, int totalReferrals, int activeReferrers) {
}
