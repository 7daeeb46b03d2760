package com.hiring.refnet.api;

/**
 * A user paired with an analytic score (total reach, incremental coverage or
 * centrality, depending on the ranking that produced it).
 */
public record RankedUser(String user, int score) {
}
