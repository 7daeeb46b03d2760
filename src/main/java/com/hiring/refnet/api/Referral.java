package com.hiring.refnet.api;

/** An accepted referral edge: {@code referrer} referred {@code candidate}. */
public record Referral(String referrer, String candidate) {
}
