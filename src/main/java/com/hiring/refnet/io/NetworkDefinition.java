package com.hiring.refnet.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * POJO representation of a referral network file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NetworkDefinition {
    private NetworkInfo network;

    /** Meta-information plus the referrals, in insertion order. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NetworkInfo {
        private String name, description;
        private List<ReferralDef> referrals;
    }

    /** A single referral. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ReferralDef {
        private String referrer, candidate;
    }
}
