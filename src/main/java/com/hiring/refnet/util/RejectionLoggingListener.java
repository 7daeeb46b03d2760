package com.hiring.refnet.util;

import com.hiring.refnet.api.Referral;
import com.hiring.refnet.api.ReferralError;
import com.hiring.refnet.api.ReferralListener;

import java.util.EnumMap;
import java.util.Map;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Counts rejected referrals per {@link ReferralError} and logs them at WARN,
 * throttled through {@link ErrorRateLimiter}.
 */
public final class RejectionLoggingListener implements ReferralListener {
    private static final Logger log = LogManager.getLogger(RejectionLoggingListener.class);

    private final ErrorRateLimiter limiter;
    private final Map<ReferralError, Long> rejections = new EnumMap<>(ReferralError.class);
    private long accepted;

    public RejectionLoggingListener() {
        this(1000);
    }

    public RejectionLoggingListener(long minIntervalMillis) {
        this.limiter = new ErrorRateLimiter(log, Level.WARN, minIntervalMillis);
    }

    @Override
    public void onReferralAccepted(Referral referral, int referralCount) {
        accepted++;
    }

    @Override
    public void onReferralRejected(String referrer, String candidate, ReferralError error, String message) {
        rejections.merge(error, 1L, Long::sum);
        limiter.log(String.format("Rejected referral %s -> %s [%s]: %s", referrer, candidate, error, message), null);
    }

    public long acceptedCount() {
        return accepted;
    }

    public long rejectedCount(ReferralError error) {
        return rejections.getOrDefault(error, 0L);
    }

    public long rejectedCount() {
        long total = 0;
        for (long n : rejections.values())
            total += n;
        return total;
    }
}
