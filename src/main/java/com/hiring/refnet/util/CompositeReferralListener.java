package com.hiring.refnet.util;

import com.hiring.refnet.api.Referral;
import com.hiring.refnet.api.ReferralError;
import com.hiring.refnet.api.ReferralListener;

import java.util.Arrays;

/**
 * Fans {@link ReferralListener} callbacks out to several listeners, in
 * registration order.
 */
public class CompositeReferralListener implements ReferralListener {
    private ReferralListener[] listeners = new ReferralListener[0];

    public CompositeReferralListener add(ReferralListener listener) {
        ReferralListener[] old = listeners;
        ReferralListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onReferralAccepted(Referral referral, int referralCount) {
        for (ReferralListener l : listeners)
            l.onReferralAccepted(referral, referralCount);
    }

    @Override
    public void onReferralRejected(String referrer, String candidate, ReferralError error, String message) {
        for (ReferralListener l : listeners)
            l.onReferralRejected(referrer, candidate, error, message);
    }
}
