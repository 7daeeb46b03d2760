package com.hiring.refnet.sim;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Cost summary for hitting a hiring target with the minimum bonus.
 *
 * <p>
 * When the target is not achievable {@code minBonus}, {@code totalCost} and
 * {@code costPerHire} are null and left out of the JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BonusAnalysis(boolean achievable, Integer minBonus, Long totalCost, Integer costPerHire,
        int days, int targetHires) {

    static BonusAnalysis of(int days, int targetHires, Integer minBonus) {
        if (minBonus == null)
            return new BonusAnalysis(false, null, null, null, days, targetHires);
        return new BonusAnalysis(true, minBonus, (long) minBonus * targetHires, minBonus, days, targetHires);
    }
}
