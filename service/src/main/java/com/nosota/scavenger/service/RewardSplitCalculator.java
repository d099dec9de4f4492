package com.nosota.scavenger.service;

import com.nosota.scavenger.error.RewardOverflowException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reward arithmetic of settlement.
 *
 * <p>{@code totalReward = rewardRate * floor(weightGrams / 1000)}. Collector and owner
 * shares are whole-token percentages of the total, rounded down. All multiplication is
 * overflow-checked.
 *
 * <p>Percentages are read once at startup and must each be within 0..100 with a sum
 * of at most 100, otherwise the application context fails to start.
 */
@Component
@Getter
@Slf4j
public class RewardSplitCalculator {

    private static final long GRAMS_PER_KILOGRAM = 1000L;
    private static final long PERCENT = 100L;

    private final long collectorPercentage;
    private final long ownerPercentage;

    public RewardSplitCalculator(@Value("${settlement.collector-percentage}") long collectorPercentage,
                                 @Value("${settlement.owner-percentage}") long ownerPercentage) {
        if (collectorPercentage < 0 || collectorPercentage > PERCENT) {
            throw new IllegalArgumentException("Collector percentage must be within 0..100, got " + collectorPercentage);
        }
        if (ownerPercentage < 0 || ownerPercentage > PERCENT) {
            throw new IllegalArgumentException("Owner percentage must be within 0..100, got " + ownerPercentage);
        }
        if (collectorPercentage + ownerPercentage > PERCENT) {
            throw new IllegalArgumentException(String.format(
                    "Collector and owner percentages must not exceed 100 together, got %d + %d",
                    collectorPercentage, ownerPercentage));
        }
        this.collectorPercentage = collectorPercentage;
        this.ownerPercentage = ownerPercentage;
        log.info("Reward split: collector={}%, owner={}%", collectorPercentage, ownerPercentage);
    }

    /**
     * Reward for a unit. Partial kilograms earn nothing.
     *
     * @param rewardRate  Tokens per whole kilogram
     * @param weightGrams Weight of the unit in grams
     * @return Total reward in tokens
     * @throws RewardOverflowException if the product overflows
     */
    public long totalReward(long rewardRate, long weightGrams) throws RewardOverflowException {
        long kilograms = weightGrams / GRAMS_PER_KILOGRAM;
        return multiply(rewardRate, kilograms, "reward");
    }

    public long collectorShare(long totalReward) throws RewardOverflowException {
        return multiply(totalReward, collectorPercentage, "collector share") / PERCENT;
    }

    public long ownerShare(long totalReward) throws RewardOverflowException {
        return multiply(totalReward, ownerPercentage, "owner share") / PERCENT;
    }

    private static long multiply(long a, long b, String what) throws RewardOverflowException {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new RewardOverflowException(String.format("Overflow computing %s: %d * %d", what, a, b), e);
        }
    }
}
