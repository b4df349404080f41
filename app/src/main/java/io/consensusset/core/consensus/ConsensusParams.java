package io.consensusset.core.consensus;

import java.math.BigInteger;

/**
 * Consensus constants.
 *
 * @param maturityDelay         blocks a payout waits in the maturity queue
 * @param initialCoinbase       block subsidy at height 0 (minor units)
 * @param minimumCoinbase       subsidy floor; subsidy drops by one unit per block until it is reached
 * @param siafundCount          total number of siafunds, fixed at genesis
 * @param siafundTaxNumerator   contract tax numerator (39 for 3.9%)
 * @param siafundTaxDenominator contract tax denominator
 * @param futureThresholdMillis how far ahead of the local clock a block timestamp may be
 */
public record ConsensusParams(long maturityDelay,
                              long initialCoinbase,
                              long minimumCoinbase,
                              long siafundCount,
                              long siafundTaxNumerator,
                              long siafundTaxDenominator,
                              long futureThresholdMillis) {

    public ConsensusParams {
        if (maturityDelay < 1) throw new IllegalArgumentException("maturityDelay must be >= 1");
        if (minimumCoinbase < 0 || initialCoinbase < minimumCoinbase) {
            throw new IllegalArgumentException("coinbase schedule must satisfy 0 <= minimum <= initial");
        }
        if (siafundCount < 1) throw new IllegalArgumentException("siafundCount must be >= 1");
        if (siafundTaxNumerator < 0 || siafundTaxDenominator < 1 || siafundTaxNumerator > siafundTaxDenominator) {
            throw new IllegalArgumentException("siafund tax must be a fraction in [0, 1]");
        }
        if (futureThresholdMillis < 0) throw new IllegalArgumentException("futureThresholdMillis must be >= 0");
    }

    public static ConsensusParams defaults() {
        return new ConsensusParams(
                144L,           // one day of blocks
                300_000L,
                30_000L,
                10_000L,
                39L, 1_000L,    // 3.9% contract tax
                3 * 60 * 60 * 1000L
        );
    }

    /** Subsidy a miner may claim at {@code height}, before fees. */
    public BigInteger blockSubsidy(long height) {
        long subsidy = initialCoinbase - height;
        return BigInteger.valueOf(Math.max(subsidy, minimumCoinbase));
    }

    /** Portion of a contract payout that goes into the siafund pool. */
    public BigInteger siafundTax(BigInteger payout) {
        return payout.multiply(BigInteger.valueOf(siafundTaxNumerator))
                .divide(BigInteger.valueOf(siafundTaxDenominator));
    }

    /** Claim owed to {@code siafunds} shares for pool growth from {@code claimStart} to {@code pool}. */
    public BigInteger siafundClaim(BigInteger pool, BigInteger claimStart, BigInteger siafunds) {
        return pool.subtract(claimStart).multiply(siafunds).divide(BigInteger.valueOf(siafundCount));
    }
}
