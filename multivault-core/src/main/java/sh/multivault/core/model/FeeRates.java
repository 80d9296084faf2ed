// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

/**
 * Fee-rate tiers in sat/vB.
 */
public record FeeRates(long fastest, long normal, long economical) {

    public FeeRates {
        if (fastest <= 0 || normal <= 0 || economical <= 0) {
            throw new IllegalArgumentException("fee rates must be positive");
        }
    }

    /**
     * Derives the tiers from a node's smart-fee estimate: fastest is twice the estimate,
     * economical is 80% of it but never below 1 sat/vB.
     *
     * @param normalSatPerVbyte the estimate, already rounded up to whole sat/vB
     */
    public static FeeRates fromEstimate(final long normalSatPerVbyte) {
        final long normal = Math.max(1L, normalSatPerVbyte);
        return new FeeRates(normal * 2, normal, Math.max(1L, (long) Math.floor(normal * 0.8)));
    }
}
