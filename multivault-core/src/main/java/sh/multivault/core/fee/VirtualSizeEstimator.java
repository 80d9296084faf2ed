// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.fee;

import java.util.List;
import java.util.Objects;
import sh.multivault.core.script.ScriptKind;

/**
 * Conservative virtual-size estimate for a multisig spend.
 *
 * <p>
 * Every estimate reserves a change output slot of the wallet's own script kind, whether or
 * not change is eventually created, and assumes 73-byte (maximum length) DER signatures. The
 * estimate therefore never falls below the finalized transaction's real size.
 *
 * <pre>{@code
 * long vsize = VirtualSizeEstimator.estimate(MultisigInputKind.P2WSH, 2, 3, 1, List.of(ScriptKind.P2WPKH));
 * long fee = VirtualSizeEstimator.fee(vsize, 10.0); // 1900 sat
 * }</pre>
 *
 * @since 0.1.0
 */
public final class VirtualSizeEstimator {

    /** Version and locktime, at full weight. */
    private static final long BASE_WEIGHT = 8 * 4;

    /** Segwit marker and flag bytes. */
    private static final long WITNESS_FLAG_WEIGHT = 2;

    private VirtualSizeEstimator() {
    }

    /**
     * Estimates the virtual size in vbytes.
     *
     * @param inputKind      wrapping of the wallet's multisig inputs
     * @param m              signature threshold
     * @param n              number of keys in the redeem script
     * @param inputCount     number of multisig inputs
     * @param recipientKinds script kinds of the non-change outputs
     * @return estimated virtual size, rounded up
     */
    public static long estimate(
            final MultisigInputKind inputKind,
            final int m,
            final int n,
            final int inputCount,
            final List<ScriptKind> recipientKinds) {
        Objects.requireNonNull(inputKind, "inputKind");
        Objects.requireNonNull(recipientKinds, "recipientKinds");
        if (m <= 0 || n < m) {
            throw new IllegalArgumentException("invalid policy " + m + "-of-" + n);
        }
        if (inputCount < 0) {
            throw new IllegalArgumentException("inputCount must be non-negative: " + inputCount);
        }

        long weight = inputKind.inputWeight(m, n) * inputCount;

        for (ScriptKind kind : recipientKinds) {
            weight += outputWeight(kind);
        }
        weight += outputWeight(inputKind.changeKind());
        final int outputCount = recipientKinds.size() + 1;

        if (inputKind.hasWitness()) {
            weight += WITNESS_FLAG_WEIGHT;
        }
        weight += BASE_WEIGHT;
        weight += varIntLength(inputCount) * 4L;
        weight += varIntLength(outputCount) * 4L;

        return (weight + 3) / 4;
    }

    /**
     * Fee for a virtual size at a sat/vB rate, rounded up to a whole satoshi.
     */
    public static long fee(final long virtualSize, final double feeRate) {
        if (feeRate <= 0 || Double.isNaN(feeRate) || Double.isInfinite(feeRate)) {
            throw new IllegalArgumentException("feeRate must be a positive number: " + feeRate);
        }
        return (long) Math.ceil(virtualSize * feeRate);
    }

    static long outputWeight(final ScriptKind kind) {
        return switch (kind) {
            case P2SH -> 32 * 4;
            case P2PKH -> 34 * 4;
            case P2WPKH -> 31 * 4;
            case P2WSH, P2TR -> 43 * 4;
        };
    }

    static int varIntLength(final long value) {
        if (value < 0xfd) {
            return 1;
        }
        if (value <= 0xffff) {
            return 3;
        }
        if (value <= 0xffffffffL) {
            return 5;
        }
        return 9;
    }
}
