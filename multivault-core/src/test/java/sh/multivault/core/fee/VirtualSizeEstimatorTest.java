// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.fee;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import sh.multivault.core.script.ScriptKind;

class VirtualSizeEstimatorTest {

    @Test
    void twoOfThreeToWitnessKeyHash() {
        assertEquals(190L, VirtualSizeEstimator.estimate(
                MultisigInputKind.P2WSH, 2, 3, 1, List.of(ScriptKind.P2WPKH)));
    }

    @Test
    void twoOfThreeToWitnessScriptHash() {
        assertEquals(202L, VirtualSizeEstimator.estimate(
                MultisigInputKind.P2WSH, 2, 3, 1, List.of(ScriptKind.P2WSH)));
    }

    @Test
    void growsWithInputsAndSigners() {
        final long one = VirtualSizeEstimator.estimate(MultisigInputKind.P2WSH, 2, 3, 1, List.of(ScriptKind.P2PKH));
        final long two = VirtualSizeEstimator.estimate(MultisigInputKind.P2WSH, 2, 3, 2, List.of(ScriptKind.P2PKH));
        final long wider = VirtualSizeEstimator.estimate(MultisigInputKind.P2WSH, 3, 5, 1, List.of(ScriptKind.P2PKH));

        assertTrue(two > one);
        assertTrue(wider > one);
    }

    @Test
    void legacyInputsCostMoreThanWitnessInputs() {
        final long legacy = VirtualSizeEstimator.estimate(MultisigInputKind.P2SH, 2, 3, 1, List.of(ScriptKind.P2SH));
        final long nested = VirtualSizeEstimator.estimate(
                MultisigInputKind.P2SH_P2WSH, 2, 3, 1, List.of(ScriptKind.P2SH));
        final long nativeSegwit = VirtualSizeEstimator.estimate(
                MultisigInputKind.P2WSH, 2, 3, 1, List.of(ScriptKind.P2SH));

        assertTrue(legacy > nested);
        assertTrue(nested > nativeSegwit);
    }

    @Test
    void varIntBoundaries() {
        assertEquals(1, VirtualSizeEstimator.varIntLength(0xfc));
        assertEquals(3, VirtualSizeEstimator.varIntLength(0xfd));
        assertEquals(5, VirtualSizeEstimator.varIntLength(0x10000));
        assertEquals(9, VirtualSizeEstimator.varIntLength(0x100000000L));
    }

    @Test
    void feeRoundsUp() {
        assertEquals(1_900L, VirtualSizeEstimator.fee(190L, 10.0));
        assertEquals(285L, VirtualSizeEstimator.fee(190L, 1.5));
        assertEquals(191L, VirtualSizeEstimator.fee(190L, 1.001));
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> VirtualSizeEstimator.fee(190L, 0));
        assertThrows(IllegalArgumentException.class, () -> VirtualSizeEstimator.fee(190L, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> VirtualSizeEstimator.estimate(
                MultisigInputKind.P2WSH, 3, 2, 1, List.of()));
    }
}
