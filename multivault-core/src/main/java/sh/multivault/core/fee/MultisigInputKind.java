// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.fee;

import sh.multivault.core.script.ScriptKind;

/**
 * How a multisig input is wrapped, with its fixed weight overhead.
 *
 * <p>
 * Per-input weight is {@code overheadWeight + (73 * m + 34 * n) * scriptMultiplier}: 73 bytes
 * per signature slot and 34 bytes per public key in the redeem script, counted at full weight
 * for legacy P2SH and at witness weight otherwise.
 */
public enum MultisigInputKind {
    P2SH(49 * 4, 4, false, ScriptKind.P2SH),
    P2WSH(8 + 41 * 4, 1, true, ScriptKind.P2WSH),
    P2SH_P2WSH(8 + 76 * 4, 1, true, ScriptKind.P2SH);

    private final int overheadWeight;
    private final int scriptMultiplier;
    private final boolean witness;
    private final ScriptKind changeKind;

    MultisigInputKind(
            final int overheadWeight, final int scriptMultiplier, final boolean witness, final ScriptKind changeKind) {
        this.overheadWeight = overheadWeight;
        this.scriptMultiplier = scriptMultiplier;
        this.witness = witness;
        this.changeKind = changeKind;
    }

    public long inputWeight(final int m, final int n) {
        return overheadWeight + (73L * m + 34L * n) * scriptMultiplier;
    }

    public boolean hasWitness() {
        return witness;
    }

    /** Script kind of the change output paying back to a wallet of this kind. */
    public ScriptKind changeKind() {
        return changeKind;
    }
}
