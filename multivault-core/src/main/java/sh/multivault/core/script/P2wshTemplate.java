// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.script.Script;
import sh.multivault.primitives.Hex;

/**
 * Native SegWit multisig template: an unsigned bitcoinj transaction plus the witness script,
 * the spent values and the partial signatures collected per input.
 */
final class P2wshTemplate implements TransactionTemplate {

    private final int threshold;
    private final Script witnessScript;
    private final List<String> publicKeys;
    private final Transaction tx;
    private final List<Long> inputValues = new ArrayList<>();
    private final List<Map<String, byte[]>> partialSignatures = new ArrayList<>();

    P2wshTemplate(
            final int threshold, final Script witnessScript, final Transaction tx) {
        this.threshold = threshold;
        this.witnessScript = witnessScript;
        this.tx = tx;
        final List<String> keys = new ArrayList<>();
        for (ECKey key : witnessScript.getPubKeys()) {
            keys.add(Hex.encodeNoPrefix(key.getPubKey()));
        }
        this.publicKeys = List.copyOf(keys);
    }

    int threshold() {
        return threshold;
    }

    Script witnessScript() {
        return witnessScript;
    }

    /** Policy keys in witness-script order. */
    List<String> publicKeys() {
        return publicKeys;
    }

    Transaction tx() {
        return tx;
    }

    long inputValue(final int index) {
        return inputValues.get(index);
    }

    void trackInput(final long value) {
        inputValues.add(value);
        partialSignatures.add(new LinkedHashMap<>());
    }

    Map<String, byte[]> signatures(final int index) {
        return partialSignatures.get(index);
    }

    void checkInputIndex(final int index) {
        if (index < 0 || index >= inputValues.size()) {
            throw new IndexOutOfBoundsException(
                    "input index " + index + " out of range, template has " + inputValues.size() + " inputs");
        }
    }

    @Override
    public int inputCount() {
        return inputValues.size();
    }

    @Override
    public int outputCount() {
        return tx.getOutputs().size();
    }

    @Override
    public long totalInputValue() {
        long total = 0;
        for (long value : inputValues) {
            total += value;
        }
        return total;
    }

    @Override
    public long outputValue(final int index) {
        return tx.getOutput(index).getValue().value;
    }
}
