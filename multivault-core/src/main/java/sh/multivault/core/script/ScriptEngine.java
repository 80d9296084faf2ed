// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.script;

import java.util.List;
import sh.multivault.core.error.InvalidSignatureException;
import sh.multivault.core.error.ValidationException;
import sh.multivault.core.model.Utxo;

/**
 * Script, address and transaction-template capability consumed by the wallet registry and the
 * transaction lifecycle engine.
 *
 * <p>
 * Implementations are injected, so the underlying Bitcoin library can be swapped without
 * touching lifecycle code. Every operation is deterministic in its inputs.
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe; templates are not and
 * must be confined to one call.
 *
 * @see BitcoinjScriptEngine
 * @since 0.1.0
 */
public interface ScriptEngine {

    /**
     * Derives the funding address and spending script for an {@code m}-of-{@code n} policy
     * over the given keys, in the given order.
     *
     * @throws ValidationException if a key is not a valid compressed public key
     */
    MultisigScript deriveAddress(int m, List<String> publicKeys);

    /**
     * Starts an empty template spending from the policy's script.
     */
    TransactionTemplate newTemplate(int m, List<String> publicKeys);

    /**
     * Adds a multisig input spending {@code utxo}.
     */
    void addInput(TransactionTemplate template, Utxo utxo);

    /**
     * Adds an output paying {@code amount} satoshis to {@code address}.
     *
     * @throws ValidationException if the address is malformed or belongs to another network
     */
    void addOutput(TransactionTemplate template, String address, long amount);

    /**
     * The exact 32 bytes a signer must sign for input {@code inputIndex}.
     */
    byte[] unsignedDigest(TransactionTemplate template, int inputIndex);

    /**
     * Verifies and records a signature for one input.
     *
     * @throws InvalidSignatureException if the key is not part of the policy, the signature
     *                                   cannot be decoded, or it does not verify against the
     *                                   input's digest
     */
    void applySignature(TransactionTemplate template, int inputIndex, String publicKey, byte[] signature);

    /**
     * Assembles the fully signed raw transaction.
     *
     * @throws IllegalStateException if any input lacks the threshold of signatures
     */
    byte[] finalizeTemplate(TransactionTemplate template);

    byte[] serialize(TransactionTemplate template);

    TransactionTemplate deserialize(byte[] serialized);

    /**
     * Script kind of a recipient address, used for fee estimation.
     *
     * @throws ValidationException if the address is malformed, belongs to another network or
     *                             is of an unsupported kind
     */
    ScriptKind outputKind(String address);
}
