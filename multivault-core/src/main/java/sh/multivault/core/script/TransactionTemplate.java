// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.script;

/**
 * Handle to a partially constructed transaction owned by a {@link ScriptEngine}.
 *
 * <p>
 * Templates are only meaningful to the engine that created or deserialized them; callers
 * treat them as opaque and round-trip them through {@link ScriptEngine#serialize} and
 * {@link ScriptEngine#deserialize}.
 */
public interface TransactionTemplate {

    int inputCount();

    int outputCount();

    /** Sum of the values of all inputs, in satoshis. */
    long totalInputValue();

    /** Value of the output at {@code index}, in satoshis. */
    long outputValue(int index);
}
