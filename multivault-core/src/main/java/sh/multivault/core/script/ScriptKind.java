// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.script;

/**
 * Output script types a recipient address can resolve to.
 */
public enum ScriptKind {
    P2PKH,
    P2SH,
    P2WPKH,
    P2WSH,
    P2TR
}
