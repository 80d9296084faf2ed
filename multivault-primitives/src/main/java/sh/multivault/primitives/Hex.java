// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding for keys, scripts, signatures and raw transactions.
 *
 * <p>
 * Bitcoin tooling exchanges hex without a prefix, so {@link #encodeNoPrefix(byte[])} is the
 * usual encoder. Decoding accepts an optional {@code 0x} prefix and either letter case.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final int len = hexLength / 2;
        final byte[] result = new byte[len];

        for (int i = 0; i < len; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }

        return result;
    }

    /**
     * Encodes bytes as lowercase hex with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} if the input is a non-empty, even-length hex string
     * (optionally {@code 0x} prefixed).
     */
    public static boolean isHex(final String hexString) {
        if (hexString == null) {
            return false;
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;
        if (hexLength == 0 || (hexLength & 1) == 1) {
            return false;
        }
        for (int i = start; i < hexString.length(); i++) {
            final char c = hexString.charAt(i);
            if (c >= 128 || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Strips a leading {@code 0x} or {@code 0X} if present.
     *
     * @throws IllegalArgumentException if the input is null
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= 128 || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character '" + c + "' in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
