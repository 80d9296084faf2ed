// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsSignatureMaterial() {
        final String out = LogSanitizer.sanitize("{\"signature\":\"3045022100ab\",\"status\":\"ok\"}");

        assertFalse(out.contains("3045022100ab"));
        assertTrue(out.contains("\"status\":\"ok\""));
    }

    @Test
    void redactsSignatureLists() {
        final String out = LogSanitizer.sanitize("{\"signatures\":[\"30aa\",\"30bb\"]}");

        assertEquals("{\"signatures\":[\"***[REDACTED]***\"]}", out);
    }

    @Test
    void redactsHsmLabelAndBasicAuth() {
        final String out = LogSanitizer.sanitize(
                "{\"label\":\"" + "ab".repeat(32) + "\",\"id\":\"alice\"} Authorization: Basic dXNlcjpwYXNz");

        assertFalse(out.contains("ab".repeat(32)));
        assertFalse(out.contains("dXNlcjpwYXNz"));
        assertTrue(out.contains("\"id\":\"alice\""));
    }

    @Test
    void truncatesLongPayloads() {
        final String out = LogSanitizer.sanitize("x".repeat(5_000));

        assertEquals(2_000, out.length());
        assertTrue(out.endsWith("...(truncated)"));
    }

    @Test
    void nullIsRenderedLiterally() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }
}
