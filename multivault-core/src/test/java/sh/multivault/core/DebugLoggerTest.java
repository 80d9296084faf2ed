// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.EnumSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import sh.multivault.core.MultivaultDebug.Channel;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.multivault.debug");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        MultivaultDebug.setEnabled(false);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        MultivaultDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.logWallet("should not appear");
        DebugLogger.logTx("nor this");

        assertFalse(MultivaultDebug.isEnabled());
        assertTrue(appender.list.isEmpty());
    }

    @Test
    void channelsAreIndependent() {
        MultivaultDebug.set(Channel.WALLET, true);

        DebugLogger.logTx("tx line");
        DebugLogger.logRpc("rpc line");
        DebugLogger.logHsm("hsm line");
        DebugLogger.logWallet("wallet line");

        assertEquals(1, appender.list.size());
        final ILoggingEvent event = appender.list.get(0);
        assertEquals("wallet line", event.getFormattedMessage());
        assertEquals("sh.multivault.debug.wallet", event.getLoggerName());
    }

    @Test
    void disablingOneChannelKeepsTheOthers() {
        MultivaultDebug.setEnabled(true);
        MultivaultDebug.set(Channel.RPC, false);

        DebugLogger.logRpc("rpc line");
        DebugLogger.logHsm("hsm line");

        assertEquals(1, appender.list.size());
        assertEquals("sh.multivault.debug.hsm", appender.list.get(0).getLoggerName());
        assertTrue(MultivaultDebug.isEnabled(Channel.TX));
    }

    @Test
    void logsSanitizedMessages() {
        MultivaultDebug.set(Channel.HSM, true);

        DebugLogger.logHsm("payload %s", "{\"signature\":\"3044deadbeef\"}");

        assertEquals(1, appender.list.size());
        final String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains("***[REDACTED]***"));
        assertFalse(message.contains("3044deadbeef"));
    }

    @Test
    void parsesStartupProperty() {
        assertEquals(EnumSet.of(Channel.WALLET, Channel.TX), MultivaultDebug.parse(" wallet, TX ,bogus"));
        assertEquals(EnumSet.allOf(Channel.class), MultivaultDebug.parse("all"));
        assertTrue(MultivaultDebug.parse(null).isEmpty());
        assertTrue(MultivaultDebug.parse("").isEmpty());
    }

    @Test
    void formatsLifecycleLines() {
        final String line = LogFormatter.formatTxSign("8WpX3kLmNoPqRsTuVwQz7u", "02" + "ab".repeat(32), 1, 2);

        assertTrue(line.contains("[TX-SIGN]"));
        assertTrue(line.contains("8WpX3k...Qz7u"));
        assertTrue(line.contains("received=1/2"));
        assertEquals("short", LogFormatter.shorten("short"));
    }
}
