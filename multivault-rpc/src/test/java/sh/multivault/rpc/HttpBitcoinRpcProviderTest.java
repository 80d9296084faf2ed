// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import sh.multivault.core.MultivaultDebug;

class HttpBitcoinRpcProviderTest {

    private HttpServer server;
    private URI baseUri;
    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("sh.multivault.debug");

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        MultivaultDebug.setEnabled(false);
        debugLogger.detachAndStopAllAppenders();
        server.stop(0);
    }

    @Test
    void sendsJsonRpc10WithBasicAuth() {
        final AtomicReference<String> body = new AtomicReference<>();
        final AtomicReference<String> auth = new AtomicReference<>();
        server.createContext("/", exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            auth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, """
                    {"result":{"blocks":812345,"difficulty":1.5},"error":null,"id":"1"}
                    """);
        });

        final HttpBitcoinRpcProvider provider = HttpBitcoinRpcProvider.builder(baseUri.toString())
                .basicAuth("user", "pass")
                .build();
        final JsonRpcResponse response = provider.send("getblockchaininfo", List.of());

        final Map<String, Object> result = response.resultAsMap();
        assertEquals(812345, ((Number) result.get("blocks")).intValue());
        assertEquals(new BigDecimal("1.5"), result.get("difficulty"));
        assertTrue(body.get().contains("\"jsonrpc\":\"1.0\""));
        assertTrue(body.get().contains("\"method\":\"getblockchaininfo\""));
        assertEquals("Basic dXNlcjpwYXNz", auth.get());
    }

    @Test
    void nodeErrorBodyOnHttp500CarriesNodeCode() {
        server.createContext("/", exchange -> respond(exchange, 500, """
                {"result":null,"error":{"code":-26,"message":"non-mandatory-script-verify-flag"},"id":"1"}
                """));

        final HttpBitcoinRpcProvider provider = HttpBitcoinRpcProvider.builder(baseUri.toString()).build();
        final RpcException ex = assertThrows(RpcException.class,
                () -> provider.send("sendrawtransaction", List.of("00")));

        assertEquals(-26, ex.code());
        assertTrue(ex.isRejected());
        assertEquals(1L, ex.requestId());
        assertTrue(ex.getMessage().contains("non-mandatory-script-verify-flag"));
    }

    @Test
    void plainHttpFailureUsesTransportCode() {
        server.createContext("/", exchange -> respond(exchange, 401, ""));

        final HttpBitcoinRpcProvider provider = HttpBitcoinRpcProvider.builder(baseUri.toString()).build();
        final RpcException ex = assertThrows(RpcException.class, () -> provider.send("getblockcount", List.of()));

        assertEquals(-32001, ex.code());
    }

    @Test
    void unparseableSuccessBodyIsReported() {
        server.createContext("/", exchange -> respond(exchange, 200, "not json"));

        final HttpBitcoinRpcProvider provider = HttpBitcoinRpcProvider.builder(baseUri.toString()).build();
        final RpcException ex = assertThrows(RpcException.class, () -> provider.send("getblockcount", List.of()));

        assertEquals(-32700, ex.code());
        assertEquals("not json", ex.data());
    }

    @Test
    void logsRpcErrorsWhenEnabled() {
        server.createContext("/", exchange -> respond(exchange, 500, "oops"));

        MultivaultDebug.set(MultivaultDebug.Channel.RPC, true);
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);

        final HttpBitcoinRpcProvider provider = HttpBitcoinRpcProvider.builder(baseUri.toString()).build();
        assertThrows(RpcException.class, () -> provider.send("getblockcount", List.of()));

        assertTrue(appender.list.stream()
                .anyMatch(e -> e.getFormattedMessage().contains("[RPC-ERROR]")
                        && e.getFormattedMessage().contains("getblockcount")));
    }

    private void respond(final HttpExchange exchange, final int statusCode, final String body) throws IOException {
        exchange.getRequestBody().readAllBytes();
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
