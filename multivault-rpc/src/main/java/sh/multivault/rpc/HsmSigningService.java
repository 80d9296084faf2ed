// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.multivault.core.DebugLogger;
import sh.multivault.core.error.ValidationException;
import sh.multivault.core.network.SigningCredential;
import sh.multivault.core.network.SigningService;
import sh.multivault.primitives.Hex;

/**
 * {@link SigningService} backed by a remote HSM vault.
 *
 * <p>
 * Endpoints, both {@code POST} with a JSON body:
 * <ul>
 * <li>{@code /sign} with {@code {message, label, id}}, answering {@code {signature}} (hex)</li>
 * <li>{@code /publickey} with {@code {label, id}}, answering {@code {publicKey}} (hex)</li>
 * </ul>
 * The label is a 64-character hex passphrase hash selecting the key; the id is the user id.
 */
public final class HsmSigningService implements SigningService {

    private static final Logger LOG = LoggerFactory.getLogger(HsmSigningService.class);

    private static final Pattern USER_ID = Pattern.compile("^[a-zA-Z0-9._-]{1,100}$");
    private static final Pattern LABEL = Pattern.compile("^[a-fA-F0-9]{64}$");

    private final HsmConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public HsmSigningService(final HsmConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = HttpClient.newBuilder().connectTimeout(config.timeout()).build();
    }

    @Override
    public byte[] sign(final byte[] hash, final SigningCredential credential) {
        validate(credential);
        if (hash == null || hash.length != 32) {
            throw new ValidationException("Signing input must be a 32-byte digest");
        }
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", Hex.encodeNoPrefix(hash));
        body.put("label", credential.label());
        body.put("id", credential.userId());
        final String signature = field(post("/sign", body), "signature");
        if (!Hex.isHex(signature)) {
            throw new HsmException("HSM returned a non-hex signature", 200);
        }
        return Hex.decode(signature);
    }

    @Override
    public String publicKey(final SigningCredential credential) {
        validate(credential);
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("label", credential.label());
        body.put("id", credential.userId());
        return Hex.cleanPrefix(field(post("/publickey", body), "publicKey")).toLowerCase();
    }

    private JsonNode post(final String path, final Map<String, Object> body) {
        final String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new HsmException("Unable to serialize HSM request for " + path, e);
        }
        DebugLogger.logHsm("[HSM] POST %s %s", path, payload);
        final HttpRequest request = HttpRequest.newBuilder(config.endpoint(path))
                .header("Content-Type", "application/json")
                .timeout(config.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new HsmException("HSM request " + path + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HsmException("HSM request " + path + " interrupted", e);
        } catch (IOException e) {
            throw new HsmException("HSM connection failed for " + path, e);
        }
        if (response.statusCode() != 200) {
            LOG.warn("HSM {} answered HTTP {}", path, response.statusCode());
            throw new HsmException("HSM service error on " + path + ": HTTP " + response.statusCode(),
                    response.statusCode());
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new HsmException("Unable to parse HSM response for " + path, e);
        }
    }

    private static String field(final JsonNode node, final String name) {
        final JsonNode value = node == null ? null : node.get(name);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new HsmException("HSM response is missing " + name, 200);
        }
        return value.asText();
    }

    private static void validate(final SigningCredential credential) {
        Objects.requireNonNull(credential, "credential");
        if (!USER_ID.matcher(credential.userId()).matches()) {
            throw new ValidationException("Invalid user id for HSM signing");
        }
        if (!LABEL.matcher(credential.label()).matches()) {
            throw new ValidationException("HSM label must be a 64-character hex passphrase hash");
        }
    }
}
