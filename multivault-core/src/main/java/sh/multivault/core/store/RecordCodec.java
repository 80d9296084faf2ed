// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

/**
 * JSON encoding of persisted records.
 *
 * <p>
 * Unknown properties are ignored so records written by newer versions stay readable. A record
 * that cannot be decoded is reported as {@link IllegalStateException}: the store holds
 * something this library did not write.
 */
public final class RecordCodec {

    private final ObjectMapper mapper;

    public RecordCodec() {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL));
    }

    public RecordCodec(final ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encode(final Object record) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + record.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(final byte[] bytes, final Class<T> type) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " record: " + e.getMessage(), e);
        }
    }
}
