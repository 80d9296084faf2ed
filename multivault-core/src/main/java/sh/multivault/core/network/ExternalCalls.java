// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.network;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.multivault.core.error.ExternalServiceException;
import sh.multivault.core.error.MultivaultException;

/**
 * Runs collaborator calls, translating their failures into
 * {@link ExternalServiceException}. Library exceptions pass through unchanged.
 */
public final class ExternalCalls {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalCalls.class);

    private ExternalCalls() {
    }

    public static <T> T call(final String operation, final Supplier<T> action) {
        try {
            return action.get();
        } catch (MultivaultException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("{} failed: {}", operation, e.toString());
            throw new ExternalServiceException(operation + " failed: " + e.getMessage(), e);
        }
    }

    public static void run(final String operation, final Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
