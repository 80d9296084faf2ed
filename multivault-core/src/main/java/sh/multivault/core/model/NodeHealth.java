// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import org.jspecify.annotations.Nullable;

/**
 * Reachability of the Bitcoin node behind the network collaborator.
 *
 * @param ok      true when the node answered with a chain height
 * @param blocks  chain height, or -1 when unknown
 * @param message failure detail when not ok
 */
public record NodeHealth(boolean ok, long blocks, @Nullable String message) {

    public static NodeHealth up(final long blocks) {
        return new NodeHealth(true, blocks, null);
    }

    public static NodeHealth down(final String message) {
        return new NodeHealth(false, -1L, message);
    }
}
