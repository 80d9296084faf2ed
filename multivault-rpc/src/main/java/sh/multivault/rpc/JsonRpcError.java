// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, Object data) {}
