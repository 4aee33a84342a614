/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mcp.adapter.outbound.client;

/**
 * Failure of {@link McpClient#send(String, me.golemcore.mcp.domain.model.Envelope)}.
 */
public class McpClientException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NETWORK, UNEXPECTED_STATUS, DESERIALIZATION
    }

    private final Kind kind;
    private final int statusCode;

    private McpClientException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static McpClientException network(Throwable cause) {
        return new McpClientException(Kind.NETWORK, -1, "Network error while sending request: " + cause.getMessage(),
                cause);
    }

    public static McpClientException unexpectedStatus(int statusCode) {
        return new McpClientException(Kind.UNEXPECTED_STATUS, statusCode,
                "Server returned unexpected status: " + statusCode, null);
    }

    public static McpClientException deserialization(Throwable cause) {
        return new McpClientException(Kind.DESERIALIZATION, -1,
                "Failed to deserialize response envelope: " + cause.getMessage(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * HTTP status for {@link Kind#UNEXPECTED_STATUS}, otherwise -1.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
