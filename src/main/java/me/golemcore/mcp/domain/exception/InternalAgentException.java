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

package me.golemcore.mcp.domain.exception;

/**
 * Agent-level failure: missing payload field, backend call failure, backend
 * non-success status or unexpected response shape.
 */
public class InternalAgentException extends McpException {

    private final String detail;

    public InternalAgentException(String detail) {
        super(McpErrorType.INTERNAL_AGENT_ERROR, "Internal agent error: " + detail);
        this.detail = detail;
    }

    public InternalAgentException(String detail, Throwable cause) {
        super(McpErrorType.INTERNAL_AGENT_ERROR, "Internal agent error: " + detail, cause);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
