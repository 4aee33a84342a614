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

package me.golemcore.mcp.domain.model;

import me.golemcore.mcp.domain.exception.McpException;

/**
 * Element of a token stream: either a token or an in-band error. Errors do
 * not end the stream, the finish token does.
 */
public record TokenEvent(StreamingToken token, McpException error) {

    public static TokenEvent of(StreamingToken token) {
        return new TokenEvent(token, null);
    }

    public static TokenEvent failure(McpException error) {
        return new TokenEvent(null, error);
    }

    public static TokenEvent finish() {
        return new TokenEvent(StreamingToken.finished(), null);
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isFinish() {
        return token != null && token.isFinish();
    }
}
