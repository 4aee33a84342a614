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

package me.golemcore.mcp.domain.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.domain.exception.DeserializationStreamException;
import me.golemcore.mcp.domain.exception.NetworkTransportException;
import me.golemcore.mcp.domain.model.StreamingToken;
import me.golemcore.mcp.domain.model.TokenEvent;
import org.reactivestreams.Publisher;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Decodes a line-delimited JSON byte stream into tokens.
 *
 * <p>
 * Chunks may split lines (and multi-byte characters) at arbitrary positions; a
 * line is only decoded once its terminator has arrived. Each complete line is
 * trimmed, skipped when empty or equal to the {@code [DONE]} marker, stripped
 * of an SSE {@code data:} prefix and parsed into the requested type. A line
 * holding JSON {@code null} produces nothing.
 *
 * <p>
 * The resulting stream:
 * <ul>
 * <li>emits one content token per parsed line, in line order</li>
 * <li>emits an in-band {@link DeserializationStreamException} for a malformed
 * line, or one whose content cannot be extracted, and keeps going</li>
 * <li>emits an in-band {@link NetworkTransportException} when the chunk source
 * fails and stops reading</li>
 * <li>always ends with exactly one finish token</li>
 * </ul>
 * Bytes after the last line terminator are discarded when the source
 * completes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonLineStreamDecoder {

    public static final String DATA_PREFIX = "data:";
    public static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;

    /**
     * Decodes lines as {@code type}. Token content is the compact JSON text of
     * the parsed value.
     */
    public <T> Flux<TokenEvent> decode(Publisher<byte[]> chunks, Class<T> type) {
        return decode(chunks, type, this::defaultContent);
    }

    /**
     * Decodes lines as {@code type} and derives token content with
     * {@code contentExtractor}. Lines for which the extractor yields
     * {@code null} produce no token.
     */
    public <T> Flux<TokenEvent> decode(Publisher<byte[]> chunks, Class<T> type,
            Function<T, String> contentExtractor) {
        return Flux.defer(() -> {
            LineAccumulator accumulator = new LineAccumulator();
            return Flux.from(chunks)
                    .concatMapIterable(accumulator::append)
                    .<TokenEvent>handle((line, sink) -> decodeLine(line, type, contentExtractor, sink))
                    .onErrorResume(error -> Mono.just(TokenEvent.failure(toTransportError(error))))
                    .concatWith(Mono.fromSupplier(() -> {
                        accumulator.discardRemainder();
                        return TokenEvent.finish();
                    }));
        });
    }

    private <T> void decodeLine(String rawLine, Class<T> type, Function<T, String> contentExtractor,
            SynchronousSink<TokenEvent> sink) {
        String line = rawLine.strip();
        if (line.isEmpty()) {
            return;
        }
        if (line.startsWith(DATA_PREFIX)) {
            line = line.substring(DATA_PREFIX.length()).strip();
        }
        if (line.isEmpty() || DONE_MARKER.equals(line)) {
            return;
        }

        T value;
        try {
            value = objectMapper.readValue(line, type);
        } catch (JsonProcessingException e) {
            log.debug("[Stream] Malformed line skipped: {}", e.getOriginalMessage());
            sink.next(TokenEvent.failure(new DeserializationStreamException(e.getOriginalMessage())));
            return;
        }

        if (value == null) {
            return;
        }

        String content;
        try {
            content = contentExtractor.apply(value);
        } catch (RuntimeException e) {
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("[Stream] Content extraction failed: {}", detail);
            sink.next(TokenEvent.failure(new DeserializationStreamException(detail)));
            return;
        }
        if (content != null) {
            sink.next(TokenEvent.of(StreamingToken.content(content)));
        }
    }

    private String defaultContent(Object value) {
        if (value instanceof JsonNode node) {
            return node.toString();
        }
        return String.valueOf(value);
    }

    private NetworkTransportException toTransportError(Throwable error) {
        if (error instanceof NetworkTransportException transportError) {
            return transportError;
        }
        log.warn("[Stream] Chunk source failed: {}", error.getMessage());
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new NetworkTransportException(detail, error);
    }

    /**
     * Byte buffer that hands out complete lines. Splitting happens on raw
     * bytes so a UTF-8 sequence cut by a chunk boundary is reassembled before
     * decoding.
     */
    static final class LineAccumulator {

        private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

        List<String> append(byte[] chunk) {
            if (chunk == null || chunk.length == 0) {
                return Collections.emptyList();
            }
            List<String> lines = null;
            int lineStart = 0;
            for (int i = 0; i < chunk.length; i++) {
                if (chunk[i] != '\n') {
                    continue;
                }
                pending.write(chunk, lineStart, i - lineStart);
                if (lines == null) {
                    lines = new ArrayList<>();
                }
                lines.add(pending.toString(StandardCharsets.UTF_8));
                pending.reset();
                lineStart = i + 1;
            }
            pending.write(chunk, lineStart, chunk.length - lineStart);
            return lines != null ? lines : Collections.emptyList();
        }

        int pendingBytes() {
            return pending.size();
        }

        void discardRemainder() {
            if (pending.size() > 0) {
                log.debug("[Stream] Dropping {} bytes after the last line terminator", pending.size());
                pending.reset();
            }
        }
    }
}
