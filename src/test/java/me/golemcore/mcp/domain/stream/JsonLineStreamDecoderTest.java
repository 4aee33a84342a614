package me.golemcore.mcp.domain.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mcp.domain.exception.DeserializationStreamException;
import me.golemcore.mcp.domain.exception.NetworkTransportException;
import me.golemcore.mcp.domain.model.TokenEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JsonLineStreamDecoderTest {

    private static final String SAMPLE = "{\"text\":\"A\"}\n{\"text\":\"B\"}\ndata: [DONE]\n";

    private JsonLineStreamDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new JsonLineStreamDecoder(new ObjectMapper());
    }

    // ==================== chunking ====================

    @Test
    void decodesSingleChunk() {
        Flux<TokenEvent> events = decoder.decode(Flux.just(bytes(SAMPLE)), JsonNode.class, this::text);

        StepVerifier.create(events)
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> assertContent("B", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void decodesByteByByteChunks() {
        Flux<TokenEvent> events = decoder.decode(Flux.fromIterable(byteByByte(SAMPLE)), JsonNode.class, this::text);

        StepVerifier.create(events)
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> assertContent("B", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void chunkBoundariesDoNotChangeOutput() {
        String input = "data: {\"text\":\"one\"}\n\n  \ndata:{\"text\":\"two\"}\r\n{\"text\":\"three\"}\n";
        List<String> whole = contents(decoder.decode(Flux.just(bytes(input)), JsonNode.class, this::text));

        for (int split = 1; split < input.length(); split++) {
            byte[] data = bytes(input);
            byte[] head = Arrays.copyOfRange(data, 0, split);
            byte[] tail = Arrays.copyOfRange(data, split, data.length);

            List<String> splitResult = contents(decoder.decode(Flux.just(head, tail), JsonNode.class, this::text));

            assertEquals(whole, splitResult, "split at " + split);
        }
        assertEquals(List.of("one", "two", "three", "<finish>"), whole);
    }

    @Test
    void reassemblesMultibyteCharacterSplitAcrossChunks() {
        byte[] data = bytes("{\"text\":\"привет ✓\"}\n");
        byte[] head = Arrays.copyOfRange(data, 0, 12);
        byte[] tail = Arrays.copyOfRange(data, 12, data.length);

        StepVerifier.create(decoder.decode(Flux.just(head, tail), JsonNode.class, this::text))
                .assertNext(event -> assertContent("привет ✓", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void defaultContentIsCompactJson() {
        StepVerifier.create(decoder.decode(Flux.just(bytes("  {\"a\": 1}  \n")), JsonNode.class))
                .assertNext(event -> assertContent("{\"a\":1}", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    // ==================== malformed input ====================

    @Test
    void malformedLineYieldsErrorAndDecodingContinues() {
        String input = "{\"text\":\"A\"}\n{\"bad json\n{\"text\":\"B\"}\n";

        StepVerifier.create(decoder.decode(Flux.just(bytes(input)), JsonNode.class, this::text))
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> {
                    assertTrue(event.isError());
                    assertInstanceOf(DeserializationStreamException.class, event.error());
                })
                .assertNext(event -> assertContent("B", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void lineOfWrongShapeYieldsError() {
        StepVerifier.create(decoder.decode(Flux.just(bytes("[1,2]\n")), Sample.class, Sample::getText))
                .assertNext(event -> assertInstanceOf(DeserializationStreamException.class, event.error()))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void typedLinesUseExtractor() {
        StepVerifier.create(decoder.decode(Flux.just(bytes("{\"text\":\"typed\",\"extra\":1}\n")),
                Sample.class, Sample::getText))
                .assertNext(event -> assertContent("typed", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void extractorReturningNullSkipsLine() {
        String input = "{\"role\":\"assistant\"}\n{\"text\":\"A\"}\n";

        StepVerifier.create(decoder.decode(Flux.just(bytes(input)), JsonNode.class, this::text))
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void nullLineIsSkippedAndDecodingContinues() {
        String input = "{\"text\":\"A\"}\ndata: null\n{\"text\":\"B\"}\n";

        StepVerifier.create(decoder.decode(Flux.just(bytes(input)), Sample.class, Sample::getText))
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> assertContent("B", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void failingExtractorYieldsErrorAndDecodingContinues() {
        String input = "{\"text\":\"A\"}\n{\"text\":\"boom\"}\n{\"text\":\"B\"}\n";

        StepVerifier.create(decoder.decode(Flux.just(bytes(input)), Sample.class, sample -> {
            if ("boom".equals(sample.getText())) {
                throw new IllegalStateException("cannot extract");
            }
            return sample.getText();
        }))
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> {
                    assertInstanceOf(DeserializationStreamException.class, event.error());
                    assertTrue(event.error().getMessage().contains("cannot extract"));
                })
                .assertNext(event -> assertContent("B", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void emptySourceYieldsOnlyFinish() {
        StepVerifier.create(decoder.decode(Flux.<byte[]>empty(), JsonNode.class))
                .assertNext(event -> {
                    assertTrue(event.isFinish());
                    assertEquals("", event.token().getContent());
                })
                .verifyComplete();
    }

    @Test
    void unterminatedTrailingLineIsDropped() {
        StepVerifier.create(decoder.decode(Flux.just(bytes("{\"text\":\"A\"}\n{\"text\":\"B\"}")), JsonNode.class,
                this::text))
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    // ==================== transport errors ====================

    @Test
    void transportErrorYieldsErrorThenFinish() {
        Flux<byte[]> source = Flux.just(bytes("{\"text\":\"A\"}\n{\"text\":"))
                .concatWith(Flux.error(new IOException("connection reset")));

        StepVerifier.create(decoder.decode(source, JsonNode.class, this::text))
                .assertNext(event -> assertContent("A", event))
                .assertNext(event -> {
                    assertInstanceOf(NetworkTransportException.class, event.error());
                    assertTrue(event.error().getMessage().contains("connection reset"));
                })
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void transportErrorStopsConsumingChunks() {
        AtomicInteger delivered = new AtomicInteger();
        Flux<byte[]> source = Flux.just(bytes("{\"text\":\"A\"}\n"))
                .concatWith(Flux.error(new NetworkTransportException("HTTP 502")))
                .concatWith(Flux.just(bytes("{\"text\":\"late\"}\n")))
                .doOnNext(chunk -> delivered.incrementAndGet());

        List<String> result = contents(decoder.decode(source, JsonNode.class, this::text));

        assertEquals(List.of("A", "<error:Network error: HTTP 502>", "<finish>"), result);
        assertEquals(1, delivered.get());
    }

    @Test
    void exactlyOneFinishTokenIsLast() {
        String input = "{\"text\":\"A\"}\ngarbage\n\ndata: [DONE]\n{\"text\":\"B\"}\n";

        List<TokenEvent> events = decoder.decode(Flux.fromIterable(byteByByte(input)), JsonNode.class, this::text)
                .collectList()
                .block();

        assertNotNull(events);
        assertEquals(1, events.stream().filter(TokenEvent::isFinish).count());
        assertTrue(events.get(events.size() - 1).isFinish());
    }

    // ==================== line accumulator ====================

    @Test
    void accumulatorKeepsPartialLinePending() {
        JsonLineStreamDecoder.LineAccumulator accumulator = new JsonLineStreamDecoder.LineAccumulator();

        assertTrue(accumulator.append(bytes("abc")).isEmpty());
        assertEquals(List.of("abcdef", ""), accumulator.append(bytes("def\n\nxy")));
        assertEquals(2, accumulator.pendingBytes());
    }

    private String text(JsonNode node) {
        JsonNode text = node.get("text");
        return text != null ? text.asText() : null;
    }

    private static void assertContent(String expected, TokenEvent event) {
        assertFalse(event.isError(), () -> "unexpected error: " + event.error());
        assertFalse(event.isFinish());
        assertEquals(expected, event.token().getContent());
    }

    private static List<String> contents(Flux<TokenEvent> events) {
        List<String> result = new ArrayList<>();
        for (TokenEvent event : events.toIterable()) {
            if (event.isError()) {
                result.add("<error:" + event.error().getMessage() + ">");
            } else if (event.isFinish()) {
                result.add("<finish>");
            } else {
                result.add(event.token().getContent());
            }
        }
        return result;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static List<byte[]> byteByByte(String text) {
        List<byte[]> chunks = new ArrayList<>();
        for (byte b : bytes(text)) {
            chunks.add(new byte[] {b});
        }
        return chunks;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Sample {
        private String text;

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }
    }
}
