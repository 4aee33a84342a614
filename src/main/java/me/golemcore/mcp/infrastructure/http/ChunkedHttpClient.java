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

package me.golemcore.mcp.infrastructure.http;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.domain.exception.NetworkTransportException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Map;

/**
 * Posts a JSON body and exposes the response body as a stream of raw byte
 * chunks, in arrival order.
 *
 * <p>
 * Reading happens on the bounded elastic scheduler. Cancelling the returned
 * flux closes the response and releases the connection. A non-2xx status
 * fails the flux with {@link NetworkTransportException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkedHttpClient {

    static final int CHUNK_SIZE = 8192;
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient okHttpClient;

    public Flux<byte[]> postJson(String url, Map<String, String> headers, byte[] body) {
        Request.Builder requestBuilder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON));
        headers.forEach(requestBuilder::header);
        Request request = requestBuilder.build();

        return Flux.using(
                () -> okHttpClient.newCall(request).execute(),
                this::readBody,
                Response::close)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Flux<byte[]> readBody(Response response) {
        ResponseBody responseBody = response.body();
        if (!response.isSuccessful() || responseBody == null) {
            log.warn("[Stream] Backend returned status {}", response.code());
            return Flux.error(new NetworkTransportException("HTTP " + response.code()));
        }
        InputStream input = responseBody.byteStream();
        return Flux.generate(sink -> {
            byte[] buffer = new byte[CHUNK_SIZE];
            try {
                int read = input.read(buffer);
                if (read < 0) {
                    sink.complete();
                } else {
                    sink.next(Arrays.copyOf(buffer, read));
                }
            } catch (IOException e) {
                sink.error(new NetworkTransportException(e.getMessage() != null ? e.getMessage() : "read failed", e));
            }
        });
    }
}
