package me.golemcore.steward.adapter.outbound.synthesis;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.domain.model.SynthesisArtifact;
import me.golemcore.steward.domain.model.SynthesisRequest;
import me.golemcore.steward.domain.model.SynthesisResult;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.SynthesisPort;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Synthesis delegate reached over HTTP.
 *
 * <p>
 * POSTs {@code {task, target, intent, current_content, new_content, signals}}
 * as JSON to {@code steward.synthesis.url} and expects
 * {@code {status, summary, artifacts: [{type, content}], compaction_performed, error}}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code steward.synthesis.enabled} - Enable/disable delegation
 * <li>{@code steward.synthesis.url} - Delegate endpoint
 * <li>{@code steward.synthesis.api-key} - Optional bearer token
 * <li>{@code steward.synthesis.timeout} - Call timeout
 * </ul>
 *
 * @see me.golemcore.steward.port.outbound.SynthesisPort
 */
@Component
@Slf4j
public class HttpSynthesisAdapter implements SynthesisPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String STATUS_SUCCESS = "success";

    private final StewardProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpSynthesisAdapter(StewardProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        // Dedicated client bounded by the synthesis timeout
        long timeoutMillis = properties.getSynthesis().getTimeout().toMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public CompletableFuture<SynthesisResult> synthesize(SynthesisRequest request) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(SynthesisResult.failure("Synthesis delegate not configured"));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                String body = objectMapper.writeValueAsString(new DelegateRequest(
                        request.getTask().name(),
                        request.getTarget(),
                        request.getIntent(),
                        request.getCurrentContent(),
                        request.getNewContent(),
                        request.getSignals()));

                Request.Builder requestBuilder = new Request.Builder()
                        .url(properties.getSynthesis().getUrl())
                        .post(RequestBody.create(body, JSON));
                addApiKeyHeader(requestBuilder);

                try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                    ResponseBody responseBody = response.body();
                    if (!response.isSuccessful() || responseBody == null) {
                        log.warn("[Synthesis] {} failed: HTTP {}", request.getTask(), response.code());
                        return SynthesisResult.failure("HTTP " + response.code());
                    }
                    return toResult(responseBody.string());
                }
            } catch (IOException e) {
                log.warn("[Synthesis] {} error: {}", request.getTask(), e.getMessage());
                return SynthesisResult.failure(e.getMessage());
            }
        });
    }

    @Override
    public boolean isAvailable() {
        StewardProperties.SynthesisProperties synthesis = properties.getSynthesis();
        return synthesis.isEnabled() && synthesis.getUrl() != null && !synthesis.getUrl().isBlank();
    }

    private SynthesisResult toResult(String responseBody) {
        DelegateResponse response;
        try {
            response = objectMapper.readValue(responseBody, DelegateResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("[Synthesis] Unparseable delegate response: {}", e.getOriginalMessage());
            return SynthesisResult.failure("Unparseable delegate response");
        }
        if (!STATUS_SUCCESS.equalsIgnoreCase(response.getStatus())) {
            String error = Objects.requireNonNullElse(response.getError(), "Delegate reported " + response.getStatus());
            return SynthesisResult.failure(error);
        }
        List<SynthesisArtifact> artifacts = new ArrayList<>();
        if (response.getArtifacts() != null) {
            for (DelegateArtifact artifact : response.getArtifacts()) {
                SynthesisArtifact.Type type = parseType(artifact.getType());
                if (type == null) {
                    log.debug("[Synthesis] Ignoring artifact of unknown type {}", artifact.getType());
                    continue;
                }
                artifacts.add(new SynthesisArtifact(type, artifact.getContent()));
            }
        }
        return SynthesisResult.success(response.getSummary(), artifacts, response.isCompactionPerformed());
    }

    private SynthesisArtifact.Type parseType(String type) {
        if (type == null) {
            return null;
        }
        try {
            return SynthesisArtifact.Type.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getSynthesis().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    // Wire DTOs
    record DelegateRequest(String task, String target, String intent, String current_content, String new_content,
            Map<String, String> signals) {
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DelegateResponse {
        private String status;
        private String summary;
        private List<DelegateArtifact> artifacts;
        @JsonProperty("compaction_performed")
        private boolean compactionPerformed;
        private String error;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DelegateArtifact {
        private String type;
        private String content;
    }
}
