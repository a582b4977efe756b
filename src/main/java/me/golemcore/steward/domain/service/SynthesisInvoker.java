package me.golemcore.steward.domain.service;

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

import me.golemcore.steward.domain.model.SynthesisRequest;
import me.golemcore.steward.domain.model.SynthesisResult;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.SynthesisPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the synthesis delegate with a bounded wait. Any timeout, error or
 * FAILURE answer becomes an empty result so callers take their deterministic
 * path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SynthesisInvoker {

    private final SynthesisPort synthesisPort;
    private final StewardProperties properties;
    private final Clock clock;

    public boolean isAvailable() {
        return synthesisPort.isAvailable();
    }

    public Optional<SynthesisResult> invoke(SynthesisRequest request) {
        long timeoutMs = properties.getSynthesis().getTimeout().toMillis();
        CompletableFuture<SynthesisResult> future = synthesisPort.synthesize(request);
        try {
            long start = clock.millis();
            SynthesisResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            long elapsed = clock.millis() - start;

            if (result == null || !result.isSuccess()) {
                log.warn("[Synthesis] {} for {} failed: {}", request.getTask(), request.getTarget(),
                        result != null ? result.getReason() : "no result");
                return Optional.empty();
            }
            log.info("[Synthesis] {} for {} answered in {}ms", request.getTask(), request.getTarget(), elapsed);
            return Optional.of(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Synthesis] {} interrupted: {}", request.getTask(), e.getMessage());
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            future.cancel(true);
            log.warn("[Synthesis] {} failed or timed out after {}ms: {}", request.getTask(), timeoutMs,
                    e.getMessage());
            return Optional.empty();
        }
    }
}
