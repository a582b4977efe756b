package me.golemcore.steward.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the external synthesis delegate that compresses session transcripts
 * and merges context semantically.
 *
 * <p>
 * The delegate is untrusted: callers bound every call with a timeout and
 * verify what it claims before writing anything.
 */
public interface SynthesisPort {

    /**
     * Run one synthesis task. The future completes with a FAILURE result
     * rather than exceptionally when the delegate answers with an error.
     */
    CompletableFuture<SynthesisResult> synthesize(SynthesisRequest request);

    /**
     * Whether the delegate is configured and enabled.
     */
    boolean isAvailable();
}
