package me.golemcore.steward.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Result of a synthesis call: either SUCCESS with a summary and artifacts, or
 * FAILURE with a reason. Claims made here are verified by the caller before
 * anything is written.
 */
@Data
@Builder
public class SynthesisResult {

    public enum Status {
        SUCCESS, FAILURE
    }

    private Status status;
    private String summary;

    @Builder.Default
    private List<SynthesisArtifact> artifacts = new ArrayList<>();

    private boolean compactionPerformed;
    private String reason;

    public static SynthesisResult success(String summary, List<SynthesisArtifact> artifacts,
            boolean compactionPerformed) {
        return SynthesisResult.builder()
                .status(Status.SUCCESS)
                .summary(summary)
                .artifacts(new ArrayList<>(artifacts))
                .compactionPerformed(compactionPerformed)
                .build();
    }

    public static SynthesisResult failure(String reason) {
        return SynthesisResult.builder()
                .status(Status.FAILURE)
                .reason(reason)
                .build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<SynthesisArtifact> findArtifact(SynthesisArtifact.Type type) {
        return artifacts.stream().filter(a -> a.getType() == type).findFirst();
    }
}
