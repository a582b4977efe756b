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

/**
 * Outcome of clock-out. {@code degraded} marks a partial success: the raw
 * transcript is archived but some later step failed.
 */
@Data
@Builder
public class ClockOutResult {

    private String sessionId;
    private String transcriptSource;
    private String rawArchivePath;
    private long rawArchiveBytes;
    private String transcriptArchivePath;
    private String summaryPath;
    private String summary;
    private int recordCount;

    @Builder.Default
    private SynthesisOutcome synthesisOutcome = SynthesisOutcome.NOT_REQUESTED;

    private boolean degraded;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
