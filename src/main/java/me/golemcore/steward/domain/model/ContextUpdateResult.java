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
 * Outcome of a context update.
 */
@Data
@Builder
public class ContextUpdateResult {

    public enum Outcome {
        MERGED, EVENT_EMITTED
    }

    public enum MergeMode {
        DIRECT_APPEND, DIRECT_REPLACE, DELEGATED
    }

    private String auditId;
    private String target;
    private Outcome outcome;
    private MergeMode mergeMode;

    @Builder.Default
    private SynthesisOutcome synthesisOutcome = SynthesisOutcome.NOT_REQUESTED;

    private boolean conflict;

    @Builder.Default
    private List<ContextConflict> conflicts = new ArrayList<>();

    private boolean conflictsAcknowledged;
    private boolean compacted;

    @Builder.Default
    private List<String> archivedSections = new ArrayList<>();

    /**
     * Live artifact path, or the event file in anchor mode.
     */
    private String path;
}
