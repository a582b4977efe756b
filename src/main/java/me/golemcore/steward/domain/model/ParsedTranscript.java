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
 * Parse result of a raw transcript together with counters for everything that
 * was skipped.
 */
@Data
@Builder
public class ParsedTranscript {

    @Builder.Default
    private List<TranscriptRecord> records = new ArrayList<>();

    private int totalLines;
    private int blankLines;
    private int malformedLines;
    private int duplicateResults;

    public long count(TranscriptRecord.Type type) {
        return records.stream().filter(r -> r.getType() == type).count();
    }
}
