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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parsed entry of an agent transcript. Which fields are populated depends
 * on {@link #type}.
 */
@Data
@Builder
public class TranscriptRecord {

    public enum Type {
        TEXT, TOOL_USE, TOOL_RESULT
    }

    private Type type;

    // TEXT
    private String role;
    private String content;

    // TOOL_USE / TOOL_RESULT
    private String toolName;
    private String toolUseId;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    private String output;
    private boolean error;

    public static TranscriptRecord text(String role, String content) {
        return TranscriptRecord.builder()
                .type(Type.TEXT)
                .role(role)
                .content(content)
                .build();
    }

    public static TranscriptRecord toolUse(String toolName, String toolUseId, Map<String, Object> parameters) {
        return TranscriptRecord.builder()
                .type(Type.TOOL_USE)
                .toolName(toolName)
                .toolUseId(toolUseId)
                .parameters(parameters)
                .build();
    }

    public static TranscriptRecord toolResult(String toolUseId, String output, boolean error) {
        return TranscriptRecord.builder()
                .type(Type.TOOL_RESULT)
                .toolUseId(toolUseId)
                .output(output)
                .error(error)
                .build();
    }
}
