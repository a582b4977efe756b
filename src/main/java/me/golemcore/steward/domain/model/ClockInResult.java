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
 * Everything an agent needs after clock-in: its session id, where to read
 * context from, and any focus conflict.
 */
@Data
@Builder
public class ClockInResult {

    private String sessionId;
    private PersistenceMode persistenceMode;

    @Builder.Default
    private List<ContextPath> contextPaths = new ArrayList<>();

    /**
     * Inline negative constraints when the file is small, otherwise
     * {@code null} and {@link #negativesPath} is set.
     */
    private String negativesContent;
    private String negativesPath;

    private FocusConflict focusConflict;

    public boolean hasFocusConflict() {
        return focusConflict != null;
    }
}
