package me.golemcore.steward;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Steward.
 *
 * <p>
 * Steward keeps a shared, bounded project context for several agents working
 * on the same codebase.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Session lifecycle</b> - clock-in with focus-conflict detection,
 * clock-out with byte-for-byte transcript archival</li>
 * <li><b>Transcript discovery</b> - chain of locators with path
 * containment checks</li>
 * <li><b>Context merging</b> - audit-trailed updates, advisory conflict
 * detection, optional delegated (semantic) merge</li>
 * <li><b>Compaction</b> - size-bounded live artifacts with lossless
 * relocation to a history file</li>
 * <li><b>Anchor mode</b> - event-sourced updates when snapshots are
 * present</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → StewardController (WebFlux)
 * Domain Layer       → SessionManager, ContextMergeEngine, CompactionGate
 * Infrastructure     → LocalStorageAdapter, HttpSynthesisAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code steward.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StewardApplication {

    public static void main(String[] args) {
        SpringApplication.run(StewardApplication.class, args);
    }

}
