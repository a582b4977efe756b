package me.golemcore.steward.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the steward, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code steward.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - per-project state directory and link
 * policy</li>
 * <li>{@link SessionsProperties} - session reaping and archive retention</li>
 * <li>{@link TranscriptsProperties} - transcript discovery and parsing</li>
 * <li>{@link ContextProperties} - context artifacts, ceiling and conflict
 * window</li>
 * <li>{@link SynthesisProperties} - external synthesis delegate</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "steward")
@Data
public class StewardProperties {

    private StorageProperties storage = new StorageProperties();
    private SessionsProperties sessions = new SessionsProperties();
    private TranscriptsProperties transcripts = new TranscriptsProperties();
    private ContextProperties context = new ContextProperties();
    private SynthesisProperties synthesis = new SynthesisProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class StorageProperties {
        private String stateDirName = ".steward";
        private List<String> allowedLinkRoots = new ArrayList<>();
    }

    @Data
    public static class SessionsProperties {
        private Duration staleAfter = Duration.ofHours(24);
        private Duration archiveRetention = Duration.ofDays(30);
        private Duration cleanupInterval = Duration.ofHours(24);
    }

    @Data
    public static class TranscriptsProperties {
        private String root = System.getProperty("user.home") + "/.claude/projects";
        private String overrideDir = "";
        private Duration tolerance = Duration.ofHours(24);
        private int maxToolOutputChars = 500;
        private int maxProjectScan = 50;
    }

    @Data
    public static class ContextProperties {
        private int maxLines = 200;
        private List<String> targets = new ArrayList<>(
                List.of("PROJECT-CONTEXT", "PROJECT-CHECKLIST", "PROJECT-ROADMAP"));
        private String primaryTarget = "PROJECT-CONTEXT";
        private String historyFile = "PROJECT-HISTORY.md";
        private String negativesFile = "CONTEXT-NEGATIVES.md";
        private Duration conflictWindow = Duration.ofMinutes(30);
        private Duration lockTimeout = Duration.ofSeconds(10);
        private List<String> protectedSections = new ArrayList<>(
                List.of("IDENTITY", "ARCHITECTURE", "CURRENT_STATE", "CONSTRAINTS"));
    }

    @Data
    public static class SynthesisProperties {
        private boolean enabled = false;
        private String url = "";
        private String apiKey = "";
        private Duration timeout = Duration.ofSeconds(15);
        private int minSummaryChars = 300;
        private int minMergedChars = 100;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long writeTimeout = 60000;
    }
}
