package me.golemcore.steward.domain.transcript;

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

import me.golemcore.steward.infrastructure.config.StewardProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Escape hatch: an operator-supplied directory, from
 * {@code steward.transcripts.override-dir} or the
 * {@code STEWARD_TRANSCRIPT_DIR} environment variable, searched for a
 * transcript that mentions the session id.
 */
@Component
@Order(40)
@Slf4j
public class OverrideDirLocator implements TranscriptLocator {

    static final String ENV_VARIABLE = "STEWARD_TRANSCRIPT_DIR";

    private final StewardProperties properties;
    private final UnaryOperator<String> environment;

    @Autowired
    public OverrideDirLocator(StewardProperties properties) {
        this(properties, System::getenv);
    }

    OverrideDirLocator(StewardProperties properties, UnaryOperator<String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @Override
    public String getName() {
        return "override-dir";
    }

    @Override
    public Optional<TranscriptCandidate> locate(TranscriptQuery query) {
        String configured = properties.getTranscripts().getOverrideDir();
        if (configured == null || configured.isBlank()) {
            configured = environment.apply(ENV_VARIABLE);
        }
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        Path dir;
        try {
            dir = Path.of(configured).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            log.warn("[Transcript] Invalid override directory: {}", configured);
            return Optional.empty();
        }
        String sessionId = query.session().getSessionId();
        return TranscriptFiles.newestFirst(TranscriptFiles.listTranscripts(dir, 1)).stream()
                .filter(file -> TranscriptFiles.contains(file, sessionId))
                .findFirst()
                .map(file -> new TranscriptCandidate(file, dir, getName()));
    }
}
