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
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Uses the transcript path the agent reported at clock-in. The file must live
 * under the transcripts root or the project root.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class ExplicitPathLocator implements TranscriptLocator {

    private final StewardProperties properties;

    @Override
    public String getName() {
        return "explicit";
    }

    @Override
    public Optional<TranscriptCandidate> locate(TranscriptQuery query) {
        String hint = query.session().getTranscriptPath();
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        Path path;
        try {
            path = Path.of(hint).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        Path transcriptsRoot = Path.of(properties.getTranscripts().getRoot()).toAbsolutePath().normalize();
        Path allowedRoot = path.startsWith(transcriptsRoot) ? transcriptsRoot : query.projectRoot();
        return Optional.of(new TranscriptCandidate(path, allowedRoot, getName()));
    }
}
