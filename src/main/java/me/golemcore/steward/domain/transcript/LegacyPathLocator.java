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

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Last resort: the agent's historical directory naming, where the project path
 * has every {@code /} replaced by {@code -}.
 */
@Component
@Order(50)
@RequiredArgsConstructor
public class LegacyPathLocator implements TranscriptLocator {

    private final StewardProperties properties;

    @Override
    public String getName() {
        return "legacy-path";
    }

    @Override
    public Optional<TranscriptCandidate> locate(TranscriptQuery query) {
        Path root = Path.of(properties.getTranscripts().getRoot()).toAbsolutePath().normalize();
        for (String dirName : encodedNames(query.projectRoot())) {
            Path dir = root.resolve(dirName).normalize();
            if (!dir.startsWith(root)) {
                continue;
            }
            Optional<Path> newest = TranscriptFiles.newest(TranscriptFiles.listTranscripts(dir, 1));
            if (newest.isPresent()) {
                return Optional.of(new TranscriptCandidate(newest.get(), root, getName()));
            }
        }
        return Optional.empty();
    }

    static List<String> encodedNames(Path projectRoot) {
        String encoded = projectRoot.toString().replace('\\', '-').replace('/', '-');
        String stripped = encoded.replaceFirst("^-+", "");
        return encoded.equals(stripped) ? List.of(encoded) : List.of(encoded, stripped);
    }
}
