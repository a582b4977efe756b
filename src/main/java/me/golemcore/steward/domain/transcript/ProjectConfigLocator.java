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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Inverts the agent's project metadata: looks for a transcript directory whose
 * {@code project_config.json} declares this project as its {@code rootPath}.
 */
@Component
@Order(30)
@RequiredArgsConstructor
@Slf4j
public class ProjectConfigLocator implements TranscriptLocator {

    static final String CONFIG_FILE = "project_config.json";
    private static final String ROOT_PATH_FIELD = "rootPath";

    private final StewardProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "project-config";
    }

    @Override
    public Optional<TranscriptCandidate> locate(TranscriptQuery query) {
        Path root = Path.of(properties.getTranscripts().getRoot()).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            return Optional.empty();
        }
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs
                    .filter(Files::isDirectory)
                    .limit(properties.getTranscripts().getMaxProjectScan())
                    .filter(dir -> declaresProject(dir, query.projectRoot()))
                    .findFirst()
                    .flatMap(dir -> TranscriptFiles.newest(TranscriptFiles.listTranscripts(dir, 1)))
                    .map(file -> new TranscriptCandidate(file, root, getName()));
        } catch (IOException e) {
            log.debug("[Transcript] Cannot scan {}: {}", root, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean declaresProject(Path dir, Path projectRoot) {
        Path config = dir.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(config)) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(config.toFile());
            String declared = node.path(ROOT_PATH_FIELD).asText("");
            return !declared.isBlank() && Path.of(declared).toAbsolutePath().normalize().equals(projectRoot);
        } catch (IOException | InvalidPathException e) {
            log.debug("[Transcript] Unreadable {}: {}", config, e.getMessage());
            return false;
        }
    }
}
