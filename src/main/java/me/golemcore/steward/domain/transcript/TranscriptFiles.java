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

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Filesystem helpers shared by the transcript locators.
 */
@Slf4j
final class TranscriptFiles {

    static final String EXTENSION = ".jsonl";

    private TranscriptFiles() {
    }

    static List<Path> listTranscripts(Path dir, int maxDepth) {
        if (dir == null || !Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> paths = Files.walk(dir, maxDepth)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.debug("[Transcript] Cannot list {}: {}", dir, e.getMessage());
            return Collections.emptyList();
        }
    }

    static Instant modified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            return Instant.EPOCH;
        }
    }

    static List<Path> newestFirst(List<Path> files) {
        return files.stream()
                .sorted(Comparator.comparing(TranscriptFiles::modified).reversed())
                .toList();
    }

    static Optional<Path> newest(List<Path> files) {
        return newestFirst(files).stream().findFirst();
    }

    /**
     * Line scan for {@code needle}; undecodable bytes are replaced so a
     * damaged transcript can still be identified.
     */
    static boolean contains(Path file, String needle) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.contains(needle)) {
                    return true;
                }
            }
            return false;
        } catch (IOException | UncheckedIOException e) {
            log.debug("[Transcript] Cannot scan {}: {}", file, e.getMessage());
            return false;
        }
    }
}
