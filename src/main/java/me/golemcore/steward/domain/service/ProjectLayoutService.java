package me.golemcore.steward.domain.service;

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

import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.StewardErrorKind;
import me.golemcore.steward.domain.model.StewardException;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.StoragePort;
import me.golemcore.steward.security.PathGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Locates (and creates) the state tree of a project.
 *
 * <p>
 * A state directory that is a symbolic link is followed once; see
 * {@link PathGuard#followStateLink}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectLayoutService {

    private static final List<String> REQUIRED_DIRS = List.of(
            ProjectLayout.ACTIVE_SESSIONS_DIR,
            ProjectLayout.ARCHIVE_DIR,
            ProjectLayout.CONTEXT_DIR,
            ProjectLayout.INBOX_PENDING_DIR,
            ProjectLayout.INBOX_PROCESSED_DIR,
            ProjectLayout.LOCKS_DIR);

    private final StoragePort storagePort;
    private final PathGuard pathGuard;
    private final StewardProperties properties;

    public ProjectLayout resolve(String workingDir) {
        if (workingDir == null || workingDir.isBlank()) {
            throw StewardException.validation("Working directory is required");
        }
        Path projectRoot;
        try {
            projectRoot = Path.of(workingDir).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw StewardException.validation("Invalid working directory: " + workingDir);
        }
        if (!Files.isDirectory(projectRoot)) {
            throw StewardException.unresolvable("Project root does not exist: " + projectRoot);
        }

        Path statePath = projectRoot.resolve(properties.getStorage().getStateDirName()).normalize();
        Path stateRoot = statePath;
        if (Files.isSymbolicLink(statePath)) {
            List<Path> allowedRoots = properties.getStorage().getAllowedLinkRoots().stream()
                    .filter(root -> root != null && !root.isBlank())
                    .map(Path::of)
                    .toList();
            stateRoot = pathGuard.followStateLink(statePath, projectRoot, allowedRoots);
        }

        try {
            storagePort.ensureDirectory(stateRoot, "").join();
            for (String dir : REQUIRED_DIRS) {
                storagePort.ensureDirectory(stateRoot, dir).join();
            }
        } catch (RuntimeException e) { // NOSONAR - any storage failure means the root is unusable
            log.error("[Session] Cannot prepare state directory {}: {}", stateRoot, e.getMessage());
            throw new StewardException(StewardErrorKind.UNRESOLVABLE,
                    "State directory is not writable: " + stateRoot, e);
        }
        if (!Files.isWritable(stateRoot)) {
            throw StewardException.unresolvable("State directory is not writable: " + stateRoot);
        }
        return new ProjectLayout(projectRoot, stateRoot);
    }
}
