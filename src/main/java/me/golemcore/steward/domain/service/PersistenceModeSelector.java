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

import me.golemcore.steward.domain.model.PersistenceMode;
import me.golemcore.steward.domain.model.ProjectLayout;
import me.golemcore.steward.domain.model.StewardException;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Chooses between direct writes and anchor (event-sourced) mode.
 *
 * <p>
 * Anchor mode is active iff {@code snapshots/} exists in the state tree.
 * Snapshots are read-only in that mode: {@link #assertWritable} guards every
 * write path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersistenceModeSelector {

    private final StoragePort storagePort;

    public PersistenceMode detect(ProjectLayout layout) {
        boolean anchor = Boolean.TRUE.equals(
                storagePort.exists(layout.stateRoot(), ProjectLayout.SNAPSHOTS_DIR).join());
        return anchor ? PersistenceMode.ANCHOR : PersistenceMode.DIRECT_WRITE;
    }

    /**
     * Refuse any write that would land inside {@code snapshots/}.
     */
    public void assertWritable(ProjectLayout layout, String relativePath) {
        Path target = storagePort.resolve(layout.stateRoot(), relativePath);
        Path snapshots = storagePort.resolve(layout.stateRoot(), ProjectLayout.SNAPSHOTS_DIR);
        if (target.startsWith(snapshots)) {
            log.warn("[Merge] Write into snapshots refused: {}", target);
            throw StewardException.gateViolation("Snapshots are read-only: " + relativePath);
        }
    }
}
