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

import java.nio.file.Path;

/**
 * Resolved on-disk locations of one project's state tree.
 *
 * <p>
 * All relative paths handed to {@link me.golemcore.steward.port.outbound.StoragePort}
 * are relative to {@link #stateRoot()}.
 *
 * @param projectRoot
 *            absolute, normalized project working directory
 * @param stateRoot
 *            absolute state directory (the symlink target when the state
 *            directory is a link)
 */
public record ProjectLayout(Path projectRoot, Path stateRoot) {

    public static final String ACTIVE_SESSIONS_DIR = "sessions/active";
    public static final String ARCHIVE_DIR = "sessions/archive";
    public static final String REGISTRY_FILE = "sessions/registry.json";
    public static final String LAST_CLEANUP_FILE = "sessions/last-cleanup";
    public static final String CONTEXT_DIR = "context";
    public static final String SNAPSHOTS_DIR = "snapshots";
    public static final String EVENTS_DIR = "events";
    public static final String INBOX_PENDING_DIR = "inbox/pending";
    public static final String INBOX_PROCESSED_DIR = "inbox/processed";
    public static final String INBOX_INDEX_FILE = "inbox/processed/index.json";
    public static final String LOCKS_DIR = "locks";
    public static final String SESSION_FILE = "session.json";

    public String sessionDir(String sessionId) {
        return ACTIVE_SESSIONS_DIR + "/" + sessionId;
    }

    public String sessionFile(String sessionId) {
        return sessionDir(sessionId) + "/" + SESSION_FILE;
    }

    public String contextFile(String target) {
        return CONTEXT_DIR + "/" + target + ".md";
    }

    public String snapshotFile(String target) {
        return SNAPSHOTS_DIR + "/" + target + ".md";
    }

    public String lockFile(String name) {
        return LOCKS_DIR + "/" + name + ".lock";
    }
}
