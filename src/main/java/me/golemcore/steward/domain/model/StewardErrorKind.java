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

package me.golemcore.steward.domain.model;

/**
 * Classification of steward failures. The kind tells the invoking agent which
 * retry strategy applies.
 */
public enum StewardErrorKind {

    /**
     * A transcript, session or target artifact cannot be located. No partial
     * write is attempted.
     */
    UNRESOLVABLE,

    /**
     * Concurrent edits were detected. Advisory: normally reported inside a
     * result instead of being thrown.
     */
    CONFLICT,

    /**
     * A delegate claimed work it cannot prove, or a write targeted a read-only
     * location. Rejected before any durable write.
     */
    GATE_VIOLATION,

    /**
     * Delegate timeout, lock contention or another condition that a retry may
     * clear.
     */
    TRANSIENT,

    /**
     * Path traversal or containment failure. No filesystem access is granted.
     */
    SECURITY,

    /**
     * Malformed or incomplete request.
     */
    VALIDATION
}
