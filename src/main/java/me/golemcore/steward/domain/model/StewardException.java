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

import lombok.Getter;

/**
 * Unchecked failure raised by steward operations, tagged with a
 * {@link StewardErrorKind}.
 */
@Getter
public class StewardException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final StewardErrorKind kind;

    public StewardException(StewardErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StewardException(StewardErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StewardException unresolvable(String message) {
        return new StewardException(StewardErrorKind.UNRESOLVABLE, message);
    }

    public static StewardException gateViolation(String message) {
        return new StewardException(StewardErrorKind.GATE_VIOLATION, message);
    }

    public static StewardException security(String message) {
        return new StewardException(StewardErrorKind.SECURITY, message);
    }

    public static StewardException validation(String message) {
        return new StewardException(StewardErrorKind.VALIDATION, message);
    }

    public static StewardException transientFailure(String message, Throwable cause) {
        return new StewardException(StewardErrorKind.TRANSIENT, message, cause);
    }
}
