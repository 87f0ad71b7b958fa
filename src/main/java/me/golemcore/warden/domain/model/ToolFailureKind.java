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

package me.golemcore.warden.domain.model;

import java.util.Locale;

/**
 * Machine-readable reason a tool call did not produce a successful result.
 */
public enum ToolFailureKind {

    /**
     * Security gate rejected a path or command.
     */
    VALIDATION_BLOCKED,

    /**
     * An explicit deny rule matched the call.
     */
    POLICY_DENIED,

    /**
     * The human rejected the approval ticket, or it timed out.
     */
    APPROVAL_REJECTED,

    /**
     * The owning exchange was cancelled while the call was pending or running.
     */
    SUPERSEDED,

    /**
     * Arguments did not satisfy the tool's declared schema.
     */
    INVALID_ARGUMENTS,

    /**
     * The requested tool, file or directory does not exist.
     */
    NOT_FOUND,

    /**
     * Execution exceeded its timeout and was cancelled.
     */
    TIMEOUT,

    /**
     * Tool ran and failed (exceptions, non-zero exit, I/O errors).
     */
    EXECUTION_FAILED;

    /**
     * Lower-case kind label reported to the model and the client, e.g.
     * {@code timeout}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
