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
 * Human decision on an approval ticket.
 */
public enum ApprovalDecision {
    APPROVE, REJECT;

    public static ApprovalDecision parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("decision is required (approve|reject)");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "approve", "approved", "allow", "yes" -> APPROVE;
        case "reject", "rejected", "deny", "no" -> REJECT;
        default -> throw new IllegalArgumentException("Unknown decision: " + value);
        };
    }
}
