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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Allow/deny rule for a bare tool name ({@code bash}) or a tool scope
 * ({@code bash:rm}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PermissionRule {

    private String subject;
    private PermissionEffect effect;

    public static PermissionRule allow(String subject) {
        return new PermissionRule(subject, PermissionEffect.ALLOW);
    }

    public static PermissionRule deny(String subject) {
        return new PermissionRule(subject, PermissionEffect.DENY);
    }

    public static String subjectOf(String toolName, String scopeHint) {
        if (scopeHint == null || scopeHint.isBlank()) {
            return toolName;
        }
        return toolName + ":" + scopeHint;
    }
}
