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
 * How far an "always/never" decision reaches when it is turned into a rule:
 * the whole tool, or only the scope of the call (e.g. {@code bash:git status}).
 */
public enum PersistScope {
    TOOL, SCOPE;

    public static PersistScope parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "tool" -> TOOL;
        case "scope" -> SCOPE;
        default -> throw new IllegalArgumentException("Unknown persist scope: " + value);
        };
    }
}
