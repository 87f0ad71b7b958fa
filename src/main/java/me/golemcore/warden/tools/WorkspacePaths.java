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

package me.golemcore.warden.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Display helper shared by the file tools.
 */
final class WorkspacePaths {

    private WorkspacePaths() {
    }

    static Path realRoot(Path root) {
        Path normalized = root.toAbsolutePath().normalize();
        try {
            return Files.exists(normalized) ? normalized.toRealPath() : normalized;
        } catch (IOException e) {
            return normalized;
        }
    }

    /**
     * Path relative to the workspace root, with forward slashes, or the path
     * itself when it lies elsewhere.
     */
    static String display(Path root, Path path) {
        if (path.startsWith(root)) {
            String relative = root.relativize(path).toString().replace('\\', '/');
            return relative.isEmpty() ? "." : relative;
        }
        return path.toString();
    }

    static Path argument(Object value) {
        return Paths.get(String.valueOf(value));
    }
}
