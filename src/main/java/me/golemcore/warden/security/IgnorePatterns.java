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

package me.golemcore.warden.security;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Compiled project ignore list.
 *
 * <p>
 * Globs follow the usual conventions: {@code *} matches within one path
 * segment, {@code **} across segments, {@code ?} one character. A glob without
 * a slash matches any single segment name (so {@code node_modules} hides the
 * whole directory); a glob with a slash is matched against the path relative
 * to the workspace root, and also hides everything beneath a matching
 * directory. Blank lines and {@code #} comments are skipped.
 */
@Slf4j
public final class IgnorePatterns {

    private static final IgnorePatterns EMPTY = new IgnorePatterns(List.of());

    private final List<Rule> rules;

    private IgnorePatterns(List<Rule> rules) {
        this.rules = rules;
    }

    public static IgnorePatterns empty() {
        return EMPTY;
    }

    public static IgnorePatterns compile(Collection<String> globs) {
        List<Rule> compiled = new ArrayList<>();
        for (String line : globs) {
            String glob = line == null ? "" : line.trim();
            if (glob.isEmpty() || glob.startsWith("#")) {
                continue;
            }
            compiled.add(Rule.of(glob));
        }
        return new IgnorePatterns(List.copyOf(compiled));
    }

    /**
     * Loads the ignore file (when present) and appends the extra globs.
     */
    public static IgnorePatterns load(Path ignoreFile, Collection<String> extraGlobs) {
        List<String> globs = new ArrayList<>();
        if (ignoreFile != null && Files.isRegularFile(ignoreFile)) {
            try {
                globs.addAll(Files.readAllLines(ignoreFile, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("[Gate] Failed to read ignore file {}: {}", ignoreFile, e.getMessage());
            }
        }
        if (extraGlobs != null) {
            globs.addAll(extraGlobs);
        }
        return compile(globs);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Returns the first glob matching the given workspace-relative path.
     *
     * @param relativePath
     *            path relative to the workspace root
     */
    public Optional<String> match(Path relativePath) {
        String unixPath = relativePath.toString().replace('\\', '/');
        if (unixPath.isEmpty()) {
            return Optional.empty();
        }
        for (Rule rule : rules) {
            if (rule.matches(unixPath)) {
                return Optional.of(rule.glob());
            }
        }
        return Optional.empty();
    }

    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                if (doubleStar) {
                    boolean leadingSegment = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                    if (leadingSegment) {
                        regex.append("(?:.*/)?");
                        i += 3;
                    } else {
                        regex.append(".*");
                        i += 2;
                    }
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
            i++;
        }
        return regex.toString();
    }

    private record Rule(String glob, Pattern pattern, boolean segmentOnly) {

        static Rule of(String glob) {
            String body = glob;
            while (body.endsWith("/") && body.length() > 1) {
                body = body.substring(0, body.length() - 1);
            }
            boolean segmentOnly = !body.contains("/");
            if (body.startsWith("/")) {
                body = body.substring(1);
            }
            String regex = segmentOnly
                    ? "^" + globToRegex(body) + "$"
                    : "^" + globToRegex(body) + "(?:/.*)?$";
            return new Rule(glob, Pattern.compile(regex), segmentOnly);
        }

        boolean matches(String unixPath) {
            if (!segmentOnly) {
                return pattern.matcher(unixPath).matches();
            }
            for (String segment : unixPath.split("/")) {
                if (pattern.matcher(segment).matches()) {
                    return true;
                }
            }
            return false;
        }
    }
}
