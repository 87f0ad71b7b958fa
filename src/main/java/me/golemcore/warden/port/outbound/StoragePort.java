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

package me.golemcore.warden.port.outbound;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage operations. Provides file operations organized
 * by directory (sessions, blobs, policy) with binary, text and crash-safe
 * atomic writes.
 */
public interface StoragePort {

    /**
     * Write binary content to file.
     *
     * @param directory
     *            subdirectory (e.g., "sessions", "blobs", "policy")
     * @param path
     *            relative path within directory
     * @param content
     *            binary content
     */
    CompletableFuture<Void> putObject(String directory, String path, byte[] content);

    /**
     * Read binary content from file, or {@code null} when absent.
     */
    CompletableFuture<byte[]> getObject(String directory, String path);

    /**
     * Read text content from file, or {@code null} when absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write text content to file.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     * Readers see either the previous content or the new content, never a mix.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Failure of the underlying storage. Fatal for the request that caused it;
     * previously committed data stays untouched.
     */
    class StorageException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public StorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
