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

package me.golemcore.warden.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.ContentBlob;
import me.golemcore.warden.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Content-addressed, gzip-compressed store for attachment bytes.
 *
 * <p>
 * Blobs are keyed by the SHA-256 of their uncompressed content and stored as
 * {@code blobs/<hash>.gz}. The reference index {@code blobs/index.json} counts
 * how many sources point at each blob; a blob is deleted when its count drops
 * to zero. {@link #put} writes the bytes and takes the caller's reference
 * under the same lock as {@link #release}, so a concurrent release can never
 * reclaim content a caller is about to point at. A caller that fails to commit
 * the owning session releases what it took; a crash in between leaves a count
 * that {@link #reconcile} corrects from the committed sessions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentBlobStore {

    private static final String BLOBS_DIR = "blobs";
    private static final String INDEX_FILE = "index.json";
    private static final String BLOB_EXTENSION = ".gz";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ContentBlob> index = new LinkedHashMap<>();

    @PostConstruct
    public synchronized void init() {
        index.clear();
        for (ContentBlob blob : loadIndex()) {
            index.put(blob.getHash(), blob);
        }
        log.info("[Blob] Loaded index with {} blobs", index.size());
    }

    public static String hash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Makes sure the content is stored and takes one reference to it.
     *
     * @return the content hash
     */
    public synchronized String put(byte[] content) {
        String hash = hash(content);
        ContentBlob blob = index.get(hash);
        if (blob == null) {
            byte[] compressed = compress(content);
            if (blobExists(hash)) {
                log.debug("[Blob] Content {} already on disk, re-indexing", hash);
            } else {
                join(storagePort.putObject(BLOBS_DIR, hash + BLOB_EXTENSION, compressed), "write blob " + hash);
                log.debug("[Blob] Stored {} ({} -> {} bytes)", hash, content.length, compressed.length);
            }
            blob = ContentBlob.builder()
                    .hash(hash)
                    .originalSize(content.length)
                    .compressedSize(compressed.length)
                    .referenceCount(0)
                    .createdAt(clock.instant())
                    .build();
        }
        ContentBlob previous = index.put(hash, blob.toBuilder().referenceCount(blob.getReferenceCount() + 1).build());
        try {
            persistIndex();
        } catch (RuntimeException e) {
            if (previous != null) {
                index.put(hash, previous);
            } else {
                index.remove(hash);
            }
            throw e;
        }
        return hash;
    }

    /**
     * Drops one reference per entry and reclaims blobs no longer referenced.
     */
    public synchronized void release(Collection<String> hashes) {
        if (hashes.isEmpty()) {
            return;
        }
        List<String> reclaimed = new ArrayList<>();
        for (String hash : hashes) {
            ContentBlob blob = index.get(hash);
            if (blob == null) {
                log.warn("[Blob] Release of unknown blob {}", hash);
                continue;
            }
            int remaining = blob.getReferenceCount() - 1;
            if (remaining <= 0) {
                index.remove(hash);
                reclaimed.add(hash);
            } else {
                index.put(hash, blob.toBuilder().referenceCount(remaining).build());
            }
        }
        persistIndex();
        for (String hash : reclaimed) {
            join(storagePort.deleteObject(BLOBS_DIR, hash + BLOB_EXTENSION), "delete blob " + hash);
            log.info("[Blob] Reclaimed {}", hash);
        }
    }

    public synchronized Optional<ContentBlob> get(String hash) {
        return Optional.ofNullable(index.get(hash));
    }

    public synchronized List<ContentBlob> listAll() {
        return List.copyOf(index.values());
    }

    /**
     * Decompressed content of a referenced blob.
     */
    public Optional<byte[]> read(String hash) {
        synchronized (this) {
            if (!index.containsKey(hash)) {
                return Optional.empty();
            }
        }
        return readCompressed(hash).map(this::decompress);
    }

    /**
     * Replaces the reference counts with the ones observed in committed
     * sessions, and deletes stored blobs that nothing references.
     *
     * @param referenceCounts
     *            hash to number of sources pointing at it
     */
    public synchronized void reconcile(Map<String, Integer> referenceCounts) {
        Set<String> stored = new HashSet<>();
        for (String file : join(storagePort.listObjects(BLOBS_DIR, ""), "list blobs")) {
            if (file.endsWith(BLOB_EXTENSION) && !file.contains("/")) {
                stored.add(file.substring(0, file.length() - BLOB_EXTENSION.length()));
            }
        }

        Map<String, ContentBlob> rebuilt = new LinkedHashMap<>();
        int corrected = 0;
        for (Map.Entry<String, Integer> entry : referenceCounts.entrySet()) {
            String hash = entry.getKey();
            if (!stored.contains(hash)) {
                log.warn("[Blob] Referenced blob {} is missing from storage", hash);
                continue;
            }
            ContentBlob existing = index.get(hash);
            if (existing == null || existing.getReferenceCount() != entry.getValue()) {
                corrected++;
            }
            ContentBlob base = existing != null ? existing : describe(hash);
            rebuilt.put(hash, base.toBuilder().referenceCount(entry.getValue()).build());
        }

        List<String> orphans = stored.stream().filter(hash -> !rebuilt.containsKey(hash)).sorted().toList();
        boolean changed = corrected > 0 || !orphans.isEmpty() || !rebuilt.keySet().equals(index.keySet());
        index.clear();
        index.putAll(rebuilt);
        if (changed) {
            persistIndex();
        }
        for (String hash : orphans) {
            join(storagePort.deleteObject(BLOBS_DIR, hash + BLOB_EXTENSION), "delete blob " + hash);
        }
        if (changed) {
            log.info("[Blob] Reconciled index: {} blobs, {} counts corrected, {} orphans reclaimed",
                    rebuilt.size(), corrected, orphans.size());
        }
    }

    private ContentBlob describe(String hash) {
        byte[] compressed = readCompressed(hash).orElse(new byte[0]);
        return ContentBlob.builder()
                .hash(hash)
                .originalSize(compressed.length == 0 ? 0 : decompress(compressed).length)
                .compressedSize(compressed.length)
                .createdAt(clock.instant())
                .build();
    }

    private boolean blobExists(String hash) {
        return Boolean.TRUE.equals(join(storagePort.exists(BLOBS_DIR, hash + BLOB_EXTENSION), "check blob"));
    }

    private Optional<byte[]> readCompressed(String hash) {
        return Optional.ofNullable(join(storagePort.getObject(BLOBS_DIR, hash + BLOB_EXTENSION), "read blob"));
    }

    private List<ContentBlob> loadIndex() {
        try {
            String json = storagePort.getText(BLOBS_DIR, INDEX_FILE).join();
            if (json == null || json.isBlank()) {
                return List.of();
            }
            return objectMapper.readValue(json, new TypeReference<List<ContentBlob>>() {
            });
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Blob] Failed to load blob index, starting empty: {}", e.getMessage());
            return List.of();
        }
    }

    private void persistIndex() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new ArrayList<>(index.values()));
            join(storagePort.putTextAtomic(BLOBS_DIR, INDEX_FILE, json), "write blob index");
        } catch (JsonProcessingException e) {
            throw new StoragePort.StorageException("Failed to serialize blob index", e);
        }
    }

    private static byte[] compress(byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(content);
        } catch (IOException e) {
            throw new StoragePort.StorageException("Failed to compress blob", e);
        }
        return out.toByteArray();
    }

    private byte[] decompress(byte[] compressed) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StoragePort.StorageException("Failed to decompress blob", e);
        }
    }

    private static <T> T join(CompletableFuture<T> future, String action) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StoragePort.StorageException storageException) {
                throw storageException;
            }
            throw new StoragePort.StorageException("Failed to " + action, cause);
        }
    }
}
