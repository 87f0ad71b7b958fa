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

package me.golemcore.warden.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.warden.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

/**
 * Serves stored attachment content by hash.
 */
@RestController
@RequestMapping("/api/blobs")
@RequiredArgsConstructor
public class BlobsController {

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    private final SessionPort sessionPort;

    @GetMapping("/{hash}")
    public Mono<ResponseEntity<byte[]>> getBlob(@PathVariable String hash) {
        if (!SHA256_HEX.matcher(hash).matches()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid content hash");
        }
        byte[] content = sessionPort.readContent(hash)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Content not found"));
        return Mono.just(ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(content));
    }
}
