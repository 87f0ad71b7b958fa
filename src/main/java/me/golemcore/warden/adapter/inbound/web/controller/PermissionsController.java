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
import me.golemcore.warden.adapter.inbound.web.dto.PermissionRuleRequest;
import me.golemcore.warden.domain.model.PermissionEffect;
import me.golemcore.warden.domain.model.PermissionRule;
import me.golemcore.warden.port.outbound.PermissionPolicyPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Permission rule administration.
 */
@RestController
@RequestMapping("/api/permissions")
@RequiredArgsConstructor
public class PermissionsController {

    private final PermissionPolicyPort permissionPolicy;

    @GetMapping
    public Mono<ResponseEntity<List<PermissionRule>>> listRules() {
        return Mono.just(ResponseEntity.ok(permissionPolicy.getRules()));
    }

    @PostMapping
    public Mono<ResponseEntity<List<PermissionRule>>> addRule(@RequestBody PermissionRuleRequest request) {
        if (request == null || request.getSubject() == null || request.getSubject().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "subject is required");
        }
        if (request.getEffect() == null || request.getEffect().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "effect is required (allow|deny)");
        }
        PermissionEffect effect = PermissionEffect.valueOf(request.getEffect().trim().toUpperCase(Locale.ROOT));
        permissionPolicy.addRule(new PermissionRule(request.getSubject().trim(), effect));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(permissionPolicy.getRules()));
    }

    @DeleteMapping
    public Mono<ResponseEntity<Void>> removeRule(@RequestParam String subject) {
        if (!permissionPolicy.removeRule(subject)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No rule for " + subject);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }
}
