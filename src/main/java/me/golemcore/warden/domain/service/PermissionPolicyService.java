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
import me.golemcore.warden.domain.model.PermissionEffect;
import me.golemcore.warden.domain.model.PermissionRule;
import me.golemcore.warden.domain.model.PolicyDecision;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.PermissionPolicyPort;
import me.golemcore.warden.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Permission policy backed by an immutable rule snapshot.
 *
 * <p>
 * Readers take the current snapshot without locking. Writers are serialized,
 * build the next snapshot, persist it, and only then swap it in, so a reader
 * sees either the old rule set or the new one and a failed write leaves the
 * old one in force.
 *
 * <p>
 * Rules live in {@code policy/permissions.json}. Rules from
 * {@code warden.permissions.allow/deny} are merged in at startup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PermissionPolicyService implements PermissionPolicyPort {

    private static final String POLICY_DIR = "policy";
    private static final String POLICY_FILE = "permissions.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final WardenProperties properties;

    private final AtomicReference<PolicySnapshot> snapshot = new AtomicReference<>(PolicySnapshot.EMPTY);
    private final Object writeLock = new Object();

    @PostConstruct
    public void init() {
        List<PermissionRule> rules = new ArrayList<>(loadPersisted());
        for (String subject : properties.getPermissions().getAllow()) {
            addIfAbsent(rules, PermissionRule.allow(subject.trim()));
        }
        for (String subject : properties.getPermissions().getDeny()) {
            addIfAbsent(rules, PermissionRule.deny(subject.trim()));
        }
        snapshot.set(PolicySnapshot.of(rules));
        log.info("[Policy] Loaded {} permission rules", rules.size());
    }

    @Override
    public PolicyDecision decide(String toolName, String scopeHint) {
        PolicySnapshot current = snapshot.get();
        if (scopeHint != null && !scopeHint.isBlank()) {
            PermissionEffect scoped = current.effectFor(PermissionRule.subjectOf(toolName, scopeHint));
            if (scoped != null) {
                log.debug("[Policy] {}:{} -> {} (scoped rule)", toolName, scopeHint, scoped);
                return toDecision(scoped);
            }
        }
        PermissionEffect bare = current.effectFor(toolName);
        if (bare != null) {
            log.debug("[Policy] {} -> {} (tool rule)", toolName, bare);
            return toDecision(bare);
        }
        return PolicyDecision.ASK;
    }

    @Override
    public void addRule(PermissionRule rule) {
        if (rule == null || rule.getSubject() == null || rule.getSubject().isBlank() || rule.getEffect() == null) {
            throw new IllegalArgumentException("Rule needs a subject and an effect");
        }
        synchronized (writeLock) {
            List<PermissionRule> rules = new ArrayList<>(snapshot.get().rules());
            if (!addIfAbsent(rules, rule)) {
                return;
            }
            PolicySnapshot next = PolicySnapshot.of(rules);
            persist(next);
            snapshot.set(next);
        }
        log.info("[Policy] Added rule: {} {}", rule.getEffect(), rule.getSubject());
    }

    @Override
    public boolean removeRule(String subject) {
        synchronized (writeLock) {
            List<PermissionRule> rules = new ArrayList<>(snapshot.get().rules());
            boolean removed = rules.removeIf(rule -> rule.getSubject().equals(subject));
            if (!removed) {
                return false;
            }
            PolicySnapshot next = PolicySnapshot.of(rules);
            persist(next);
            snapshot.set(next);
        }
        log.info("[Policy] Removed rules for {}", subject);
        return true;
    }

    @Override
    public List<PermissionRule> getRules() {
        return snapshot.get().rules().stream()
                .map(rule -> new PermissionRule(rule.getSubject(), rule.getEffect()))
                .toList();
    }

    private static boolean addIfAbsent(List<PermissionRule> rules, PermissionRule rule) {
        if (rule.getSubject().isEmpty() || rules.contains(rule)) {
            return false;
        }
        rules.add(new PermissionRule(rule.getSubject(), rule.getEffect()));
        return true;
    }

    private static PolicyDecision toDecision(PermissionEffect effect) {
        return effect == PermissionEffect.DENY ? PolicyDecision.DENY : PolicyDecision.ALLOW;
    }

    private List<PermissionRule> loadPersisted() {
        try {
            String json = storagePort.getText(POLICY_DIR, POLICY_FILE).join();
            if (json == null || json.isBlank()) {
                return List.of();
            }
            return objectMapper.readValue(json, new TypeReference<List<PermissionRule>>() {
            });
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Policy] Failed to load persisted rules, starting from configuration: {}", e.getMessage());
            return List.of();
        }
    }

    private void persist(PolicySnapshot next) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(next.rules());
            storagePort.putTextAtomic(POLICY_DIR, POLICY_FILE, json).join();
        } catch (JsonProcessingException e) {
            throw new StoragePort.StorageException("Failed to serialize permission rules", e);
        } catch (CompletionException e) {
            throw new StoragePort.StorageException("Failed to persist permission rules", e.getCause());
        }
    }

    /**
     * Immutable rule list plus the effective effect per subject (deny wins).
     */
    private record PolicySnapshot(List<PermissionRule> rules, Map<String, PermissionEffect> effects) {

        static final PolicySnapshot EMPTY = new PolicySnapshot(List.of(), Map.of());

        static PolicySnapshot of(List<PermissionRule> rules) {
            Map<String, PermissionEffect> effects = new LinkedHashMap<>();
            for (PermissionRule rule : rules) {
                effects.merge(rule.getSubject(), rule.getEffect(),
                        (a, b) -> a == PermissionEffect.DENY || b == PermissionEffect.DENY
                                ? PermissionEffect.DENY
                                : PermissionEffect.ALLOW);
            }
            return new PolicySnapshot(List.copyOf(rules), Map.copyOf(effects));
        }

        PermissionEffect effectFor(String subject) {
            return effects.get(subject);
        }
    }
}
