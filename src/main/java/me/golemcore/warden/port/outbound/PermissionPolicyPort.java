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

import me.golemcore.warden.domain.model.PermissionRule;
import me.golemcore.warden.domain.model.PolicyDecision;

import java.util.List;

/**
 * Allow/deny rules consulted before a tool call is escalated to the human.
 *
 * <p>
 * Lookup order: exact {@code tool:scope} subject, then bare tool name, then
 * {@link PolicyDecision#ASK}. A deny rule outranks an allow rule for the same
 * subject. Updates are visible to the next lookup from any session.
 */
public interface PermissionPolicyPort {

    PolicyDecision decide(String toolName, String scopeHint);

    void addRule(PermissionRule rule);

    /**
     * Removes every rule for the subject.
     *
     * @return true when at least one rule was removed
     */
    boolean removeRule(String subject);

    /**
     * Current ordered rule list, as an immutable snapshot.
     */
    List<PermissionRule> getRules();
}
