/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.textarchive.recovery;

import dev.mars.textarchive.archive.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entity types layered by {@link EntityType#dependencies()}.
 * <p>
 * Stage {@code n} holds the types whose dependencies all sit in earlier stages, so types
 * within a stage may be recovered concurrently while stages run one after another:
 * <pre>
 * 0: USER, ROLE
 * 1: ROLE_ASSIGNMENT, PRAYER, AUTH_REQUEST, SESSION, INVITE_TOKEN, SECURITY_EVENT
 * 2: INTERACTION_MARK, INTERACTION_ATTRIBUTE, ACTIVITY_LOG, AUTH_APPROVAL, INVITE_USAGE, NOTIFICATION
 * </pre>
 */
public final class RecoveryPlan {

    private static final List<List<EntityType>> STAGES = layer();

    private RecoveryPlan() {
    }

    public static List<List<EntityType>> stages() {
        return STAGES;
    }

    /** All types, dependencies first. */
    public static List<EntityType> order() {
        List<EntityType> order = new ArrayList<>();
        STAGES.forEach(order::addAll);
        return order;
    }

    private static List<List<EntityType>> layer() {
        Map<EntityType, Set<EntityType>> remaining = new EnumMap<>(EntityType.class);
        for (EntityType t : EntityType.values()) {
            remaining.put(t, EnumSet.noneOf(EntityType.class));
            remaining.get(t).addAll(t.dependencies());
        }
        List<List<EntityType>> stages = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<EntityType> ready = new ArrayList<>();
            remaining.forEach((type, deps) -> {
                if (deps.isEmpty()) {
                    ready.add(type);
                }
            });
            if (ready.isEmpty()) {
                throw new IllegalStateException("Entity dependency cycle among " + remaining.keySet());
            }
            ready.forEach(remaining::remove);
            remaining.values().forEach(deps -> ready.forEach(deps::remove));
            stages.add(Collections.unmodifiableList(ready));
        }
        return Collections.unmodifiableList(stages);
    }
}
