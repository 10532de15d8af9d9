package me.golemcore.toolgate.domain.strap;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resource/action table of one domain tool with the shared routing rules.
 *
 * <p>
 * Routing applies, in order:
 * <ol>
 * <li>alias normalization of the resource name (case-insensitive)</li>
 * <li>resource inference when the resource is omitted: a single-resource domain
 * always uses its resource, otherwise the action must belong to exactly one
 * resource</li>
 * <li>validation of the action against the resource's declared set</li>
 * </ol>
 * Every failure names the valid resources or actions so the agent can retry.
 *
 * @param <R>
 *            resource enum
 * @param <A>
 *            action enum
 */
public final class StrapDomain<R extends Enum<R> & StrapResource, A extends Enum<A> & StrapAction> {

    private final String name;
    private final Map<R, Set<A>> actions;
    private final Map<String, R> resourcesByName;
    private final Map<String, A> actionsByName;

    private StrapDomain(String name, Map<R, Set<A>> actions, Map<String, R> aliases, Class<A> actionType) {
        this.name = name;
        this.actions = Collections.unmodifiableMap(actions);
        Map<String, R> byName = new LinkedHashMap<>();
        actions.keySet().forEach(resource -> byName.put(resource.wireName(), resource));
        byName.putAll(aliases);
        this.resourcesByName = Collections.unmodifiableMap(byName);
        Map<String, A> actionIndex = new LinkedHashMap<>();
        for (A action : actionType.getEnumConstants()) {
            actionIndex.put(action.wireName(), action);
        }
        this.actionsByName = Collections.unmodifiableMap(actionIndex);
    }

    public static <R extends Enum<R> & StrapResource, A extends Enum<A> & StrapAction> Builder<R, A> builder(
            String name, Class<R> resourceType, Class<A> actionType) {
        return new Builder<>(name, resourceType, actionType);
    }

    public String getName() {
        return name;
    }

    public Set<R> resources() {
        return actions.keySet();
    }

    public Set<A> actionsOf(R resource) {
        return actions.getOrDefault(resource, Set.of());
    }

    public List<String> resourceNames() {
        return actions.keySet().stream().map(StrapResource::wireName).collect(Collectors.toList());
    }

    /**
     * Actions of the named resource (aliases accepted). Unknown names yield an
     * empty list.
     */
    public List<String> actionNames(String resource) {
        R resolved = resolveResource(resource);
        if (resolved == null) {
            return List.of();
        }
        return wireNames(actionsOf(resolved));
    }

    /**
     * Union of all actions, in first-declared order.
     */
    public List<String> allActionNames() {
        Set<String> names = new LinkedHashSet<>();
        actions.values().forEach(set -> set.forEach(action -> names.add(action.wireName())));
        return new ArrayList<>(names);
    }

    public boolean isSingleResource() {
        return actions.size() == 1;
    }

    /**
     * Resolves and validates a call.
     *
     * @param resource
     *            resource from the call, may be blank
     * @param action
     *            action from the call
     * @return the validated route
     * @throws StrapValidationException
     *             when the pair does not name a declared route
     */
    public StrapRoute<R, A> route(String resource, String action) throws StrapValidationException {
        String actionName = normalize(action);
        if (actionName.isEmpty()) {
            throw new StrapValidationException("action is required (valid: " + String.join(", ", allActionNames())
                    + ")");
        }

        R resolved;
        String resourceName = normalize(resource);
        if (!resourceName.isEmpty()) {
            resolved = resourcesByName.get(resourceName);
            if (resolved == null) {
                throw new StrapValidationException("unknown resource: " + resource.trim() + " (valid: "
                        + String.join(", ", resourceNames()) + ")");
            }
        } else if (isSingleResource()) {
            resolved = actions.keySet().iterator().next();
        } else {
            resolved = inferResource(actionName);
        }

        A resolvedAction = actionsByName.get(actionName);
        if (resolvedAction == null || !actionsOf(resolved).contains(resolvedAction)) {
            throw new StrapValidationException("unknown action '" + action.trim() + "' for resource '"
                    + resolved.wireName() + "' (valid: " + String.join(", ", wireNames(actionsOf(resolved))) + ")");
        }
        return new StrapRoute<>(resolved, resolvedAction);
    }

    private R inferResource(String actionName) throws StrapValidationException {
        A candidate = actionsByName.get(actionName);
        List<R> owners = new ArrayList<>();
        if (candidate != null) {
            actions.forEach((resource, set) -> {
                if (set.contains(candidate)) {
                    owners.add(resource);
                }
            });
        }
        if (owners.size() == 1) {
            return owners.get(0);
        }
        if (owners.isEmpty()) {
            throw new StrapValidationException("unknown action '" + actionName + "' (valid resources: "
                    + String.join(", ", resourceNames()) + "; valid actions: "
                    + String.join(", ", allActionNames()) + ")");
        }
        throw new StrapValidationException("resource is required for action '" + actionName + "' (valid: "
                + owners.stream().map(StrapResource::wireName).collect(Collectors.joining(", ")) + ")");
    }

    private R resolveResource(String resource) {
        String normalized = normalize(resource);
        if (normalized.isEmpty()) {
            return isSingleResource() ? actions.keySet().iterator().next() : null;
        }
        return resourcesByName.get(normalized);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private List<String> wireNames(Set<A> set) {
        return set.stream().map(StrapAction::wireName).collect(Collectors.toList());
    }

    /**
     * Builder collecting resources in declaration order.
     */
    public static final class Builder<R extends Enum<R> & StrapResource, A extends Enum<A> & StrapAction> {

        private final String name;
        private final Class<R> resourceType;
        private final Class<A> actionType;
        private final Map<R, Set<A>> actions = new LinkedHashMap<>();
        private final Map<String, R> aliases = new LinkedHashMap<>();

        private Builder(String name, Class<R> resourceType, Class<A> actionType) {
            this.name = name;
            this.resourceType = resourceType;
            this.actionType = actionType;
        }

        @SafeVarargs
        public final Builder<R, A> resource(R resource, A... resourceActions) {
            if (resourceActions.length == 0) {
                throw new IllegalArgumentException("Resource " + resource.wireName() + " declares no actions");
            }
            Set<A> set = new LinkedHashSet<>(List.of(resourceActions));
            actions.put(resource, Collections.unmodifiableSet(set));
            return this;
        }

        public Builder<R, A> alias(String alias, R resource) {
            aliases.put(alias.toLowerCase(Locale.ROOT), resource);
            return this;
        }

        public StrapDomain<R, A> build() {
            if (actions.isEmpty()) {
                throw new IllegalStateException("Domain " + name + " declares no resources");
            }
            Map<String, R> wireNames = new LinkedHashMap<>();
            for (R constant : resourceType.getEnumConstants()) {
                wireNames.put(constant.wireName(), constant);
            }
            aliases.forEach((alias, target) -> {
                if (!actions.containsKey(target)) {
                    throw new IllegalStateException("Alias " + alias + " targets undeclared resource "
                            + target.wireName());
                }
                R shadowed = wireNames.get(alias);
                if (shadowed != null && shadowed != target) {
                    throw new IllegalStateException("Alias " + alias + " shadows resource " + shadowed.wireName());
                }
            });
            return new StrapDomain<>(name, new LinkedHashMap<>(actions), aliases, actionType);
        }
    }
}
