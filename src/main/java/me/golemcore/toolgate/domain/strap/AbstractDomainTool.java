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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.component.DomainToolComponent;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolDefinition;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for domain tools. Routes every call through
 * {@link StrapDomain#route(String, String)} before the handler runs, so no
 * subclass can accept an action outside its declared set.
 *
 * @param <R>
 *            resource enum
 * @param <A>
 *            action enum
 */
@Slf4j
public abstract class AbstractDomainTool<R extends Enum<R> & StrapResource, A extends Enum<A> & StrapAction>
        implements DomainToolComponent {

    protected static final String PARAM_RESOURCE = "resource";
    protected static final String PARAM_ACTION = "action";

    private final StrapDomain<R, A> strap;
    private volatile ToolDefinition definition;

    protected AbstractDomainTool(StrapDomain<R, A> strap) {
        this.strap = strap;
    }

    protected StrapDomain<R, A> strap() {
        return strap;
    }

    /**
     * Builds the definition once. Called lazily on first access.
     */
    protected abstract ToolDefinition buildDefinition();

    /**
     * Handles a validated call.
     */
    protected abstract CompletableFuture<ToolResult> handle(RequestContext context, StrapRoute<R, A> route,
            Map<String, Object> parameters);

    @Override
    public final ToolDefinition getDefinition() {
        ToolDefinition result = definition;
        if (result == null) {
            synchronized (this) {
                result = definition;
                if (result == null) {
                    result = buildDefinition();
                    definition = result;
                }
            }
        }
        return result;
    }

    @Override
    public String getToolName() {
        return strap.getName();
    }

    @Override
    public String getDomain() {
        return strap.getName();
    }

    @Override
    public List<String> getResources() {
        return strap.resourceNames();
    }

    @Override
    public List<String> getActionsFor(String resource) {
        return strap.actionNames(resource);
    }

    @Override
    public final CompletableFuture<ToolResult> execute(RequestContext context, Map<String, Object> parameters) {
        StrapRoute<R, A> route;
        try {
            route = resolve(parameters);
        } catch (StrapValidationException e) {
            log.debug("[{}] Rejected call: {}", strap.getName(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage()));
        }
        return handle(context, route, parameters);
    }

    /**
     * Validates the resource and action of a call without running it.
     */
    public StrapRoute<R, A> resolve(Map<String, Object> parameters) throws StrapValidationException {
        return strap.route(stringParam(parameters, PARAM_RESOURCE), stringParam(parameters, PARAM_ACTION));
    }

    protected static String stringParam(Map<String, Object> parameters, String name) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(name);
        return value != null ? value.toString() : null;
    }

    protected static String requireParam(Map<String, Object> parameters, String name, StrapRoute<?, ?> route)
            throws StrapValidationException {
        String value = stringParam(parameters, name);
        if (value == null || value.isBlank()) {
            throw new StrapValidationException(name + " is required for action '" + route.action().wireName() + "'");
        }
        return value;
    }
}
