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

import me.golemcore.toolgate.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates the JSON schema and the agent-facing description of a domain tool
 * from its {@link StrapDomain}. Output is deterministic for a given domain.
 */
public final class StrapSchemaBuilder {

    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";
    private static final String STRING = "string";

    private StrapSchemaBuilder() {
    }

    public static ToolDefinition definition(StrapDomain<?, ?> domain, String description, List<StrapField> fields,
            List<String> examples) {
        return ToolDefinition.builder()
                .name(domain.getName())
                .description(description(domain, description, examples))
                .inputSchema(schema(domain, description, fields, examples))
                .build();
    }

    public static Map<String, Object> schema(StrapDomain<?, ?> domain, String description, List<StrapField> fields,
            List<String> examples) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        required.add("action");

        if (!domain.isSingleResource()) {
            List<String> resources = domain.resourceNames();
            properties.put("resource", Map.of(
                    TYPE, STRING,
                    DESCRIPTION, "Resource type: " + String.join(", ", resources),
                    "enum", resources));
        }

        List<String> actions = domain.allActionNames();
        properties.put("action", Map.of(
                TYPE, STRING,
                DESCRIPTION, "Action to perform: " + String.join(", ", actions),
                "enum", actions));

        for (StrapField field : fields) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put(TYPE, field.getType());
            property.put(DESCRIPTION, fieldDescription(field));
            if (!field.getEnumValues().isEmpty()) {
                property.put("enum", field.getEnumValues());
            }
            if (field.getDefaultValue() != null) {
                property.put("default", field.getDefaultValue());
            }
            if ("array".equals(field.getType())) {
                property.put("items", Map.of(TYPE, field.getItems() != null ? field.getItems() : STRING));
            }
            properties.put(field.getName(), Collections.unmodifiableMap(property));
            if (field.isRequired()) {
                required.add(field.getName());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, "object");
        schema.put(DESCRIPTION, withExamples(new StringBuilder(description), examples));
        schema.put("properties", Collections.unmodifiableMap(properties));
        schema.put("required", List.copyOf(required));
        return Collections.unmodifiableMap(schema);
    }

    public static String description(StrapDomain<?, ?> domain, String description, List<String> examples) {
        StringBuilder text = new StringBuilder(description);
        text.append("\n\nResources and Actions:");
        domain.resources().forEach(resource -> {
            text.append("\n- ").append(resource.wireName()).append(": ")
                    .append(String.join(", ", domain.actionNames(resource.wireName())));
            if (!resource.description().isEmpty()) {
                text.append(" (").append(resource.description()).append(')');
            }
        });
        return withExamples(text, examples);
    }

    private static String fieldDescription(StrapField field) {
        String text = field.getDescription() != null ? field.getDescription() : "";
        if (field.getRequiredFor().isEmpty()) {
            return text;
        }
        return text + " (required for: " + String.join(", ", field.getRequiredFor()) + ")";
    }

    private static String withExamples(StringBuilder text, List<String> examples) {
        if (!examples.isEmpty()) {
            text.append("\n\nExamples:\n");
            examples.forEach(example -> text.append("  ").append(example).append('\n'));
        }
        return text.toString();
    }
}
