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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Input field of a domain tool schema.
 */
@Value
@Builder
public class StrapField {

    String name;

    /** JSON type: string, integer, number, boolean, array or object. */
    @Builder.Default
    String type = "string";

    String description;
    boolean required;

    /** Actions for which the field must be present. */
    @Singular("requiredFor")
    List<String> requiredFor;

    @Singular("enumValue")
    List<String> enumValues;

    Object defaultValue;

    /** Item type for arrays; "string" when unset. */
    String items;

    public static StrapField string(String name, String description) {
        return StrapField.builder().name(name).description(description).build();
    }
}
