package me.golemcore.toolgate.domain.catalog;

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

import me.golemcore.toolgate.domain.model.Capability;

import java.util.List;

/**
 * Contributes capability descriptors to the catalog. Providers are collected
 * once at startup in {@link org.springframework.core.annotation.Order} order;
 * each returns its descriptors in a fixed, explicit order.
 */
public interface CapabilityProvider {

    List<Capability> capabilities();
}
