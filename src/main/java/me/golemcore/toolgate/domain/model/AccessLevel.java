package me.golemcore.toolgate.domain.model;

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

import java.util.Locale;

/**
 * Global access level of the policy.
 */
public enum AccessLevel {

    /** Every command tool call asks for approval. */
    DENY,

    /** Allowlisted commands run directly, everything else asks. */
    ALLOWLIST,

    /** Everything runs without asking. Origin deny lists still apply. */
    FULL;

    public static AccessLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return ALLOWLIST;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid access level: " + value + " (valid: deny, allowlist, full)", e);
        }
    }
}
