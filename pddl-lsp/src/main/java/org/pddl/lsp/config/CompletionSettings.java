/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.pddl.lsp.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User settings that change which completions are offered.
 *
 * <p>Read from the {@code initializationOptions} of the LSP {@code initialize} request
 * and from {@code workspace/didChangeConfiguration}:</p>
 * <pre>{@code
 * { "pddl": { "jobScheduling": true } }
 * }</pre>
 *
 * <p>Built programmatically with:</p>
 * <pre>{@code
 * CompletionSettings settings = CompletionSettings.builder()
 *     .jobScheduling(true)
 *     .build();
 * }</pre>
 */
public final class CompletionSettings {

    private static final Logger LOG = LoggerFactory.getLogger(CompletionSettings.class);

    public static final String SECTION = "pddl";
    public static final String JOB_SCHEDULING = "jobScheduling";

    private static final CompletionSettings DEFAULTS = builder().build();

    private final boolean jobScheduling;

    private CompletionSettings(boolean jobScheduling) {
        this.jobScheduling = jobScheduling;
    }

    public static CompletionSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Whether the {@code :job} structure and {@code :job-scheduling} requirement are offered. */
    public boolean isJobScheduling() {
        return jobScheduling;
    }

    /**
     * Reads the settings from an LSP settings payload. Accepts either the whole settings
     * object, with the values under {@code "pddl"}, or the {@code "pddl"} object itself.
     * Unrecognized payloads yield the defaults.
     */
    public static CompletionSettings fromJson(Object payload) {
        if (!(payload instanceof JsonObject json)) {
            if (payload != null) {
                LOG.debug("Ignoring settings payload of type {}", payload.getClass().getName());
            }
            return DEFAULTS;
        }
        JsonObject section = json.has(SECTION) && json.get(SECTION).isJsonObject()
                ? json.getAsJsonObject(SECTION)
                : json;
        return builder()
                .jobScheduling(booleanValue(section.get(JOB_SCHEDULING), DEFAULTS.jobScheduling))
                .build();
    }

    private static boolean booleanValue(JsonElement element, boolean defaultValue) {
        if (element instanceof JsonPrimitive primitive) {
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            } else if (primitive.isString()) {
                return Boolean.parseBoolean(primitive.getAsString());
            }
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "CompletionSettings{jobScheduling=" + jobScheduling + "}";
    }

    public static final class Builder {

        private boolean jobScheduling;

        private Builder() {
        }

        public Builder jobScheduling(boolean jobScheduling) {
            this.jobScheduling = jobScheduling;
            return this;
        }

        public CompletionSettings build() {
            return new CompletionSettings(jobScheduling);
        }
    }
}
