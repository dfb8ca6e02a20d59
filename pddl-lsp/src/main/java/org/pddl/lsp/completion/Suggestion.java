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
package org.pddl.lsp.completion;

import java.util.Optional;

/**
 * Candidate name to offer, with the text the editor matches it against.
 *
 * @param sectionName section, keyword or symbol name, e.g. {@code :types}
 * @param filterText prefix plus the name, e.g. {@code (:types}
 */
public record Suggestion(String sectionName, String filterText) {

    /**
     * @param filterTextPrefix text the user types before the name, e.g. {@code (}
     * @return the suggestion, or empty when {@code :} was typed and the name does not start with it
     */
    public static Optional<Suggestion> from(String sectionName, CompletionRequest request, String filterTextPrefix) {
        if (request.isTriggeredBy(":") && !sectionName.startsWith(":")) {
            return Optional.empty();
        }
        return Optional.of(new Suggestion(sectionName, filterTextPrefix + sectionName));
    }
}
