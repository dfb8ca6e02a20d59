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

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.Range;
import org.pddl.lsp.config.CompletionSettings;

/**
 * Requirement flags offered inside {@code (:requirements}, shared by domain and problem files.
 */
class RequirementsCompletions {

    private final SuggestionBuilder builder = new SuggestionBuilder(SuggestionDocumentation.DOMAIN);

    List<CompletionItem> provide(CursorContext cursor, CompletionSettings settings) {
        CompletionRequest request = cursor.request();
        Range range = request.replacesTriggerText() ? cursor.rangeFrom(cursor.node()) : null;

        List<String> requirements = SectionGrammar.requirements(settings);
        List<CompletionItem> items = new ArrayList<>();
        for (int index = 0; index < requirements.size(); index++) {
            String requirement = requirements.get(index);
            int sortIndex = index;
            Suggestion.from(requirement, request, "")
                    .map(suggestion -> builder.createSnippetItem(suggestion, requirement, range, sortIndex))
                    .ifPresent(items::add);
        }
        return items;
    }
}
