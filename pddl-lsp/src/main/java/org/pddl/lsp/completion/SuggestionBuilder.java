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

import java.util.List;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.InsertTextFormat;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

/**
 * Renders suggestions as snippet completion items, using one documentation table for
 * detail text, markdown and item kind.
 */
public class SuggestionBuilder {

    private final SuggestionDocumentation documentation;

    public SuggestionBuilder(SuggestionDocumentation documentation) {
        this.documentation = documentation;
    }

    /**
     * @param range text to replace, or {@code null} to insert at the cursor
     * @param index position of the suggestion in grammar order
     */
    public CompletionItem createSnippetItem(Suggestion suggestion, String snippet, Range range, int index) {
        CompletionItem item = new CompletionItem(suggestion.sectionName());
        item.setKind(CompletionItemKind.Keyword);
        item.setInsertTextFormat(InsertTextFormat.Snippet);
        if (range != null) {
            item.setTextEdit(Either.forLeft(new TextEdit(range, snippet)));
        } else {
            item.setInsertText(snippet);
        }

        documentation.get(suggestion.sectionName()).ifPresent(details -> {
            if (details.kind() != null) {
                item.setKind(details.kind());
            }
            item.setDetail(details.detail());
            if (!details.documentation().isEmpty()) {
                item.setDocumentation(markdown(details.documentation()));
            }
        });
        item.setFilterText(suggestion.filterText());
        item.setSortText(sortText(index));
        return item;
    }

    /**
     * Generic rendering for names without a dedicated template.
     *
     * @param bracketed whether the name opens a bracket, as top level sections do
     */
    public CompletionItem createKeywordItem(Suggestion suggestion, boolean bracketed, Range range, int index) {
        String name = escape(suggestion.sectionName());
        return createSnippetItem(suggestion, bracketed ? "(" + name + " $0)" : name + " $0", range, index);
    }

    /** Snippet item that does not come from a grammar table, e.g. a file skeleton. */
    public static CompletionItem createTemplateItem(String label, String snippet, String detail, CompletionItemKind kind,
                                                    Range range, int index) {
        CompletionItem item = new CompletionItem(label);
        item.setKind(kind);
        item.setInsertTextFormat(InsertTextFormat.Snippet);
        if (range != null) {
            item.setTextEdit(Either.forLeft(new TextEdit(range, snippet)));
        } else {
            item.setInsertText(snippet);
        }
        item.setDetail(detail);
        item.setSortText(sortText(index));
        return item;
    }

    /** Plain text item for a symbol declared in the document, e.g. a predicate or a type. */
    public static CompletionItem createSymbolItem(String label, String insertText, String detail, String documentation,
                                                  CompletionItemKind kind, int index) {
        CompletionItem item = new CompletionItem(label);
        item.setKind(kind);
        item.setInsertText(insertText);
        item.setInsertTextFormat(InsertTextFormat.PlainText);
        item.setDetail(detail);
        if (documentation != null && !documentation.isEmpty()) {
            item.setDocumentation(markdown(documentation));
        }
        item.setSortText(sortText(index));
        return item;
    }

    public static MarkupContent markdown(String text) {
        return new MarkupContent(MarkupKind.MARKDOWN, text);
    }

    /** Sort key keeping items in grammar order; zero padded so that item10 sorts after item9. */
    public static String sortText(int index) {
        return String.format("item%03d", index);
    }

    /**
     * Snippet placeholder offering the given names as a choice, or a plain placeholder
     * with the default text when there is nothing to choose from.
     */
    public static String toSelection(int tabstop, List<String> options, String orDefault) {
        if (options.isEmpty()) {
            return "${" + tabstop + ":" + orDefault + "}";
        }
        return "${" + tabstop + "|" + String.join(",", options.stream().map(SuggestionBuilder::escapeChoice).toList()) + "|}";
    }

    /** Escapes snippet syntax characters in literal text. */
    public static String escape(String text) {
        return text.replace("\\", "\\\\").replace("$", "\\$").replace("}", "\\}");
    }

    private static String escapeChoice(String option) {
        return escape(option).replace(",", "\\,").replace("|", "\\|");
    }
}
