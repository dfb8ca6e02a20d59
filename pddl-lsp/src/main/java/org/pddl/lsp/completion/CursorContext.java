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

import org.eclipse.lsp4j.Range;
import org.pddl.lsp.model.PddlDocumentModel;
import org.pddl.lsp.syntax.SyntaxNode;

/**
 * Cursor of one completion request: the document snapshot, the offset and the innermost
 * syntax node covering it.
 */
public record CursorContext(PddlDocumentModel document, int offset, SyntaxNode node, CompletionRequest request) {

    /** Source text from the start of {@code from} up to the cursor. */
    public String textBefore(SyntaxNode from) {
        String text = document.getText();
        int start = Math.min(from.getStart(), offset);
        return text.substring(start, Math.min(offset, text.length()));
    }

    /** Range from the start of {@code from} to the cursor, covering what the user just typed. */
    public Range rangeFrom(SyntaxNode from) {
        return new Range(document.positionAt(from.getStart()), document.positionAt(offset));
    }
}
