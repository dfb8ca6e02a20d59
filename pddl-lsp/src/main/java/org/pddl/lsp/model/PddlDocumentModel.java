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
package org.pddl.lsp.model;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.pddl.lsp.syntax.ConstructKind;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsed snapshot of a single PDDL document: source text, syntax tree, file kind and
 * the line index used to map LSP positions to offsets. A new model is built for every
 * document version, so a request always sees one consistent snapshot.
 */
public class PddlDocumentModel {

    private static final Logger LOG = LoggerFactory.getLogger(PddlDocumentModel.class);

    private final String uri;
    private final String text;
    private final SyntaxTree tree;
    private final FileKind fileKind;
    private final int[] lineOffsets;
    private DomainDeclarations declarations;

    public PddlDocumentModel(String uri, String text) {
        this.uri = uri;
        this.text = text;
        this.tree = SyntaxTree.parse(text);
        this.fileKind = detectFileKind(tree);
        this.lineOffsets = computeLineOffsets(text);
        LOG.debug("Parsed {} as {}", uri, fileKind);
    }

    private static FileKind detectFileKind(SyntaxTree tree) {
        SyntaxNode define = tree.getDefineNode();
        if (define == null) {
            return FileKind.UNKNOWN;
        }
        if (define.getFirstChild(ConstructKind.DOMAIN) != null) {
            return FileKind.DOMAIN;
        } else if (define.getFirstChild(ConstructKind.PROBLEM) != null) {
            return FileKind.PROBLEM;
        }
        return FileKind.UNKNOWN;
    }

    private static int[] computeLineOffsets(String text) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
                offsets.add(i + 1);
            } else if (c == '\n' || c == '\r') {
                offsets.add(i + 1);
            }
        }
        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    public String getUri() {
        return uri;
    }

    public String getText() {
        return text;
    }

    public SyntaxTree getTree() {
        return tree;
    }

    public FileKind getFileKind() {
        return fileKind;
    }

    /** Declarations of this document when it is a domain, otherwise empty. */
    public synchronized DomainDeclarations getDeclarations() {
        if (declarations == null) {
            declarations = fileKind == FileKind.DOMAIN ? DomainDeclarations.extract(tree) : DomainDeclarations.EMPTY;
        }
        return declarations;
    }

    /** Name in {@code (domain name)} or {@code (problem name)}, or {@code null}. */
    public String getName() {
        SyntaxNode define = tree.getDefineNode();
        if (define == null) {
            return null;
        }
        ConstructKind header = fileKind == FileKind.PROBLEM ? ConstructKind.PROBLEM : ConstructKind.DOMAIN;
        return firstWordIn(define.getFirstChild(header));
    }

    /** Domain a problem refers to in {@code (:domain name)}, or {@code null}. */
    public String getDomainReference() {
        SyntaxNode define = tree.getDefineNode();
        if (define == null) {
            return null;
        }
        return firstWordIn(define.getFirstChild(ConstructKind.DOMAIN_REFERENCE));
    }

    private static String firstWordIn(SyntaxNode bracket) {
        if (bracket == null) {
            return null;
        }
        return bracket.getNonWhitespaceChildren().stream()
                .filter(child -> !child.isOpenBracket())
                .map(child -> child.getToken().getText().trim())
                .filter(word -> !word.isEmpty() && !word.equals(")"))
                .findFirst()
                .orElse(null);
    }

    /**
     * Converts a 0-based LSP position to an offset into the text, clamping positions
     * beyond the end of a line or of the document.
     */
    public int offsetAt(Position position) {
        int line = position.getLine();
        if (line < 0) {
            return 0;
        }
        if (line >= lineOffsets.length) {
            return text.length();
        }
        int lineStart = lineOffsets[line];
        int lineEnd = line + 1 < lineOffsets.length ? lineOffsets[line + 1] : text.length();
        return Math.min(lineStart + Math.max(0, position.getCharacter()), lineEnd);
    }

    public Position positionAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int line = 0;
        while (line + 1 < lineOffsets.length && lineOffsets[line + 1] <= clamped) {
            line++;
        }
        return new Position(line, clamped - lineOffsets[line]);
    }

    public Range rangeOf(SyntaxNode node) {
        return new Range(positionAt(node.getStart()), positionAt(node.getEnd()));
    }

    /**
     * Returns the lines of the document text, useful for position-based lookups.
     */
    public String[] getLines() {
        return text.split("\\r?\\n", -1);
    }

    /**
     * Returns the symbol at the given 0-based line and column position.
     */
    public String getWordAt(int line, int column) {
        String[] lines = getLines();
        if (line < 0 || line >= lines.length) {
            return "";
        }
        String lineText = lines[line];
        if (column < 0 || column > lineText.length()) {
            return "";
        }

        int start = column;
        while (start > 0 && isSymbolChar(lineText.charAt(start - 1))) {
            start--;
        }
        int end = column;
        while (end < lineText.length() && isSymbolChar(lineText.charAt(end))) {
            end++;
        }
        return lineText.substring(start, end);
    }

    private static boolean isSymbolChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '?';
    }
}
