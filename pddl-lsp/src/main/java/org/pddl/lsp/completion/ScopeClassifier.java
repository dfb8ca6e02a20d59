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

import java.util.regex.Pattern;

import org.pddl.lsp.syntax.ConstructKind;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.TokenType;

/**
 * Decides which grammar applies at the cursor by inspecting the construct tags of the
 * cursor node and its ancestors, most specific scope first. Stateless.
 */
public class ScopeClassifier {

    private static final Pattern EMPTY_SECTION_OPENING = Pattern.compile("^\\(\\s*:?$");

    public StructuralPosition classify(CursorContext cursor) {
        SyntaxNode node = cursor.node();
        CompletionRequest request = cursor.request();

        if (node.isType(TokenType.COMMENT)) {
            // directives such as ;;!pre-parsing are written as top level comments
            return node.getParent() != null && node.getParent().isDocument()
                    ? StructuralPosition.BEFORE_DEFINE
                    : StructuralPosition.UNKNOWN;
        }
        if (request.isTriggeredBy("?")) {
            return StructuralPosition.PARAMETER_REFERENCE;
        }

        SyntaxNode define = cursor.document().getTree().getDefineNode();
        if (isInsideDefine(cursor, define)) {
            return StructuralPosition.INSIDE_DEFINE;
        }
        if (isInsideRequirements(node, define)) {
            return StructuralPosition.INSIDE_REQUIREMENTS;
        }

        SyntaxNode scope = node.expand();
        if (scope != null) {
            switch (scope.getConstructKind()) {
                case ACTION, PROCESS, EVENT -> {
                    return StructuralPosition.INSIDE_ACTION_BODY;
                }
                case DURATIVE_ACTION, JOB -> {
                    return StructuralPosition.INSIDE_DURATIVE_ACTION_BODY;
                }
                default -> {
                    // nested expression, keep looking at the ancestors
                }
            }
        }

        if (isInsideEffect(node)) {
            return StructuralPosition.INSIDE_EFFECT;
        }
        if (isInsideCondition(node) && isInsideDurativeAction(node) && findTimeQualifier(node) == null) {
            return StructuralPosition.INSIDE_CONDITION;
        }
        if (isAtDocumentLevel(node, request)) {
            return StructuralPosition.BEFORE_DEFINE;
        }
        if (request.isTriggeredBy("-") && isPrecededByWhitespace(cursor)) {
            return StructuralPosition.TYPE_REFERENCE;
        }
        if (request.isTriggeredBy("(")) {
            return StructuralPosition.OPERATOR_POSITION;
        }
        return StructuralPosition.UNKNOWN;
    }

    /**
     * On explicit invocation the cursor must sit directly in {@code (define}; after a typed
     * {@code (} or {@code (:} the bracket just opened must be a direct child of it.
     */
    static boolean isInsideDefine(CursorContext cursor, SyntaxNode define) {
        if (define == null) {
            return false;
        }
        SyntaxNode node = cursor.node();
        if (!cursor.request().isTriggerCharacter()) {
            return node.getParent() == define;
        }
        SyntaxNode enclosing = node.expand();
        return enclosing != null
                && enclosing.getParent() == define
                && EMPTY_SECTION_OPENING.matcher(cursor.textBefore(enclosing)).matches();
    }

    static boolean isInsideRequirements(SyntaxNode node, SyntaxNode define) {
        if (define == null) {
            return false;
        }
        SyntaxNode requirements = define.getFirstChild(ConstructKind.REQUIREMENTS);
        if (requirements == null || node.getParent() == null) {
            return false;
        }
        SyntaxNode parent = node.getParent();
        return parent == requirements
                || parent.isType(TokenType.KEYWORD) && parent.getParent() == requirements
                || node.isType(TokenType.KEYWORD) && parent == requirements;
    }

    public static boolean isInsideEffect(SyntaxNode node) {
        return node.hasAncestor(ConstructKind.EFFECT);
    }

    public static boolean isInsideCondition(SyntaxNode node) {
        return node.hasAncestor(ConstructKind.CONDITION);
    }

    public static boolean isInsideDurativeAction(SyntaxNode node) {
        return node.hasAncestor(ConstructKind.DURATIVE_ACTION) || node.hasAncestor(ConstructKind.JOB);
    }

    public static boolean isInsideActionOrEvent(SyntaxNode node) {
        return node.hasAncestor(ConstructKind.ACTION) || node.hasAncestor(ConstructKind.EVENT);
    }

    public static boolean isInsideProcess(SyntaxNode node) {
        return node.hasAncestor(ConstructKind.PROCESS);
    }

    /** Nearest {@code (at start}, {@code (at end} or {@code (over all} ancestor, or {@code null}. */
    public static SyntaxNode findTimeQualifier(SyntaxNode node) {
        SyntaxNode ancestor = node.getParent();
        while (ancestor != null && !ancestor.isDocument()) {
            switch (ancestor.getConstructKind()) {
                case AT_START, AT_END, OVER_ALL -> {
                    return ancestor;
                }
                default -> ancestor = ancestor.getParent();
            }
        }
        return null;
    }

    /** Inside a durative effect, under {@code (at start} or {@code (at end}. */
    public static boolean isInsideDurativeDiscreteEffect(SyntaxNode node) {
        SyntaxNode qualifier = findTimeQualifier(node);
        return isInsideDurativeAction(node) && qualifier != null
                && qualifier.getConstructKind() != ConstructKind.OVER_ALL;
    }

    /** Inside a durative effect but outside any time qualifier, where continuous effects go. */
    public static boolean isInsideDurativeUnqualifiedEffect(SyntaxNode node) {
        return isInsideDurativeAction(node) && findTimeQualifier(node) == null;
    }

    private static boolean isAtDocumentLevel(SyntaxNode node, CompletionRequest request) {
        if (node.isDocument()) {
            return true;
        }
        SyntaxNode parent = node.getParent();
        if (parent == null || !parent.isDocument()) {
            return false;
        }
        return node.isType(TokenType.WHITESPACE)
                || node.isType(TokenType.OPEN_BRACKET) && request.isTriggeredBy("(");
    }

    private static boolean isPrecededByWhitespace(CursorContext cursor) {
        String text = cursor.document().getText();
        int dash = cursor.offset() - 1;
        return dash >= 1 && dash < text.length() && text.charAt(dash) == '-'
                && Character.isWhitespace(text.charAt(dash - 1));
    }
}
