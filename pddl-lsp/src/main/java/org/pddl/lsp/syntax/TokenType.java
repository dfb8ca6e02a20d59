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
package org.pddl.lsp.syntax;

public enum TokenType {

    /** Open bracket with the operator name, e.g. {@code (+}, {@code (:action} or {@code (increase}. */
    OPEN_BRACKET_OPERATOR,
    /** Bare open bracket {@code (}. */
    OPEN_BRACKET,
    CLOSE_BRACKET,
    /** Keyword such as {@code :parameters} or {@code :effect}. */
    KEYWORD,
    DASH,
    /** Parameter name such as {@code ?p1}. */
    PARAMETER,
    WHITESPACE,
    OTHER,
    /** Anything from {@code ;} to the end of the line, semicolon included. */
    COMMENT,
    /** Root of the syntax tree. */
    DOCUMENT;

    public boolean isOpenBracket() {
        return this == OPEN_BRACKET_OPERATOR || this == OPEN_BRACKET;
    }
}
