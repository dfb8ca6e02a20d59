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

/**
 * Grammatical context of the cursor, re-derived from the syntax tree on every request.
 */
public enum StructuralPosition {

    /** Document level, outside any {@code (define}. */
    BEFORE_DEFINE,
    /** Directly inside {@code (define}, where domain or problem sections go. */
    INSIDE_DEFINE,
    INSIDE_REQUIREMENTS,
    /** Body of an {@code :action}, {@code :process} or {@code :event}. */
    INSIDE_ACTION_BODY,
    /** Body of a {@code :durative-action} or {@code :job}. */
    INSIDE_DURATIVE_ACTION_BODY,
    INSIDE_EFFECT,
    /** Unqualified {@code :condition} of a durative action. */
    INSIDE_CONDITION,
    /** After a {@code ?} typed where a parameter name is expected. */
    PARAMETER_REFERENCE,
    /** After a {@code -} typed where a type name is expected. */
    TYPE_REFERENCE,
    /** After a {@code (} typed where an operator, predicate or function is expected. */
    OPERATOR_POSITION,
    UNKNOWN
}
