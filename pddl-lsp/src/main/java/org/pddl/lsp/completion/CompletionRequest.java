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

import org.eclipse.lsp4j.CompletionContext;
import org.eclipse.lsp4j.CompletionTriggerKind;

/**
 * How a completion request was triggered.
 *
 * @param triggerKind explicit invocation or a typed trigger character
 * @param triggerCharacter the character typed, or {@code null} for explicit invocation
 */
public record CompletionRequest(CompletionTriggerKind triggerKind, String triggerCharacter) {

    public static final CompletionRequest INVOKED = new CompletionRequest(CompletionTriggerKind.Invoked, null);

    public static CompletionRequest from(CompletionContext context) {
        if (context == null || context.getTriggerKind() == null) {
            return INVOKED;
        }
        return new CompletionRequest(context.getTriggerKind(), context.getTriggerCharacter());
    }

    public static CompletionRequest triggeredBy(String triggerCharacter) {
        return new CompletionRequest(CompletionTriggerKind.TriggerCharacter, triggerCharacter);
    }

    public boolean isInvoked() {
        return triggerKind == CompletionTriggerKind.Invoked;
    }

    public boolean isTriggeredBy(String character) {
        return character.equals(triggerCharacter);
    }

    /** Whether a trigger character, rather than an explicit invocation, started the request. */
    public boolean isTriggerCharacter() {
        return triggerKind == CompletionTriggerKind.TriggerCharacter
                && triggerCharacter != null && !triggerCharacter.isEmpty();
    }

    /** Whether the inserted text replaces the typed {@code (} or {@code :}. */
    public boolean replacesTriggerText() {
        return isTriggeredBy("(") || isTriggeredBy(":");
    }
}
