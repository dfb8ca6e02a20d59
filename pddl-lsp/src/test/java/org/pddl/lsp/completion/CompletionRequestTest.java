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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionRequestTest {

    @Test
    void missingContextShouldMeanExplicitInvocation() {
        assertThat(CompletionRequest.from(null)).isEqualTo(CompletionRequest.INVOKED);
        assertThat(CompletionRequest.from(new CompletionContext())).isEqualTo(CompletionRequest.INVOKED);
    }

    @Test
    void triggerCharacterShouldBeKept() {
        CompletionRequest request = CompletionRequest.from(new CompletionContext(CompletionTriggerKind.TriggerCharacter, "("));

        assertThat(request.isTriggerCharacter()).isTrue();
        assertThat(request.isTriggeredBy("(")).isTrue();
        assertThat(request.replacesTriggerText()).isTrue();
        assertThat(request.isInvoked()).isFalse();
    }

    @Test
    void parameterTriggerShouldNotReplaceText() {
        CompletionRequest request = CompletionRequest.triggeredBy("?");

        assertThat(request.replacesTriggerText()).isFalse();
        assertThat(CompletionRequest.INVOKED.isTriggerCharacter()).isFalse();
    }
}
