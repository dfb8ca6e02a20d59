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

/**
 * Node opened by {@code (} or {@code (operator}. The matching close bracket only
 * extends the node range; it is not a child.
 */
public class BracketNode extends SyntaxNode {

    private Token closeToken;

    BracketNode(Token token, SyntaxNode parent) {
        super(token, parent);
    }

    void setCloseBracket(Token closeToken) {
        this.closeToken = closeToken;
        recalculateEnd(closeToken.getEnd());
    }

    public boolean isClosed() {
        return closeToken != null;
    }

    @Override
    public String getText() {
        String text = super.getText();
        return closeToken == null ? text : text + closeToken.getText();
    }
}
