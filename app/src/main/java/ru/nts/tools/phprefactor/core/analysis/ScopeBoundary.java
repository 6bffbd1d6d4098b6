/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.phprefactor.core.analysis;

import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;

/**
 * Граница области видимости: идентификатор функции, метода, замыкания или стрелочной функции,
 * либо {@link #TOP_LEVEL}, если строка не находится ни в одной из них.
 */
public record ScopeBoundary(int nodeId) {

    public static final ScopeBoundary TOP_LEVEL = new ScopeBoundary(SyntaxNode.NO_NODE);

    public static ScopeBoundary of(SyntaxNode scope) {
        if (!scope.kind().isScopeIntroducing()) {
            throw new IllegalArgumentException("Not a scope-introducing node: " + scope);
        }
        return new ScopeBoundary(scope.id());
    }

    public boolean isTopLevel() {
        return nodeId == SyntaxNode.NO_NODE;
    }

    public SyntaxNode node(SyntaxTree tree) {
        if (isTopLevel()) {
            throw new IllegalStateException("Top-level scope has no node");
        }
        return tree.node(nodeId);
    }

    /**
     * Человекочитаемое описание для сообщений ("function total", "method save", "closure at line 12").
     */
    public String describe(SyntaxTree tree) {
        if (isTopLevel()) {
            return "top-level scope";
        }
        SyntaxNode scope = tree.node(nodeId);
        SyntaxNode name = tree.childOfType(scope, "name");
        return switch (scope.kind()) {
            case FUNCTION -> "function " + (name != null ? tree.text(name) : "");
            case METHOD -> "method " + (name != null ? tree.text(name) : "");
            case CLOSURE -> "closure at line " + scope.span().startLine();
            case ARROW_FUNCTION -> "arrow function at line " + scope.span().startLine();
            default -> scope.type();
        };
    }
}
