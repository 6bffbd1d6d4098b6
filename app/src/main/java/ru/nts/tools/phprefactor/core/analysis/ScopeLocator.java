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

import ru.nts.tools.phprefactor.core.tree.SourceSpan;
import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Определяет самую внутреннюю функцию, метод, замыкание или стрелочную функцию, содержащую строку.
 *
 * Обход pre-order: родитель посещается раньше детей, дети - в порядке исходника.
 * Каждый узел, чей span содержит строку, при непустом стеке областей делает вершину стека текущим кандидатом.
 * Последнее обновление всегда приходится на самый глубокий содержащий узел, поэтому побеждает внутренняя область.
 * Порядок обхода менять нельзя: на нём держится этот инвариант.
 */
public final class ScopeLocator {

    private final SyntaxTree tree;
    private final int targetLine;
    private final Deque<SyntaxNode> scopes = new ArrayDeque<>();
    private SyntaxNode best;

    private ScopeLocator(SyntaxTree tree, int targetLine) {
        this.tree = tree;
        this.targetLine = targetLine;
    }

    public static ScopeBoundary findScope(SyntaxTree tree, int targetLine) {
        ScopeLocator locator = new ScopeLocator(tree, targetLine);
        locator.visit(tree.root());
        return locator.best == null ? ScopeBoundary.TOP_LEVEL : ScopeBoundary.of(locator.best);
    }

    /**
     * Ближайшая область, объемлющая сам узел (а не строку): первый scope-introducing предок.
     */
    public static ScopeBoundary enclosingScope(SyntaxTree tree, SyntaxNode node) {
        SyntaxNode current = tree.parent(node);
        while (current != null) {
            if (current.kind().isScopeIntroducing()) {
                return ScopeBoundary.of(current);
            }
            current = tree.parent(current);
        }
        return ScopeBoundary.TOP_LEVEL;
    }

    private void visit(SyntaxNode node) {
        boolean scope = node.kind().isScopeIntroducing();
        if (scope) {
            scopes.push(node);
        }

        SourceSpan span = node.span();
        if (span != null && span.containsLine(targetLine) && !scopes.isEmpty()) {
            best = scopes.peek();
        }

        for (SyntaxNode child : tree.children(node)) {
            visit(child);
        }

        if (scope) {
            scopes.pop();
        }
    }
}
