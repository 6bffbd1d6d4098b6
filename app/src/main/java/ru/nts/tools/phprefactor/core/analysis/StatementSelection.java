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

import ru.nts.tools.phprefactor.core.tree.NodeKind;
import ru.nts.tools.phprefactor.core.tree.SourceSpan;
import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Целые операторы одного списка операторов, лежащие в диапазоне строк.
 *
 * @param container список операторов (program, блок или ветка switch)
 * @param statements выбранные соседние операторы; пусто, если ничего не найдено
 * @param cut оператор, который диапазон пересекает лишь частично, или null
 */
public record StatementSelection(SyntaxNode container, List<SyntaxNode> statements, SyntaxNode cut) {

    private static final StatementSelection NONE = new StatementSelection(null, List.of(), null);

    public StatementSelection {
        statements = List.copyOf(statements);
    }

    public boolean isFound() {
        return !statements.isEmpty() && cut == null;
    }

    public boolean isCut() {
        return cut != null;
    }

    public SyntaxNode first() {
        return statements.get(0);
    }

    public SyntaxNode last() {
        return statements.get(statements.size() - 1);
    }

    /**
     * Ищет самый глубокий список операторов, в котором диапазон строк накрывает хотя бы один оператор целиком.
     * Если диапазон задевает оператор частично, результат помечается {@link #cut()}.
     */
    public static StatementSelection select(SyntaxTree tree, int startLine, int endLine) {
        StatementSelection result = visit(tree, tree.root(), startLine, endLine);
        return result != null ? result : NONE;
    }

    private static StatementSelection visit(SyntaxTree tree, SyntaxNode node, int startLine, int endLine) {
        if (StatementInserter.isStatementContainer(node)) {
            return visitContainer(tree, node, startLine, endLine);
        }
        for (SyntaxNode child : tree.children(node)) {
            if (overlaps(child, startLine, endLine)) {
                StatementSelection nested = visit(tree, child, startLine, endLine);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private static StatementSelection visitContainer(SyntaxTree tree, SyntaxNode container, int startLine, int endLine) {
        List<SyntaxNode> children = tree.children(container);
        int firstIndex = -1;
        int lastIndex = -1;
        List<SyntaxNode> partial = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            if (!isSelectable(child) || !overlaps(child, startLine, endLine)) {
                continue;
            }
            if (child.span().isWithinLines(startLine, endLine)) {
                if (firstIndex < 0) {
                    firstIndex = i;
                }
                lastIndex = i;
            } else {
                partial.add(child);
            }
        }

        if (firstIndex < 0) {
            if (partial.size() == 1) {
                StatementSelection nested = visit(tree, partial.get(0), startLine, endLine);
                if (nested != null) {
                    return nested;
                }
            }
            // Диапазон строго внутри оператора (например, на строке комментария) ничего не режет
            for (SyntaxNode child : partial) {
                if (touchesBoundary(child, startLine, endLine)) {
                    return new StatementSelection(container, List.of(), child);
                }
            }
            return null;
        }

        List<SyntaxNode> selected = children.subList(firstIndex, lastIndex + 1);
        for (SyntaxNode child : selected) {
            if (!isSelectable(child)) {
                return new StatementSelection(container, List.of(), child);
            }
        }
        return new StatementSelection(container, selected, partial.isEmpty() ? null : partial.get(0));
    }

    private static boolean isSelectable(SyntaxNode node) {
        return !node.isSynthetic() && node.hasSpan()
                && (node.kind().isStatement() || node.kind() == NodeKind.BLOCK);
    }

    private static boolean touchesBoundary(SyntaxNode node, int startLine, int endLine) {
        SourceSpan span = node.span();
        return (startLine <= span.startLine() && span.startLine() <= endLine)
                || (startLine <= span.endLine() && span.endLine() <= endLine);
    }

    private static boolean overlaps(SyntaxNode node, int startLine, int endLine) {
        SourceSpan span = node.span();
        return span != null && span.overlapsLines(startLine, endLine);
    }
}
