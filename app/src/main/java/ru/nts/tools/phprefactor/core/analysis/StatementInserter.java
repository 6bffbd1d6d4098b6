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
import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Вставка операторов и замена выражений ссылкой на новую переменную.
 */
public final class StatementInserter {

    private StatementInserter() {}

    /**
     * Узлы, чьи дети - последовательность операторов.
     * Кроме PROGRAM и блоков сюда входят ветки switch: операторы case лежат прямо в case_statement.
     */
    public static boolean isStatementContainer(SyntaxNode node) {
        return node.kind().isStatementList()
                || "case_statement".equals(node.type())
                || "default_statement".equals(node.type());
    }

    /**
     * Поднимается от узла к ближайшему предку (или самому узлу), который лежит непосредственно
     * в последовательности операторов. Перед таким узлом можно вставить новый оператор.
     *
     * @return найденный оператор или null
     */
    public static SyntaxNode insertionAnchor(SyntaxTree tree, SyntaxNode node) {
        SyntaxNode current = node;
        while (current != null) {
            SyntaxNode parent = tree.parent(current);
            if (parent != null && isStatementContainer(parent) && !current.isSynthetic()) {
                return current;
            }
            current = parent;
        }
        return null;
    }

    /**
     * Вставляет "$name = expression;" перед anchor с отступом anchor.
     */
    public static SyntaxNode insertDeclaration(SyntaxTree tree, SyntaxNode anchor, String name, String expression) {
        String indent = tree.indentationOf(anchor);
        return tree.insertBefore(anchor, "$" + name + " = " + expression + ";\n" + indent);
    }

    /**
     * Заменяет внутри within каждое выражение, чей исходный текст совпадает с expressionText.
     * Заменяются только внешние вхождения: внутрь заменённого узла обход не спускается.
     *
     * @return заменённые узлы в порядке исходника
     */
    public static List<SyntaxNode> replaceOccurrences(SyntaxTree tree, SyntaxNode within, String expressionText, String replacement) {
        List<SyntaxNode> matches = new ArrayList<>();
        collectMatches(tree, within, expressionText, matches);
        for (SyntaxNode match : matches) {
            tree.replace(List.of(match), replacement);
        }
        return matches;
    }

    private static void collectMatches(SyntaxTree tree, SyntaxNode node, String expressionText, List<SyntaxNode> matches) {
        if (node.isSynthetic()) {
            return;
        }
        if (node.kind().isExpression() && node.kind() != NodeKind.VARIABLE
                && node.hasSpan() && node.span().hasOffsets()
                && expressionText.equals(tree.text(node))) {
            matches.add(node);
            return;
        }
        for (SyntaxNode child : tree.children(node)) {
            collectMatches(tree, child, expressionText, matches);
        }
    }
}
