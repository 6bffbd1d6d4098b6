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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Поиск выражения, которое пользователь выделил.
 *
 * Обход в глубину (pre-order) со стеком объемлющих операторов. Кандидаты - выражения,
 * кроме ссылок на переменные и присваиваний. Из пересекающихся с выделением кандидатов
 * выбирается самый длинный: пользователь, выделивший строку с "1 + 2", имеет в виду всё сложение, а не "1".
 */
public final class SpanMatcher {

    /**
     * Найденное выражение и оператор, внутри которого оно находится.
     */
    public record ExpressionMatch(Optional<SyntaxNode> expression, Optional<SyntaxNode> statement) {

        static final ExpressionMatch NONE = new ExpressionMatch(Optional.empty(), Optional.empty());

        public boolean isFound() {
            return expression.isPresent();
        }
    }

    private final SyntaxTree tree;
    private final SelectionRange range;
    private final Deque<SyntaxNode> statements = new ArrayDeque<>();

    private SyntaxNode best;
    private SyntaxNode bestStatement;

    private SpanMatcher(SyntaxTree tree, SelectionRange range) {
        this.tree = tree;
        this.range = range;
    }

    public static ExpressionMatch findBestExpression(SyntaxTree tree, SelectionRange range) {
        SpanMatcher matcher = new SpanMatcher(tree, range);
        matcher.visit(tree.root());
        if (matcher.best == null) {
            return ExpressionMatch.NONE;
        }
        return new ExpressionMatch(Optional.of(matcher.best), Optional.ofNullable(matcher.bestStatement));
    }

    private void visit(SyntaxNode node) {
        boolean statement = node.kind().isStatement();
        if (statement) {
            statements.push(node);
        }

        if (node.kind().isExpression() && !node.kind().isExcludedFromMatching()
                && !isConditionParentheses(node) && overlaps(node)) {
            if (best == null || isBetterMatch(node, best)) {
                best = node;
                bestStatement = statements.peek();
            }
        }

        for (SyntaxNode child : tree.children(node)) {
            visit(child);
        }

        if (statement) {
            statements.pop();
        }
    }

    /**
     * Скобки условия if/while/switch принадлежат синтаксису оператора, а не выражению.
     */
    private boolean isConditionParentheses(SyntaxNode node) {
        if (!"parenthesized_expression".equals(node.type())) {
            return false;
        }
        SyntaxNode parent = tree.parent(node);
        return parent != null && parent.kind() == NodeKind.STATEMENT;
    }

    private boolean overlaps(SyntaxNode node) {
        SourceSpan span = node.span();
        if (span == null) {
            return false;
        }
        if (range.isSingleLine()) {
            return span.startLine() == range.startLine();
        }
        return span.startLine() <= range.endLine() && span.endLine() >= range.startLine();
    }

    /**
     * Кандидат без смещений никогда не лучше; кандидат со смещениями всегда лучше лучшего без них.
     */
    static boolean isBetterMatch(SyntaxNode candidate, SyntaxNode current) {
        if (!candidate.span().hasOffsets()) {
            return false;
        }
        if (!current.span().hasOffsets()) {
            return true;
        }
        return candidate.span().length() > current.span().length();
    }
}
