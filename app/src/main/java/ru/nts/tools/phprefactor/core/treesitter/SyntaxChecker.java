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
package ru.nts.tools.phprefactor.core.treesitter;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка синтаксиса через tree-sitter AST.
 * Ищет ERROR и MISSING узлы в дереве разбора.
 */
public final class SyntaxChecker {

    private static final int MAX_ERRORS = 5;

    private SyntaxChecker() {}

    public record SyntaxError(int line, int column, String message, String context) {
        @Override
        public String toString() {
            String result = message + " on line " + line + ", column " + column;
            return context.isEmpty() ? result : result + ": " + context;
        }
    }

    public record SyntaxCheckResult(List<SyntaxError> errors) {
        public boolean hasErrors() { return !errors.isEmpty(); }
        public int errorCount() { return errors.size(); }
    }

    /**
     * Собирает синтаксические ошибки уже разобранного дерева.
     *
     * @param root корень дерева tree-sitter
     * @param content исходник (для контекста ошибки)
     * @return результат проверки
     */
    public static SyntaxCheckResult check(TSNode root, String content) {
        String[] lines = content.split("\n", -1);
        List<SyntaxError> errors = new ArrayList<>();
        collectErrors(root, lines, errors);
        return new SyntaxCheckResult(List.copyOf(errors));
    }

    /**
     * Разбирает и проверяет содержимое.
     */
    public static SyntaxCheckResult checkContent(String content) {
        return check(TreeSitterManager.getInstance().parse(content).getRootNode(), content);
    }

    private static void collectErrors(TSNode node, String[] lines, List<SyntaxError> errors) {
        if (errors.size() >= MAX_ERRORS) return;

        if (node.getType().equals("ERROR") || node.isMissing()) {
            int line = node.getStartPoint().getRow() + 1; // tree-sitter: 0-based -> 1-based
            int column = node.getStartPoint().getColumn() + 1;

            String message;
            if (node.isMissing()) {
                message = "Missing " + node.getType();
            } else {
                TSNode parent = node.getParent();
                String parentType = (parent != null && !parent.isNull()) ? parent.getType() : "unknown";
                message = "Syntax error in " + parentType;
            }

            String context = (line - 1 < lines.length) ? lines[line - 1].trim() : "";
            if (context.length() > 80) {
                context = context.substring(0, 80) + "...";
            }

            errors.add(new SyntaxError(line, column, message, context));
            return; // внутрь ERROR-узла не спускаемся
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount && errors.size() < MAX_ERRORS; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                collectErrors(child, lines, errors);
            }
        }
    }
}
