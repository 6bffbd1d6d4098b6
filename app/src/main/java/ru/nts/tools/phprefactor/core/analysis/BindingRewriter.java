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
 * Переименование переменной в пределах границы области видимости.
 *
 * <ul>
 *   <li>Граница - конкретный узел: переименовываются все вхождения внутри его поддерева.
 *       Вложенные функции и методы пропускаются целиком, замыкания - если не захватывают переменную
 *       через use(...), стрелочные функции - если объявляют параметр с тем же именем.</li>
 *   <li>Граница - верхний уровень: глубина вложенности увеличивается на каждом узле, вводящем область,
 *       переименовываются только вхождения на глубине 0.</li>
 * </ul>
 *
 * Роль вхождения (чтение, запись, параметр) не различается. Состояние обхода передаётся параметрами рекурсии,
 * поэтому вход и выход из области парные по построению.
 */
public final class BindingRewriter {

    private final SyntaxTree tree;
    private final String oldName;
    private final String newName;
    private final ScopeBoundary boundary;
    private final boolean rename;
    private final List<Integer> occurrences = new ArrayList<>();

    private BindingRewriter(SyntaxTree tree, String oldName, String newName, ScopeBoundary boundary, boolean rename) {
        this.tree = tree;
        this.oldName = Binding.normalize(oldName);
        this.newName = Binding.normalize(newName);
        this.boundary = boundary;
        this.rename = rename;
    }

    /**
     * Переименовывает переменную и возвращает переименованные вхождения.
     *
     * @param oldName  текущее имя (с '$' или без)
     * @param newName  новое имя (с '$' или без)
     * @param boundary граница, найденная {@link ScopeLocator}
     */
    public static Binding rewrite(SyntaxTree tree, String oldName, String newName, ScopeBoundary boundary) {
        BindingRewriter rewriter = new BindingRewriter(tree, oldName, newName, boundary, true);
        rewriter.run();
        return new Binding(rewriter.oldName, rewriter.occurrences);
    }

    /**
     * Находит вхождения по тем же правилам, что и {@link #rewrite}, не изменяя дерево.
     */
    public static Binding resolve(SyntaxTree tree, String name, ScopeBoundary boundary) {
        BindingRewriter rewriter = new BindingRewriter(tree, name, name, boundary, false);
        rewriter.run();
        return new Binding(rewriter.oldName, rewriter.occurrences);
    }

    private void run() {
        if (boundary.isTopLevel()) {
            visitTopLevel(tree.root(), 0);
        } else {
            visitBounded(tree.root(), false);
        }
    }

    private void visitBounded(SyntaxNode node, boolean inTarget) {
        boolean entering = node.id() == boundary.nodeId();
        boolean inside = inTarget || entering;

        if (inside && !entering && node.kind().isScopeIntroducing() && !sharesBinding(node)) {
            return;
        }

        if (inside && node.kind() == NodeKind.VARIABLE) {
            apply(node);
        }

        for (SyntaxNode child : tree.children(node)) {
            visitBounded(child, inside);
        }
    }

    /**
     * Видит ли вложенная область переменную внешней области.
     * Именованная функция и метод - никогда; замыкание - только через use(...);
     * стрелочная функция захватывает внешние переменные, пока не перекрывает имя своим параметром.
     */
    private boolean sharesBinding(SyntaxNode scope) {
        if (tree.parameterNames(scope).contains(oldName)) {
            return false;
        }
        return switch (scope.kind()) {
            case CLOSURE -> capturedNames(scope).contains(oldName);
            case ARROW_FUNCTION -> true;
            default -> false;
        };
    }

    private List<String> capturedNames(SyntaxNode closure) {
        List<String> names = new ArrayList<>();
        SyntaxNode useClause = tree.childOfType(closure, "anonymous_function_use_clause");
        if (useClause != null) {
            collectNames(useClause, names);
        }
        return names;
    }

    private void collectNames(SyntaxNode node, List<String> names) {
        if (node.kind() == NodeKind.VARIABLE) {
            names.add(node.identifierName());
            return;
        }
        for (SyntaxNode child : tree.children(node)) {
            collectNames(child, names);
        }
    }

    private void visitTopLevel(SyntaxNode node, int depth) {
        int current = node.kind().isScopeIntroducing() ? depth + 1 : depth;

        if (current == 0 && node.kind() == NodeKind.VARIABLE) {
            apply(node);
        }

        for (SyntaxNode child : tree.children(node)) {
            visitTopLevel(child, current);
        }
    }

    private void apply(SyntaxNode variable) {
        if (!oldName.equals(variable.identifierName())) {
            return;
        }
        occurrences.add(variable.id());
        if (rename) {
            variable.setIdentifierName(newName);
        }
    }
}
