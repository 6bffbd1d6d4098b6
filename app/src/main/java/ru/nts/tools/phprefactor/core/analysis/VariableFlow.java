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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Анализ потока переменных для извлечения метода.
 *
 * Для непрерывной последовательности операторов определяет:
 * <ul>
 *   <li>used - переменные выделения в порядке первого появления, без $this;</li>
 *   <li>parameters - используемые переменные, которые встречаются в объемлющей области до выделения;</li>
 *   <li>written - переменные, которым выделение присваивает значение;</li>
 *   <li>returns - записанные переменные, которые встречаются в объемлющей области после выделения.</li>
 * </ul>
 *
 * Вложенные именованные функции и методы - отдельные области и не учитываются.
 * У замыкания учитывается только use(...), у стрелочной функции - всё тело, кроме её параметров.
 */
public final class VariableFlow {

    private static final Set<String> ASSIGNMENT_TYPES = Set.of(
            "assignment_expression", "augmented_assignment_expression", "reference_assignment_expression");

    /**
     * Узлы, через которые цель записи может быть вложена в левую часть: [$a, $b] = ..., list($a) = ...,
     * foreach (... as $k => &$v), $items[] = ...
     */
    private static final Set<String> DESTRUCTURING_TYPES = Set.of(
            "list_literal", "array_creation_expression", "array_element_initializer", "pair", "by_ref");

    private final List<String> used;
    private final List<String> parameters;
    private final List<String> written;
    private final List<String> returns;

    private VariableFlow(List<String> used, List<String> parameters, List<String> written, List<String> returns) {
        this.used = List.copyOf(used);
        this.parameters = List.copyOf(parameters);
        this.written = List.copyOf(written);
        this.returns = List.copyOf(returns);
    }

    /**
     * @param scopeRoot узел объемлющей области (функция, метод, замыкание или PROGRAM для верхнего уровня)
     * @param selection соседние операторы одного списка операторов
     */
    public static VariableFlow analyze(SyntaxTree tree, SyntaxNode scopeRoot, List<SyntaxNode> selection) {
        if (selection.isEmpty()) {
            throw new IllegalArgumentException("Selection is empty");
        }
        int selectionStart = selection.get(0).printStart();
        int selectionEnd = selection.get(selection.size() - 1).printEnd();

        List<SyntaxNode> inside = new ArrayList<>();
        for (SyntaxNode statement : selection) {
            collectVariables(tree, statement, statement, inside);
        }

        Set<String> used = new LinkedHashSet<>();
        Set<String> written = new LinkedHashSet<>();
        for (SyntaxNode variable : inside) {
            String name = variable.identifierName();
            if ("this".equals(name)) continue;
            used.add(name);
            if (isWriteTarget(tree, variable)) {
                written.add(name);
            }
        }

        List<SyntaxNode> scopeVariables = new ArrayList<>();
        collectVariables(tree, scopeRoot, scopeRoot, scopeVariables);
        Set<String> before = new LinkedHashSet<>();
        Set<String> after = new LinkedHashSet<>();
        for (SyntaxNode variable : scopeVariables) {
            if (variable.nameStart() < selectionStart) {
                before.add(variable.identifierName());
            } else if (variable.nameStart() >= selectionEnd) {
                after.add(variable.identifierName());
            }
        }

        List<String> parameters = new ArrayList<>();
        for (String name : used) {
            if (before.contains(name)) {
                parameters.add(name);
            }
        }
        List<String> returns = new ArrayList<>();
        for (String name : written) {
            if (after.contains(name)) {
                returns.add(name);
            }
        }

        return new VariableFlow(new ArrayList<>(used), parameters, new ArrayList<>(written), returns);
    }

    public List<String> used() {
        return used;
    }

    public List<String> parameters() {
        return parameters;
    }

    public List<String> written() {
        return written;
    }

    public List<String> returns() {
        return returns;
    }

    private static void collectVariables(SyntaxTree tree, SyntaxNode node, SyntaxNode root, List<SyntaxNode> out) {
        if (node.isSynthetic()) {
            return;
        }
        if (node.kind() == NodeKind.VARIABLE) {
            out.add(node);
            return;
        }
        if (node.id() != root.id()) {
            switch (node.kind()) {
                case FUNCTION, METHOD -> {
                    return;
                }
                case CLOSURE -> {
                    SyntaxNode useClause = tree.childOfType(node, "anonymous_function_use_clause");
                    if (useClause != null) {
                        collectVariables(tree, useClause, root, out);
                    }
                    return;
                }
                case ARROW_FUNCTION -> {
                    List<String> own = tree.parameterNames(node);
                    List<SyntaxNode> nested = new ArrayList<>();
                    for (SyntaxNode child : tree.children(node)) {
                        if (!"formal_parameters".equals(child.type())) {
                            collectVariables(tree, child, root, nested);
                        }
                    }
                    for (SyntaxNode variable : nested) {
                        if (!own.contains(variable.identifierName())) {
                            out.add(variable);
                        }
                    }
                    return;
                }
                default -> {
                    // обычный узел
                }
            }
        }
        for (SyntaxNode child : tree.children(node)) {
            collectVariables(tree, child, root, out);
        }
    }

    /**
     * Переменная является целью записи: левая часть присваивания, операнд ++/--,
     * переменная цикла foreach или элемент деструктуризации.
     */
    static boolean isWriteTarget(SyntaxTree tree, SyntaxNode variable) {
        SyntaxNode current = variable;
        SyntaxNode parent = tree.parent(current);
        while (parent != null) {
            if (DESTRUCTURING_TYPES.contains(parent.type())) {
                current = parent;
            } else if ("subscript_expression".equals(parent.type()) && isFirstChild(tree, parent, current)) {
                current = parent;
            } else {
                break;
            }
            parent = tree.parent(current);
        }
        if (parent == null) {
            return false;
        }
        if (ASSIGNMENT_TYPES.contains(parent.type())) {
            return isFirstChild(tree, parent, current);
        }
        if ("update_expression".equals(parent.type())) {
            return true;
        }
        if ("foreach_statement".equals(parent.type())) {
            // первый ребёнок - перебираемое выражение, последний - тело
            return !isFirstChild(tree, parent, current) && current.kind() != NodeKind.BLOCK
                    && current.kind() != NodeKind.STATEMENT;
        }
        return false;
    }

    private static boolean isFirstChild(SyntaxTree tree, SyntaxNode parent, SyntaxNode child) {
        List<SyntaxNode> children = tree.children(parent);
        return !children.isEmpty() && children.get(0).id() == child.id();
    }
}
