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
package ru.nts.tools.phprefactor.core.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Поиск узлов в дереве для тестов.
 */
public final class TreeNodes {

    private TreeNodes() {}

    /**
     * Все достижимые из корня узлы в порядке pre-order.
     */
    public static List<SyntaxNode> all(SyntaxTree tree) {
        List<SyntaxNode> result = new ArrayList<>();
        collect(tree, tree.root(), result);
        return result;
    }

    public static List<SyntaxNode> ofKind(SyntaxTree tree, NodeKind kind) {
        return matching(tree, node -> node.kind() == kind);
    }

    public static List<SyntaxNode> ofType(SyntaxTree tree, String type) {
        return matching(tree, node -> type.equals(node.type()));
    }

    public static SyntaxNode firstOfType(SyntaxTree tree, String type) {
        List<SyntaxNode> nodes = ofType(tree, type);
        if (nodes.isEmpty()) {
            throw new AssertionError("No node of type " + type);
        }
        return nodes.get(0);
    }

    /**
     * Первый узел указанного типа, начинающийся на строке.
     */
    public static SyntaxNode firstOfTypeOnLine(SyntaxTree tree, String type, int line) {
        for (SyntaxNode node : ofType(tree, type)) {
            if (node.hasSpan() && node.span().startLine() == line) {
                return node;
            }
        }
        throw new AssertionError("No node of type " + type + " on line " + line);
    }

    public static List<SyntaxNode> variables(SyntaxTree tree, String name) {
        return matching(tree, node -> node.kind() == NodeKind.VARIABLE && name.equals(node.identifierName()));
    }

    public static List<SyntaxNode> matching(SyntaxTree tree, Predicate<SyntaxNode> predicate) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode node : all(tree)) {
            if (predicate.test(node)) {
                result.add(node);
            }
        }
        return result;
    }

    private static void collect(SyntaxTree tree, SyntaxNode node, List<SyntaxNode> out) {
        out.add(node);
        for (SyntaxNode child : tree.children(node)) {
            collect(tree, child, out);
        }
    }
}
