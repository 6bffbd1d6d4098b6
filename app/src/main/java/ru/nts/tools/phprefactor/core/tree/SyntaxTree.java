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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Арена узлов разобранного файла.
 * Узлы адресуются индексами, исходный текст хранится в виде байтов UTF-8,
 * так как смещения tree-sitter байтовые.
 *
 * Форма дерева меняется только через {@link #insertBefore}, {@link #insertAfter} и {@link #replace}:
 * они добавляют синтетические узлы и перестраивают список детей родителя.
 * Вытесненные узлы остаются в арене, но больше не достижимы из корня.
 */
public final class SyntaxTree {

    private final byte[] source;
    private final List<SyntaxNode> nodes = new ArrayList<>();
    private int rootId = SyntaxNode.NO_NODE;

    public SyntaxTree(String source) {
        this.source = source.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Добавляет узел в арену. Первый узел без родителя становится корнем.
     *
     * @return идентификатор нового узла
     */
    public int addNode(NodeKind kind, String type, SourceSpan span, int parentId) {
        if (kind == NodeKind.VARIABLE || kind == NodeKind.SYNTHETIC) {
            throw new IllegalArgumentException("Use addVariable/insert* for " + kind);
        }
        return attach(SyntaxNode.parsed(nodes.size(), kind, type, span, parentId));
    }

    /**
     * Добавляет ссылку на переменную.
     *
     * @param name      имя без '$'
     * @param nameStart байтовое смещение первого символа имени
     * @param nameEnd   байтовое смещение за последним символом имени
     */
    public int addVariable(String type, SourceSpan span, int parentId, String name, int nameStart, int nameEnd) {
        return attach(SyntaxNode.variable(nodes.size(), type, span, parentId, name, nameStart, nameEnd));
    }

    private int attach(SyntaxNode node) {
        nodes.add(node);
        if (node.parent() == SyntaxNode.NO_NODE) {
            if (rootId != SyntaxNode.NO_NODE) {
                throw new IllegalStateException("Tree already has a root: " + node(rootId));
            }
            rootId = node.id();
        } else {
            node(node.parent()).children.add(node.id());
        }
        return node.id();
    }

    public SyntaxNode node(int id) {
        return nodes.get(id);
    }

    public SyntaxNode root() {
        if (rootId == SyntaxNode.NO_NODE) {
            throw new IllegalStateException("Tree is empty");
        }
        return nodes.get(rootId);
    }

    /**
     * Количество узлов в арене, включая вытесненные и синтетические.
     */
    public int size() {
        return nodes.size();
    }

    public List<SyntaxNode> children(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<>(node.children.size());
        for (int childId : node.children) {
            result.add(nodes.get(childId));
        }
        return result;
    }

    /**
     * Родитель узла или null для корня.
     */
    public SyntaxNode parent(SyntaxNode node) {
        return node.parent() == SyntaxNode.NO_NODE ? null : nodes.get(node.parent());
    }

    /**
     * Первый прямой потомок с указанным типом грамматики или null.
     */
    public SyntaxNode childOfType(SyntaxNode node, String type) {
        for (int childId : node.children) {
            SyntaxNode child = nodes.get(childId);
            if (type.equals(child.type())) {
                return child;
            }
        }
        return null;
    }

    public boolean isAncestorOrSelf(SyntaxNode ancestor, SyntaxNode node) {
        SyntaxNode current = node;
        while (current != null) {
            if (current.id() == ancestor.id()) {
                return true;
            }
            current = parent(current);
        }
        return false;
    }

    public String source() {
        return new String(source, StandardCharsets.UTF_8);
    }

    byte[] sourceBytes() {
        return source;
    }

    /**
     * Исходный текст узла (для синтетических - их собственный текст).
     */
    public String text(SyntaxNode node) {
        if (node.isSynthetic()) {
            return node.text();
        }
        SourceSpan span = node.span();
        if (span == null || !span.hasOffsets()) {
            return "";
        }
        return slice(span.startOffset(), span.endOffset());
    }

    /**
     * Исходный текст между байтовыми смещениями (end exclusive).
     */
    public String slice(int start, int end) {
        int from = Math.max(0, Math.min(start, source.length));
        int to = Math.max(from, Math.min(end, source.length));
        return new String(source, from, to - from, StandardCharsets.UTF_8);
    }

    /**
     * Колонка (1-based, в символах) байтового смещения.
     */
    public int columnOf(int offset) {
        int lineStart = Math.min(offset, source.length);
        while (lineStart > 0 && source[lineStart - 1] != '\n') {
            lineStart--;
        }
        return slice(lineStart, offset).length() + 1;
    }

    /**
     * Пробельный префикс строки, на которой начинается узел.
     */
    public String indentationOf(SyntaxNode node) {
        int start = node.printStart();
        int lineStart = start;
        while (lineStart > 0 && source[lineStart - 1] != '\n') {
            lineStart--;
        }
        int end = lineStart;
        while (end < start && (source[end] == ' ' || source[end] == '\t')) {
            end++;
        }
        return slice(lineStart, end);
    }

    /**
     * Имена формальных параметров функции, метода, замыкания или стрелочной функции.
     * Переменные из use(...) замыкания параметрами не считаются: они разделяют значение с внешней областью.
     */
    public List<String> parameterNames(SyntaxNode scope) {
        List<String> names = new ArrayList<>();
        SyntaxNode parameters = childOfType(scope, "formal_parameters");
        if (parameters == null) {
            return names;
        }
        for (SyntaxNode parameter : children(parameters)) {
            for (SyntaxNode part : children(parameter)) {
                if (part.kind() == NodeKind.VARIABLE) {
                    names.add(part.identifierName());
                    break;
                }
            }
        }
        return names;
    }

    /**
     * Вставляет синтетический узел непосредственно перед sibling.
     * Текст печатается в начале sibling, поэтому должен сам заканчиваться переводом строки и отступом.
     */
    public SyntaxNode insertBefore(SyntaxNode sibling, String text) {
        SyntaxNode parent = requireParent(sibling);
        int index = parent.children.indexOf(sibling.id());
        SyntaxNode synthetic = SyntaxNode.synthetic(nodes.size(), parent.id(), text,
                sibling.printStart(), sibling.printStart());
        nodes.add(synthetic);
        parent.children.add(index, synthetic.id());
        return synthetic;
    }

    /**
     * Вставляет синтетический узел сразу после sibling.
     */
    public SyntaxNode insertAfter(SyntaxNode sibling, String text) {
        SyntaxNode parent = requireParent(sibling);
        int index = parent.children.indexOf(sibling.id());
        SyntaxNode synthetic = SyntaxNode.synthetic(nodes.size(), parent.id(), text,
                sibling.printEnd(), sibling.printEnd());
        nodes.add(synthetic);
        parent.children.add(index + 1, synthetic.id());
        return synthetic;
    }

    /**
     * Заменяет непрерывную последовательность соседних узлов одним синтетическим узлом.
     * Текст между заменяемыми узлами (комментарии, пробелы) также вытесняется.
     */
    public SyntaxNode replace(List<SyntaxNode> siblings, String text) {
        if (siblings.isEmpty()) {
            throw new IllegalArgumentException("Nothing to replace");
        }
        SyntaxNode first = siblings.get(0);
        SyntaxNode parent = requireParent(first);
        int index = parent.children.indexOf(first.id());
        for (int i = 0; i < siblings.size(); i++) {
            SyntaxNode node = siblings.get(i);
            if (node.parent() != parent.id() || index + i >= parent.children.size()
                    || parent.children.get(index + i) != node.id()) {
                throw new IllegalArgumentException("Nodes to replace must be contiguous siblings: " + node);
            }
        }
        SyntaxNode last = siblings.get(siblings.size() - 1);
        SyntaxNode synthetic = SyntaxNode.synthetic(nodes.size(), parent.id(), text,
                first.printStart(), last.printEnd());
        nodes.add(synthetic);
        parent.children.subList(index, index + siblings.size()).clear();
        parent.children.add(index, synthetic.id());
        return synthetic;
    }

    private SyntaxNode requireParent(SyntaxNode node) {
        SyntaxNode parent = parent(node);
        if (parent == null) {
            throw new IllegalArgumentException("Root node has no siblings");
        }
        if (!parent.children.contains(node.id())) {
            throw new IllegalArgumentException("Node is detached from the tree: " + node);
        }
        return parent;
    }
}
