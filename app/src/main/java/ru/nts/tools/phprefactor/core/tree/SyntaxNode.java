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
import java.util.Collections;
import java.util.List;

/**
 * Элемент арены {@link SyntaxTree}.
 * Узел адресуется целочисленным идентификатором; связи с родителем и детьми хранятся как идентификаторы.
 * Форма узла неизменна, единственное изменяемое поле - имя переменной у узлов {@link NodeKind#VARIABLE}.
 */
public final class SyntaxNode {

    public static final int NO_NODE = -1;

    private final int id;
    private final NodeKind kind;
    private final String type;
    private final SourceSpan span;
    private final int parent;
    final List<Integer> children = new ArrayList<>();

    // VARIABLE
    private String identifierName;
    private final int nameStart;
    private final int nameEnd;

    // SYNTHETIC
    private final String text;
    private final int anchorStart;
    private final int anchorEnd;

    private SyntaxNode(int id, NodeKind kind, String type, SourceSpan span, int parent,
                       String name, int nameStart, int nameEnd,
                       String text, int anchorStart, int anchorEnd) {
        this.id = id;
        this.kind = kind;
        this.type = type;
        this.span = span;
        this.parent = parent;
        this.identifierName = name;
        this.nameStart = nameStart;
        this.nameEnd = nameEnd;
        this.text = text;
        this.anchorStart = anchorStart;
        this.anchorEnd = anchorEnd;
    }

    static SyntaxNode parsed(int id, NodeKind kind, String type, SourceSpan span, int parent) {
        return new SyntaxNode(id, kind, type, span, parent, null, -1, -1, null, -1, -1);
    }

    static SyntaxNode variable(int id, String type, SourceSpan span, int parent,
                               String name, int nameStart, int nameEnd) {
        return new SyntaxNode(id, NodeKind.VARIABLE, type, span, parent, name, nameStart, nameEnd, null, -1, -1);
    }

    static SyntaxNode synthetic(int id, int parent, String text, int anchorStart, int anchorEnd) {
        return new SyntaxNode(id, NodeKind.SYNTHETIC, "synthetic", null, parent, null, -1, -1,
                text, anchorStart, anchorEnd);
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Исходный тип узла грамматики (например, "binary_expression").
     */
    public String type() {
        return type;
    }

    /**
     * Положение в исходном тексте или null для синтетических узлов.
     */
    public SourceSpan span() {
        return span;
    }

    public boolean hasSpan() {
        return span != null;
    }

    public int parent() {
        return parent;
    }

    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isSynthetic() {
        return kind == NodeKind.SYNTHETIC;
    }

    /**
     * Текущее имя переменной (без '$').
     */
    public String identifierName() {
        return identifierName;
    }

    public void setIdentifierName(String identifierName) {
        if (kind != NodeKind.VARIABLE) {
            throw new IllegalStateException("Only variable nodes can be renamed, got " + type);
        }
        this.identifierName = identifierName;
    }

    public int nameStart() {
        return nameStart;
    }

    public int nameEnd() {
        return nameEnd;
    }

    /**
     * Текст синтетического узла.
     */
    public String text() {
        return text;
    }

    /**
     * Начало участка исходного текста, который занимает узел при печати.
     * Для обычных узлов совпадает с началом span, для синтетических - с точкой вставки.
     */
    public int printStart() {
        return isSynthetic() ? anchorStart : span.startOffset();
    }

    public int printEnd() {
        return isSynthetic() ? anchorEnd : span.endOffset();
    }

    @Override
    public String toString() {
        if (isSynthetic()) {
            return "synthetic#" + id + "[" + anchorStart + ".." + anchorEnd + "]";
        }
        String base = type + "#" + id;
        if (span != null) {
            base += "[" + span.startLine() + "-" + span.endLine() + "]";
        }
        if (kind == NodeKind.VARIABLE) {
            base += " $" + identifierName;
        }
        return base;
    }
}
