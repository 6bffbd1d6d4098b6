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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Печать дерева обратно в исходный текст с сохранением форматирования.
 *
 * Текст между дочерними узлами (пробелы, комментарии, ключевые слова, скобки) копируется из исходника,
 * переименованные переменные печатают новое имя, синтетические узлы - свой текст в точке привязки.
 * Дерево без изменений печатается байт в байт.
 */
public final class TreePrinter {

    public String print(SyntaxTree tree) {
        byte[] source = tree.sourceBytes();
        SyntaxNode root = tree.root();
        if (!root.hasSpan() || !root.span().hasOffsets()) {
            throw new IllegalStateException("Cannot print tree without source offsets: " + root);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(source.length + 256);

        out.write(source, 0, root.printStart());
        printNode(tree, root, source, out);
        out.write(source, root.printEnd(), source.length - root.printEnd());

        return out.toString(StandardCharsets.UTF_8);
    }

    private void printNode(SyntaxTree tree, SyntaxNode node, byte[] source, ByteArrayOutputStream out) {
        if (node.isSynthetic()) {
            out.writeBytes(node.text().getBytes(StandardCharsets.UTF_8));
            return;
        }
        SourceSpan span = node.span();
        if (span == null || !span.hasOffsets()) {
            throw new IllegalStateException("Cannot print node without source offsets: " + node);
        }

        if (node.kind() == NodeKind.VARIABLE) {
            out.write(source, span.startOffset(), node.nameStart() - span.startOffset());
            out.writeBytes(node.identifierName().getBytes(StandardCharsets.UTF_8));
            out.write(source, node.nameEnd(), span.endOffset() - node.nameEnd());
            return;
        }

        int position = span.startOffset();
        for (SyntaxNode child : tree.children(node)) {
            int childStart = child.printStart();
            if (childStart > position) {
                out.write(source, position, childStart - position);
            }
            printNode(tree, child, source, out);
            position = Math.max(position, child.printEnd());
        }
        if (span.endOffset() > position) {
            out.write(source, position, span.endOffset() - position);
        }
    }
}
