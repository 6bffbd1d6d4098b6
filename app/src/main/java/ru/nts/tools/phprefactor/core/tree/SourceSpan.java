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

/**
 * Положение узла в исходном тексте.
 * Строки 1-based, смещения - байтовые позиции UTF-8 (end exclusive).
 * Смещения могут отсутствовать (-1), если узел построен не парсером.
 */
public record SourceSpan(int startLine, int endLine, int startOffset, int endOffset) {

    public static final int UNKNOWN = -1;

    public SourceSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range: " + startLine + "-" + endLine);
        }
    }

    /**
     * Span без байтовых смещений.
     */
    public static SourceSpan ofLines(int startLine, int endLine) {
        return new SourceSpan(startLine, endLine, UNKNOWN, UNKNOWN);
    }

    public boolean hasOffsets() {
        return startOffset >= 0 && endOffset >= startOffset;
    }

    /**
     * Длина в байтах. Для span без смещений возвращает -1.
     */
    public int length() {
        return hasOffsets() ? endOffset - startOffset : UNKNOWN;
    }

    public boolean containsLine(int line) {
        return startLine <= line && line <= endLine;
    }

    public boolean isWithinLines(int fromLine, int toLine) {
        return fromLine <= startLine && endLine <= toLine;
    }

    public boolean overlapsLines(int fromLine, int toLine) {
        return startLine <= toLine && endLine >= fromLine;
    }
}
