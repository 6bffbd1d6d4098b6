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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Выделение в файле: строки 1-based, колонки 1-based.
 * Колонки сохраняются для отчётов, но при поиске выражения не используются.
 */
public record SelectionRange(int startLine, int startColumn, int endLine, int endColumn) {

    private static final Pattern FORMAT = Pattern.compile("\\s*(\\d+):(\\d+)\\s*-\\s*(\\d+):(\\d+)\\s*");

    public SelectionRange {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid selection lines: " + startLine + "-" + endLine);
        }
        if (startColumn < 0 || endColumn < 0) {
            throw new IllegalArgumentException("Columns must not be negative");
        }
    }

    /**
     * Выделение целых строк.
     */
    public static SelectionRange ofLines(int startLine, int endLine) {
        return new SelectionRange(startLine, 0, endLine, 0);
    }

    /**
     * Разбирает строку вида "3:10-3:25".
     *
     * @throws IllegalArgumentException если формат не распознан
     */
    public static SelectionRange parse(String text) {
        Matcher m = FORMAT.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Selection must look like 'line:column-line:column', got '" + text + "'");
        }
        return new SelectionRange(
                Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
    }

    public boolean isSingleLine() {
        return startLine == endLine;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
