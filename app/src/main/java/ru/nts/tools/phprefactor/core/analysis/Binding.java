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

import java.util.List;

/**
 * Переменная в области видимости: имя без '$' и найденные вхождения (идентификаторы узлов).
 * Связывание определяется только совпадением имени.
 */
public record Binding(String name, List<Integer> occurrences) {

    public Binding {
        name = normalize(name);
        occurrences = List.copyOf(occurrences);
    }

    public boolean isEmpty() {
        return occurrences.isEmpty();
    }

    public int size() {
        return occurrences.size();
    }

    /**
     * Снимает все ведущие '$' и окружающие пробелы: "$$x" и " x " дают "x".
     * Для null возвращает пустую строку.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim();
        int i = 0;
        while (i < trimmed.length() && trimmed.charAt(i) == '$') {
            i++;
        }
        return trimmed.substring(i);
    }
}
