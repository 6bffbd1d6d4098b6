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
package ru.nts.tools.phprefactor.tools.refactoring.operations;

import com.fasterxml.jackson.databind.JsonNode;
import ru.nts.tools.phprefactor.core.NtsParamException;
import ru.nts.tools.phprefactor.core.analysis.Binding;
import ru.nts.tools.phprefactor.core.analysis.SelectionRange;

import java.util.regex.Pattern;

/**
 * Чтение и проверка параметров операций.
 */
final class OperationParams {

    /**
     * Идентификатор PHP: буква, '_' или байт 0x80-0xff, затем то же или цифры.
     */
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\u0080-\\uFFFF][A-Za-z0-9_\\u0080-\\uFFFF]*");

    private OperationParams() {}

    static String requireText(JsonNode params, String name) {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            throw NtsParamException.missing(name);
        }
        if (!value.isTextual()) {
            throw NtsParamException.invalid(name, value.toString(), "string");
        }
        return value.asText();
    }

    static int requireLine(JsonNode params, String name) {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            throw NtsParamException.missing(name);
        }
        return toLine(name, value);
    }

    static int optionalInt(JsonNode params, String name, int defaultValue) {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt() && !(value.isTextual() && value.asText().matches("\\d+"))) {
            throw NtsParamException.invalid(name, value.toString(), "integer");
        }
        return value.asInt();
    }

    private static int toLine(String name, JsonNode value) {
        int line;
        if (value.canConvertToInt() && value.isIntegralNumber()) {
            line = value.asInt();
        } else if (value.isTextual() && value.asText().trim().matches("\\d+")) {
            line = Integer.parseInt(value.asText().trim());
        } else {
            throw NtsParamException.invalid(name, value.toString(), "positive integer");
        }
        if (line < 1) {
            throw NtsParamException.outOfRange(name, line, 1, Integer.MAX_VALUE);
        }
        return line;
    }

    /**
     * Имя переменной без '$'. Пустое имя и недопустимый идентификатор отклоняются.
     */
    static String requireVariableName(JsonNode params, String name) {
        String normalized = Binding.normalize(requireText(params, name));
        if (normalized.isEmpty()) {
            throw NtsParamException.emptyName(name);
        }
        if (!IDENTIFIER.matcher(normalized).matches()) {
            throw NtsParamException.invalid(name, normalized, "PHP variable name");
        }
        return normalized;
    }

    /**
     * Имя функции или метода.
     */
    static String requireFunctionName(JsonNode params, String name) {
        String value = requireText(params, name).trim();
        if (value.isEmpty()) {
            throw NtsParamException.missing(name);
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw NtsParamException.invalid(name, value, "PHP function name");
        }
        return value;
    }

    /**
     * Выделение из "selectionRange" ("L:C-L:C") или из startLine/startColumn/endLine/endColumn.
     */
    static SelectionRange requireSelection(JsonNode params) {
        JsonNode text = params.get("selectionRange");
        if (text != null && !text.isNull()) {
            try {
                return SelectionRange.parse(text.asText());
            } catch (IllegalArgumentException e) {
                throw NtsParamException.invalid("selectionRange", text.asText(), "line:column-line:column");
            }
        }
        if (!params.has("startLine")) {
            throw NtsParamException.missing("selectionRange");
        }
        int startLine = requireLine(params, "startLine");
        int endLine = params.has("endLine") ? requireLine(params, "endLine") : startLine;
        if (endLine < startLine) {
            throw NtsParamException.outOfRange("endLine", endLine, startLine, Integer.MAX_VALUE);
        }
        int startColumn = optionalInt(params, "startColumn", 0);
        int endColumn = optionalInt(params, "endColumn", 0);
        if (startColumn < 0 || endColumn < 0) {
            throw NtsParamException.outOfRange(startColumn < 0 ? "startColumn" : "endColumn",
                    Math.min(startColumn, endColumn), 0, Integer.MAX_VALUE);
        }
        return new SelectionRange(startLine, startColumn, endLine, endColumn);
    }
}
