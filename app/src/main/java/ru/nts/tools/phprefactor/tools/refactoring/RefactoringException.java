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
package ru.nts.tools.phprefactor.tools.refactoring;

import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.analysis.SelectionRange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Исключение при выполнении операции рефакторинга.
 * Несёт код ошибки, по которому клиент получает errorType, и подсказки.
 */
public class RefactoringException extends Exception {

    private final NtsErrorCode code;
    private final List<String> suggestions;

    public RefactoringException(NtsErrorCode code, String message) {
        super(message);
        this.code = code;
        this.suggestions = new ArrayList<>();
    }

    public RefactoringException(NtsErrorCode code, String message, List<String> suggestions) {
        super(message);
        this.code = code;
        this.suggestions = suggestions != null ? new ArrayList<>(suggestions) : new ArrayList<>();
    }

    private RefactoringException(NtsErrorCode code, Map<String, Object> context) {
        this(code, code.formatMessage(context), List.of(code.formatSolution(context)));
    }

    public NtsErrorCode getCode() {
        return code;
    }

    public NtsErrorCode.Category getCategory() {
        return code.getCategory();
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public RefactoringException addSuggestion(String suggestion) {
        this.suggestions.add(suggestion);
        return this;
    }

    // Фабричные методы для типичных ошибок
    public static RefactoringException variableNotFound(String name, String scope) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("name", name);
        ctx.put("scope", scope);
        return new RefactoringException(NtsErrorCode.VARIABLE_NOT_FOUND, ctx);
    }

    public static RefactoringException expressionNotFound(SelectionRange range) {
        return new RefactoringException(NtsErrorCode.EXPRESSION_NOT_FOUND, Map.of("range", range.toString()));
    }

    public static RefactoringException statementsNotFound(int startLine, int endLine) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("startLine", startLine);
        ctx.put("endLine", endLine);
        return new RefactoringException(NtsErrorCode.STATEMENTS_NOT_FOUND, ctx);
    }

    public static RefactoringException invalidSelection(String reason) {
        return new RefactoringException(NtsErrorCode.INVALID_SELECTION, Map.of("reason", reason));
    }
}
