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

import com.fasterxml.jackson.databind.JsonNode;
import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.NtsException;
import ru.nts.tools.phprefactor.tools.refactoring.operations.ExtractMethodOperation;
import ru.nts.tools.phprefactor.tools.refactoring.operations.ExtractVariableOperation;
import ru.nts.tools.phprefactor.tools.refactoring.operations.RenameVariableOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Движок рефакторинга.
 * Управляет регистрацией и выполнением операций.
 *
 * Граница обработки ошибок: {@link #execute} никогда не бросает исключений,
 * любая ошибка превращается в результат с success=false и категорией errorType.
 */
public final class RefactoringEngine {

    private static final RefactoringEngine INSTANCE = new RefactoringEngine();

    private final Map<String, RefactoringOperation> operations = new TreeMap<>();

    private RefactoringEngine() {
        // Регистрация встроенных операций
        registerOperation(new RenameVariableOperation());
        registerOperation(new ExtractVariableOperation());
        registerOperation(new ExtractMethodOperation());
        registerAlias("introduce_variable", "extract_variable");
    }

    public static RefactoringEngine getInstance() {
        return INSTANCE;
    }

    /**
     * Регистрирует операцию рефакторинга.
     */
    public void registerOperation(RefactoringOperation operation) {
        operations.put(operation.getName(), operation);
    }

    /**
     * Регистрирует операцию под дополнительным именем.
     */
    public void registerAlias(String alias, String name) {
        RefactoringOperation operation = operations.get(name);
        if (operation == null) {
            throw new IllegalArgumentException("Unknown operation: " + name);
        }
        operations.put(alias, operation);
    }

    /**
     * Получает операцию по имени.
     */
    public RefactoringOperation getOperation(String name) {
        return operations.get(name);
    }

    /**
     * Проверяет, зарегистрирована ли операция.
     */
    public boolean hasOperation(String name) {
        return operations.containsKey(name);
    }

    /**
     * Выполняет операцию рефакторинга с новым контекстом.
     */
    public RefactoringResult execute(String action, JsonNode params) {
        return execute(action, params, RefactoringContext::new);
    }

    /**
     * Выполняет операцию рефакторинга.
     *
     * @param action имя операции или её псевдоним
     * @param params параметры
     * @param contextFactory источник контекста (для тестов)
     * @return результат; при ошибке - результат с success=false
     */
    public RefactoringResult execute(String action, JsonNode params, Supplier<RefactoringContext> contextFactory) {
        RefactoringOperation operation = operations.get(action);
        if (operation == null) {
            return RefactoringResult.failure(action, NtsErrorCode.Category.INPUT,
                    "Unknown refactoring action: " + action,
                    available());
        }

        try {
            operation.validateParams(params);
            return operation.execute(params, contextFactory.get());
        } catch (RefactoringException e) {
            return RefactoringResult.failure(action, e.getCategory(), e.getMessage(), e.getSuggestions());
        } catch (NtsException e) {
            return RefactoringResult.failure(action, e.getCategory(), e.getMessage(), List.of(e.getSolution()));
        } catch (SecurityException e) {
            return RefactoringResult.failure(action, NtsErrorCode.Category.INPUT, e.getMessage(), List.of());
        } catch (RuntimeException e) {
            System.err.println("Refactoring '" + action + "' failed unexpectedly: " + e);
            String details = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return RefactoringResult.failure(action, NtsErrorCode.Category.UNEXPECTED,
                    NtsErrorCode.INTERNAL_ERROR.formatMessage(Map.of("details", details)),
                    List.of(NtsErrorCode.INTERNAL_ERROR.getSolution()));
        }
    }

    /**
     * Возвращает список доступных операций (включая псевдонимы).
     */
    public Iterable<String> getAvailableOperations() {
        return operations.keySet();
    }

    private List<String> available() {
        List<String> suggestions = new ArrayList<>();
        for (String op : getAvailableOperations()) {
            suggestions.add("Available: " + op);
        }
        return suggestions;
    }
}
