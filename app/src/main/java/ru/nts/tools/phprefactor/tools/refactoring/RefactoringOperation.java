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

/**
 * Базовый интерфейс для операций рефакторинга.
 * Каждая операция читает файл, преобразует дерево и возвращает новый исходник целиком.
 */
public interface RefactoringOperation {

    /**
     * Имя операции (rename_variable, extract_variable, extract_method).
     */
    String getName();

    /**
     * Выполняет операцию рефакторинга.
     *
     * @param params параметры операции
     * @param context контекст выполнения
     * @return результат операции
     * @throws RefactoringException если цель рефакторинга не найдена или выделение некорректно
     */
    RefactoringResult execute(JsonNode params, RefactoringContext context) throws RefactoringException;

    /**
     * Валидирует параметры операции до чтения файла.
     *
     * @param params параметры для проверки
     * @throws ru.nts.tools.phprefactor.core.NtsParamException если параметры некорректны
     */
    void validateParams(JsonNode params);
}
