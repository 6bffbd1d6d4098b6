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
 * Закрытый набор категорий узлов дерева.
 * Все обходы движка рефакторинга классифицируют узлы только через предикаты этого перечисления,
 * поэтому новые типы узлов tree-sitter достаточно отобразить на одну из категорий в {@link ru.nts.tools.phprefactor.core.treesitter.PhpTreeBuilder}.
 */
public enum NodeKind {

    /** Корень файла. */
    PROGRAM,

    /** Список операторов: тело функции, блок if, тело класса. */
    BLOCK,

    /** Именованная функция (function foo() {}). */
    FUNCTION,

    /** Метод класса, интерфейса, трейта или enum. */
    METHOD,

    /** Анонимная функция (function () use ($x) {}). */
    CLOSURE,

    /** Стрелочная функция (fn($x) => $x * 2). */
    ARROW_FUNCTION,

    /** Любой оператор или объявление, кроме функций и методов. */
    STATEMENT,

    /** Простое присваивание ($a = expr). */
    ASSIGNMENT,

    /** Ссылка на переменную ($name). Единственный узел с изменяемым именем. */
    VARIABLE,

    /** Прочие выражения. */
    EXPRESSION,

    /** Служебные узлы: имена, параметры, аргументы, комментарии. */
    OTHER,

    /** Узел, созданный при рефакторинге и не имеющий исходного текста. */
    SYNTHETIC;

    /**
     * Функция, метод, замыкание или стрелочная функция: конструкции, ограничивающие видимость локальных переменных.
     */
    public boolean isScopeIntroducing() {
        return switch (this) {
            case FUNCTION, METHOD, CLOSURE, ARROW_FUNCTION -> true;
            default -> false;
        };
    }

    /**
     * Узлы, которые попадают в стек операторов при поиске выражения.
     * Объявления функций и методов тоже являются операторами.
     */
    public boolean isStatement() {
        return switch (this) {
            case STATEMENT, FUNCTION, METHOD -> true;
            default -> false;
        };
    }

    public boolean isExpression() {
        return switch (this) {
            case EXPRESSION, ASSIGNMENT, VARIABLE, CLOSURE, ARROW_FUNCTION -> true;
            default -> false;
        };
    }

    /**
     * Выражения, которые никогда не выбираются как цель извлечения:
     * ссылка на переменную и само присваивание.
     */
    public boolean isExcludedFromMatching() {
        return this == VARIABLE || this == ASSIGNMENT;
    }

    /**
     * Узлы, чьи дочерние операторы образуют последовательность, в которую можно вставлять новые операторы.
     */
    public boolean isStatementList() {
        return this == PROGRAM || this == BLOCK;
    }
}
