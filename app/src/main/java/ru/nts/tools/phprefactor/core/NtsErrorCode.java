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
package ru.nts.tools.phprefactor.core;

import java.util.Map;

/**
 * Structured error codes for the PHP refactoring tools.
 * Each error has a message template, a solution hint and a category reported to the caller as errorType.
 *
 * <p>Templates use %placeholder% markers resolved from the exception context:
 * <pre>
 * File not found: src/Missing.php
 * Solution: Check the file path. Relative paths are resolved against PROJECT_ROOT.
 * </pre>
 */
public enum NtsErrorCode {

    // ============ File Errors ============

    FILE_NOT_FOUND(Category.INPUT, "File not found: %path%",
            "Check the file path. Relative paths are resolved against PROJECT_ROOT."),

    FILE_NOT_READABLE(Category.INPUT, "File is not readable: %path%",
            "Check file permissions. Ensure the file is not locked."),

    FILE_IS_BINARY(Category.INPUT, "Binary file detected: %path%",
            "Only PHP source files can be refactored."),

    FILE_TOO_LARGE(Category.INPUT, "File too large: %path% (%size% bytes, max %maxAllowed%)",
            "Split the file or refactor it with a text editor."),

    SOURCE_TOO_LARGE(Category.INPUT, "Source too large for parsing: %size% bytes in UTF-8 (max %maxAllowed%)",
            "Split the file or refactor it with a text editor."),

    // ============ Parameter Errors ============

    PARAM_MISSING(Category.INPUT, "Required parameter missing: %parameter%",
            "Provide the required parameter. Check the tool input schema."),

    PARAM_INVALID(Category.INPUT, "Invalid value for '%parameter%': %value% (expected %expected%)",
            "Check parameter type and format. Refer to the tool input schema."),

    PARAM_OUT_OF_RANGE(Category.INPUT, "Parameter '%parameter%' out of range: %value% (allowed %min%..%max%)",
            "Check parameter bounds."),

    PARAM_LINE_EXCEEDS(Category.INPUT, "Line %line% exceeds file length (%totalLines% lines)",
            "File has %totalLines% lines, requested line %line%."),

    EMPTY_NAME(Category.INPUT, "Variable names cannot be empty",
            "Pass a name such as 'total' or '$total'."),

    INVALID_SELECTION(Category.INPUT, "Cannot extract selection: %reason%",
            "Select whole statements of a single block."),

    // ============ Parse Errors ============

    PARSE_ERROR(Category.PARSE, "Parse error: %details%",
            "Fix the syntax error before refactoring."),

    // ============ Lookup Errors ============

    VARIABLE_NOT_FOUND(Category.NOT_FOUND, "Variable $%name% not found in %scope%",
            "Check the variable name and the line: the line selects the function, method or closure to rename in."),

    EXPRESSION_NOT_FOUND(Category.NOT_FOUND, "No expression found at %range%",
            "Select a line containing an expression other than a plain variable or assignment."),

    STATEMENTS_NOT_FOUND(Category.NOT_FOUND, "No complete statements found in lines %startLine%-%endLine%",
            "Select lines covering whole statements."),

    // ============ System Errors ============

    IO_ERROR(Category.UNEXPECTED, "I/O error: %details%",
            "Check disk space and permissions. Try again."),

    INTERNAL_ERROR(Category.UNEXPECTED, "Unexpected error: %details%",
            "Unexpected error. Check logs for details.");

    /**
     * Категория ошибки, возвращаемая клиенту в поле errorType.
     */
    public enum Category {
        INPUT,
        PARSE,
        NOT_FOUND,
        UNEXPECTED
    }

    private final Category category;
    private final String message;
    private final String solution;

    NtsErrorCode(Category category, String message, String solution) {
        this.category = category;
        this.message = message;
        this.solution = solution;
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Resolves the message template against the context.
     *
     * @param context Optional context map (path, parameter, etc.)
     * @return Single-line message
     */
    public String formatMessage(Map<String, Object> context) {
        return interpolate(message, context);
    }

    /**
     * Resolves the solution hint against the context.
     */
    public String formatSolution(Map<String, Object> context) {
        return interpolate(solution, context);
    }

    /**
     * Formats the full error: message, solution and context.
     *
     * @param context Optional context map
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(formatMessage(context)).append("\n");
        sb.append(String.format("[%s] Solution: %s", this.name(), formatSolution(context)));
        return sb.toString();
    }

    private static String interpolate(String template, Map<String, Object> context) {
        String resolved = template;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolved = resolved.replace("%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        return resolved.replaceAll("%\\w+%", "...");
    }
}
