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
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * MCP Tool для извлечения выражения в переменную.
 * Регистрируется дважды: extract_variable и introduce_variable.
 */
public class ExtractVariableTool extends PhpRefactoringTool {

    public ExtractVariableTool() {
        this("extract_variable");
    }

    public ExtractVariableTool(String name) {
        super(name);
    }

    @Override
    public String getDescription() {
        return """
                Extract the PHP expression at a range into a new variable.
                The longest expression starting on the selected line (or overlapping a multi-line range)
                is chosen; assignments and bare variables are never extracted. '$name = <expr>;' is
                inserted before the enclosing statement and identical expressions in that statement
                are replaced by '$name'.

                Returns the full rewritten source in 'code'; the file itself is not modified.
                """;
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = baseSchema();
        ObjectNode properties = properties(schema);

        properties.putObject("selectionRange")
                .put("type", "string")
                .put("pattern", "^\\s*\\d+:\\d+\\s*-\\s*\\d+:\\d+\\s*$")
                .put("description", "Range as 'startLine:startColumn-endLine:endColumn', e.g. '3:10-3:25'");
        properties.putObject("startLine")
                .put("type", "integer")
                .put("minimum", 1)
                .put("description", "Alternative to selectionRange: first line (1-based)");
        properties.putObject("startColumn")
                .put("type", "integer")
                .put("minimum", 0)
                .put("description", "Alternative to selectionRange: first column");
        properties.putObject("endLine")
                .put("type", "integer")
                .put("minimum", 1)
                .put("description", "Alternative to selectionRange: last line (defaults to startLine)");
        properties.putObject("endColumn")
                .put("type", "integer")
                .put("minimum", 0)
                .put("description", "Alternative to selectionRange: last column");
        properties.putObject("variableName")
                .put("type", "string")
                .put("description", "Name of the new variable, with or without '$'");

        schema.putArray("required").add("file").add("variableName");
        return schema;
    }
}
