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
 * MCP Tool для переименования локальной переменной PHP в пределах её области видимости.
 */
public class RenameVariableTool extends PhpRefactoringTool {

    public RenameVariableTool() {
        super("rename_variable");
    }

    @Override
    public String getDescription() {
        return """
                Rename a PHP variable inside the function, method or closure that contains the given line.
                Same-named variables in other functions and nested closures that declare it as a parameter
                are left untouched. Outside any function only top-level occurrences are renamed.

                Returns the full rewritten source in 'code'; the file itself is not modified.
                """;
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = baseSchema();
        ObjectNode properties = properties(schema);

        properties.putObject("line")
                .put("type", "integer")
                .put("minimum", 1)
                .put("description", "Any line (1-based) inside the scope where the variable is used");
        properties.putObject("oldName")
                .put("type", "string")
                .put("description", "Current variable name, with or without '$'");
        properties.putObject("newName")
                .put("type", "string")
                .put("description", "New variable name, with or without '$'");

        schema.putArray("required").add("file").add("line").add("oldName").add("newName");
        return schema;
    }
}
