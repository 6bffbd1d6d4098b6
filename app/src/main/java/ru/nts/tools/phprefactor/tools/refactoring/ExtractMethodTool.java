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
 * MCP Tool для извлечения операторов в функцию или метод.
 */
public class ExtractMethodTool extends PhpRefactoringTool {

    public ExtractMethodTool() {
        super("extract_method");
    }

    @Override
    public String getDescription() {
        return """
                Move whole PHP statements between startLine and endLine into a new function.
                Inside a class method a private (static) method is created and called via $this-> (self::);
                elsewhere a plain function is added. Variables defined before the selection become
                parameters, variables assigned in it and read afterwards are returned.
                Selections with return statements or partial statements are rejected.

                Returns the full rewritten source in 'code'; the file itself is not modified.
                """;
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = baseSchema();
        ObjectNode properties = properties(schema);

        properties.putObject("startLine")
                .put("type", "integer")
                .put("minimum", 1)
                .put("description", "First line of the statements to extract (1-based)");
        properties.putObject("endLine")
                .put("type", "integer")
                .put("minimum", 1)
                .put("description", "Last line of the statements to extract (defaults to startLine)");
        properties.putObject("selectionRange")
                .put("type", "string")
                .put("description", "Alternative to startLine/endLine: 'startLine:col-endLine:col' (columns ignored)");
        properties.putObject("methodName")
                .put("type", "string")
                .put("description", "Name of the new function or method");

        schema.putArray("required").add("file").add("methodName");
        return schema;
    }
}
