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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.phprefactor.core.McpTool;

/**
 * Базовый MCP-инструмент над одной операцией {@link RefactoringEngine}.
 *
 * Ответ - один текстовый блок с JSON результата; при неудаче дополнительно выставляется isError.
 * Файл на диске не изменяется: клиент получает полный новый исходник в поле code.
 */
public abstract class PhpRefactoringTool implements McpTool {

    protected static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String action;
    private final RefactoringEngine engine;

    protected PhpRefactoringTool(String action) {
        this(action, RefactoringEngine.getInstance());
    }

    protected PhpRefactoringTool(String action, RefactoringEngine engine) {
        this.action = action;
        this.engine = engine;
    }

    @Override
    public String getName() {
        return action;
    }

    @Override
    public String getCategory() {
        return "refactoring";
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        JsonNode arguments = params != null ? params : MAPPER.createObjectNode();
        RefactoringResult result = engine.execute(action, arguments);
        return toResponse(result);
    }

    /**
     * Оборачивает результат в формат контента MCP.
     */
    protected JsonNode toResponse(RefactoringResult result) throws Exception {
        ObjectNode response = MAPPER.createObjectNode();
        response.putArray("content").addObject()
                .put("type", "text")
                .put("text", MAPPER.writeValueAsString(result.toJson(MAPPER)));
        if (!result.success()) {
            response.put("isError", true);
        }
        return response;
    }

    /**
     * Заготовка схемы: {"type": "object", "properties": {"file": ...}}.
     */
    protected static ObjectNode baseSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("file")
                .put("type", "string")
                .put("description", "Path to the PHP file, absolute or relative to the project root");
        return schema;
    }

    protected static ObjectNode properties(ObjectNode schema) {
        return (ObjectNode) schema.get("properties");
    }
}
