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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Роутер для управления инструментами (Tools) и маршрутизации запросов от MCP клиента.
 * Реализует реестр инструментов и предоставляет интерфейс для их динамического вызова.
 */
public class McpRouter {

    /**
     * Карта зарегистрированных инструментов, где ключ - имя инструмента.
     * Порядок регистрации сохраняется в ответе tools/list.
     */
    private final Map<String, McpTool> tools = new LinkedHashMap<>();

    private final ObjectMapper mapper;

    /**
     * Создает новый роутер с привязкой к ObjectMapper.
     *
     * @param mapper Объект ObjectMapper, используемый для работы с JSON.
     */
    public McpRouter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Регистрирует новый инструмент в реестре сервера.
     * После регистрации инструмент становится доступен для вызова через 'tools/call'.
     *
     * @param tool Объект реализации инструмента.
     */
    public void registerTool(McpTool tool) {
        tools.put(tool.getName(), tool);
    }

    /**
     * Формирует список всех доступных инструментов в формате, соответствующем протоколу MCP.
     * Используется для ответа на запрос 'tools/list'.
     *
     * @return JsonNode вида {"tools": [{name, description, category, inputSchema}, ...]}
     */
    public JsonNode listTools() {
        ArrayNode toolsArray = mapper.createArrayNode();
        for (McpTool tool : tools.values()) {
            ObjectNode toolNode = mapper.createObjectNode();
            toolNode.put("name", tool.getName());
            // Префикс категории в описании для UI клиентов
            toolNode.put("description", "[" + tool.getCategory().toUpperCase() + "] " + tool.getDescription());
            toolNode.put("category", tool.getCategory());
            toolNode.set("inputSchema", tool.getInputSchema());
            toolsArray.add(toolNode);
        }
        ObjectNode result = mapper.createObjectNode();
        result.set("tools", toolsArray);
        return result;
    }

    /**
     * Выполняет вызов инструмента по его уникальному имени.
     *
     * @param name   Имя инструмента.
     * @param params JSON-узел с аргументами вызова.
     *
     * @return JSON-узел с результатом выполнения инструмента.
     *
     * @throws IllegalArgumentException Если инструмент не найден.
     */
    public JsonNode callTool(String name, JsonNode params) {
        McpTool tool = getTool(name);
        if (tool == null) {
            throw new IllegalArgumentException("Tool not found: " + name);
        }
        return tool.executeWithFeedback(params);
    }

    /**
     * @return Реализация {@link McpTool} или null, если инструмент не зарегистрирован.
     */
    public McpTool getTool(String name) {
        return tools.get(name);
    }
}
