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
package ru.nts.tools.phprefactor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.phprefactor.core.McpRouter;
import ru.nts.tools.phprefactor.core.PathSanitizer;
import ru.nts.tools.phprefactor.tools.refactoring.ExtractMethodTool;
import ru.nts.tools.phprefactor.tools.refactoring.ExtractVariableTool;
import ru.nts.tools.phprefactor.tools.refactoring.RenameVariableTool;

import java.io.BufferedReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.LocalDateTime;

/**
 * Основной класс MCP сервера рефакторинга PHP.
 * Реализует протокол Model Context Protocol через стандартные потоки ввода-вывода (stdio).
 *
 * Сообщения обрабатываются строго по одному в порядке поступления:
 * каждый вызов читает файл, строит дерево, преобразует его и возвращает новый исходник.
 */
public class McpServer {

    private static final String SERVER_NAME = "NTS-PHP-Refactor-MCP";
    private static final String SERVER_VERSION = "1.0.0";
    private static final String PROTOCOL_VERSION = "2024-11-05";

    /**
     * Флаг включения отладочной информации в stderr.
     * Некоторые клиенты объединяют stderr и stdout, поэтому по умолчанию выключен.
     * Включить можно через переменную окружения MCP_DEBUG=true
     */
    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("MCP_DEBUG"));

    /**
     * Путь к файлу логов. Если установлен MCP_LOG_FILE, логи пишутся в файл.
     */
    private static final String LOG_FILE = System.getenv("MCP_LOG_FILE");
    private static PrintWriter logWriter = null;

    static {
        if (LOG_FILE != null && !LOG_FILE.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(LOG_FILE, StandardCharsets.UTF_8, true), true);
            } catch (IOException e) {
                System.err.println("Cannot open MCP_LOG_FILE '" + LOG_FILE + "', file logging disabled: " + e.getMessage());
            }
        }
    }

    /**
     * Записывает сообщение в лог-файл (если настроен) и в stderr при MCP_DEBUG=true.
     */
    static void log(String message) {
        if (logWriter != null) {
            logWriter.println("[" + LocalDateTime.now() + "] " + message);
        }
        if (DEBUG) {
            System.err.println(message);
        }
    }

    private final ObjectMapper mapper;
    private final McpRouter router;
    private final PrintStream out;

    public McpServer(PrintStream out) {
        this(new ObjectMapper(), out);
    }

    McpServer(ObjectMapper mapper, PrintStream out) {
        this.mapper = mapper;
        this.out = out;
        this.router = new McpRouter(mapper);

        // Регистрация инструментов рефакторинга
        router.registerTool(new RenameVariableTool());
        router.registerTool(new ExtractVariableTool());
        router.registerTool(new ExtractVariableTool("introduce_variable"));
        router.registerTool(new ExtractMethodTool());
    }

    public McpRouter getRouter() {
        return router;
    }

    /**
     * Точка входа в приложение. Инициализирует цикл чтения команд.
     *
     * @param args Аргументы командной строки.
     */
    public static void main(String[] args) {
        // UTF-8 для стандартных потоков: на Windows по умолчанию используется системная кодировка
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        // Клиенты MCP могут запускать сервер с произвольным CWD
        String projectRoot = System.getenv("PROJECT_ROOT");
        if (projectRoot != null && !projectRoot.isBlank()) {
            PathSanitizer.setRoot(Paths.get(projectRoot));
            log("Project root set from PROJECT_ROOT env: " + projectRoot);
        } else {
            log("No PROJECT_ROOT env found, using CWD as root: " + PathSanitizer.getRoot());
        }

        log("MCP Server starting...");
        McpServer server = new McpServer(System.out);
        try (var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            server.serve(reader);
        } catch (IOException e) {
            log("Error in server loop: " + e.getMessage());
            if (logWriter != null) {
                e.printStackTrace(logWriter);
            }
        }
        log("MCP Server stopped");
    }

    /**
     * Читает сообщения построчно до конца потока.
     */
    public void serve(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            ObjectNode response = processMessage(line);
            if (response != null) {
                sendResponse(response);
            }
        }
    }

    /**
     * Обрабатывает одиночное JSON-RPC сообщение.
     * Выполняет парсинг, маршрутизацию к соответствующему методу и формирование ответа.
     *
     * @param message Строка, содержащая JSON-RPC запрос.
     * @return ответ или null для уведомлений и нечитаемых сообщений
     */
    public ObjectNode processMessage(String message) {
        JsonNode request;
        try {
            request = mapper.readTree(message);
        } catch (IOException e) {
            log("Failed to parse message: " + e.getMessage());
            return null;
        }
        if (request == null || !request.isObject()) {
            log("Ignoring non-object message: " + message);
            return null;
        }

        String method = request.path("method").asText();
        JsonNode id = request.get("id");
        log("<<< RECV: " + method + (id != null ? " (id=" + id + ")" : ""));

        // Подготовка базового каркаса ответа
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        if (id != null) {
            response.set("id", id);
        }

        try {
            // Диспетчеризация методов MCP протокола
            switch (method) {
                case "initialize" -> {
                    JsonNode clientInfo = request.path("params").path("clientInfo");
                    log("Client info: " + clientInfo.path("name").asText() + " (" + clientInfo.path("version").asText() + ")");

                    ObjectNode result = mapper.createObjectNode();
                    result.put("protocolVersion", PROTOCOL_VERSION);
                    ObjectNode capabilities = result.putObject("capabilities");
                    capabilities.putObject("tools").put("listChanged", false);
                    capabilities.putObject("resources").put("listChanged", false).put("subscribe", false);
                    capabilities.putObject("prompts").put("listChanged", false);
                    capabilities.putObject("logging");

                    ObjectNode serverInfo = result.putObject("serverInfo");
                    serverInfo.put("name", SERVER_NAME);
                    serverInfo.put("version", SERVER_VERSION);
                    response.set("result", result);
                }
                case "notifications/initialized" -> {
                    // По стандарту ответ на уведомление не отправляется
                    log("Client initialized connection.");
                    return null;
                }
                case "ping" -> response.set("result", mapper.createObjectNode());
                case "resources/list" -> {
                    ObjectNode result = mapper.createObjectNode();
                    result.putArray("resources");
                    response.set("result", result);
                }
                case "prompts/list" -> {
                    ObjectNode result = mapper.createObjectNode();
                    result.putArray("prompts");
                    response.set("result", result);
                }
                case "tools/list" -> response.set("result", router.listTools());
                case "tools/call" -> {
                    JsonNode params = request.path("params");
                    String toolName = params.path("name").asText(null);
                    if (toolName == null || toolName.isBlank()) {
                        throw new IllegalArgumentException("Missing tool name");
                    }
                    JsonNode arguments = params.path("arguments");
                    if (arguments.isMissingNode() || arguments.isNull()) {
                        arguments = mapper.createObjectNode();
                    }
                    response.set("result", router.callTool(toolName, arguments));
                }
                case "logging/setLevel" -> response.set("result", mapper.createObjectNode());
                default -> {
                    if (id == null) {
                        // Неизвестное уведомление
                        return null;
                    }
                    ObjectNode error = mapper.createObjectNode();
                    error.put("code", -32601);
                    error.put("message", "Method not found: " + method);
                    response.set("error", error);
                }
            }
        } catch (IllegalArgumentException e) {
            log("IllegalArgumentException: " + e.getMessage());
            ObjectNode error = mapper.createObjectNode();
            error.put("code", -32602);
            error.put("message", "Invalid params: " + e.getMessage());
            response.set("error", error);
        } catch (RuntimeException e) {
            log("Exception in tool: " + e.getClass().getName() + ": " + e.getMessage());
            if (logWriter != null) {
                e.printStackTrace(logWriter);
            }
            ObjectNode error = mapper.createObjectNode();
            error.put("code", -32603);
            error.put("message", "Internal error: " + e.getMessage());
            response.set("error", error);
        }

        return id != null ? response : null;
    }

    private void sendResponse(ObjectNode response) {
        try {
            String json = mapper.writeValueAsString(response);
            log(">>> SEND: " + json);
            out.print(json + "\n");
            out.flush();
        } catch (IOException e) {
            log("Failed to send response: " + e.getMessage());
        }
    }
}
