// Aristo 23.12.2025
package ru.nts.tools.phprefactor.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Базовый интерфейс для реализации инструментов (Tools) в рамках Model Context Protocol.
 */
public interface McpTool {

    String getName();
    String getDescription();
    String getCategory();
    JsonNode getInputSchema();
    JsonNode execute(JsonNode params) throws Exception;

    /**
     * Обертка над execute для обеспечения информативной обратной связи при ошибках.
     * Исключение, вылетевшее из инструмента, не должно рвать JSON-RPC соединение.
     */
    default JsonNode executeWithFeedback(JsonNode params) {
        try {
            return execute(params);
        } catch (NtsException e) {
            return createErrorResponse(e.getCategory().name(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return createErrorResponse("INVALID_ARGUMENTS", "Invalid request parameters: " + e.getMessage());
        } catch (SecurityException e) {
            return createErrorResponse("SECURITY_VIOLATION", "Security policy violation: " + e.getMessage());
        } catch (IllegalStateException e) {
            return createErrorResponse("VALIDATION_FAILED", "State validation failed: " + e.getMessage());
        } catch (java.io.IOException e) {
            return createErrorResponse("SYSTEM_ERROR", "System I/O error: " + e.getMessage());
        } catch (Exception e) {
            return createErrorResponse("INTERNAL_BUG", "Internal server error: " + e.toString());
        }
    }

    private JsonNode createErrorResponse(String type, String message) {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", "Error [" + type + "]: " + message);
        res.put("isError", true);
        return res;
    }
}
