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
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.PathSanitizer;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Движок никогда не бросает исключений: любая ошибка превращается в результат с errorType.
 */
class RefactoringEngineTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final RefactoringEngine engine = RefactoringEngine.getInstance();

    @BeforeEach
    void setUp() throws Exception {
        PathSanitizer.setRoot(tempDir);
        Files.writeString(tempDir.resolve("ok.php"), "<?php\n$a = 1;\necho $a;\n");
    }

    private ObjectNode rename(String file, int line, String oldName) {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", file);
        params.put("line", line);
        params.put("oldName", oldName);
        params.put("newName", "b");
        return params;
    }

    @Test
    void testRegisteredOperations() {
        assertTrue(engine.hasOperation("rename_variable"));
        assertTrue(engine.hasOperation("extract_variable"));
        assertTrue(engine.hasOperation("extract_method"));
        assertSame(engine.getOperation("extract_variable"), engine.getOperation("introduce_variable"));
        assertThrows(IllegalArgumentException.class, () -> engine.registerAlias("x", "no_such_operation"));
    }

    @Test
    void testSuccessJson() {
        RefactoringResult result = engine.execute("rename_variable", rename("ok.php", 2, "a"));

        JsonNode json = result.toJson(mapper);
        assertTrue(json.get("success").asBoolean());
        assertEquals("<?php\n$b = 1;\necho $b;\n", json.get("code").asText());
        assertEquals(2, json.get("occurrences").asInt());
        assertEquals(2, json.get("changes").size());
        assertEquals(2, json.get("changes").get(0).get("line").asInt());
        assertFalse(json.has("error"));
    }

    @Test
    void testAliasRunsExtractVariable() throws Exception {
        Files.writeString(tempDir.resolve("call.php"), "<?php\n$x = 1;\necho strtoupper('a');\n");
        ObjectNode params = mapper.createObjectNode();
        params.put("file", "call.php");
        params.put("selectionRange", "3:0-3:0");
        params.put("variableName", "v");

        RefactoringResult result = engine.execute("introduce_variable", params);

        assertTrue(result.success(), String.valueOf(result.error()));
        assertEquals("extract_variable", result.action());
        assertEquals("<?php\n$x = 1;\n$v = strtoupper('a');\necho $v;\n", result.code());
    }

    @Test
    void testUnknownAction() {
        RefactoringResult result = engine.execute("inline_variable", mapper.createObjectNode());

        assertFalse(result.success());
        assertEquals(NtsErrorCode.Category.INPUT, result.errorType());
        assertEquals("Unknown refactoring action: inline_variable", result.error());
        assertTrue(result.suggestions().contains("Available: extract_method"));
    }

    @Test
    void testMissingParameter() {
        ObjectNode params = rename("ok.php", 2, "a");
        params.remove("file");

        RefactoringResult result = engine.execute("rename_variable", params);

        assertEquals(NtsErrorCode.Category.INPUT, result.errorType());
        assertEquals("Required parameter missing: file", result.error());
    }

    @Test
    void testEmptyName() {
        RefactoringResult result = engine.execute("rename_variable", rename("ok.php", 2, "$"));

        assertEquals(NtsErrorCode.Category.INPUT, result.errorType());
        assertEquals("Variable names cannot be empty", result.error());
    }

    @Test
    void testMissingFile() {
        RefactoringResult result = engine.execute("rename_variable", rename("missing.php", 2, "a"));

        assertEquals(NtsErrorCode.Category.INPUT, result.errorType());
        assertTrue(result.error().startsWith("File not found"), result.error());
    }

    @Test
    void testPathOutsideRoot() {
        RefactoringResult result = engine.execute("rename_variable", rename("../outside.php", 2, "a"));

        assertEquals(NtsErrorCode.Category.INPUT, result.errorType());
        assertTrue(result.error().contains("outside of project root"), result.error());
    }

    @Test
    void testLineBeyondEndOfFile() {
        RefactoringResult result = engine.execute("rename_variable", rename("ok.php", 99, "a"));

        assertEquals(NtsErrorCode.Category.INPUT, result.errorType());
        assertTrue(result.error().startsWith("Line 99 exceeds file length"), result.error());
    }

    @Test
    void testParseError() throws Exception {
        Files.writeString(tempDir.resolve("broken.php"), "<?php\nfunction f( {\n");

        RefactoringResult result = engine.execute("rename_variable", rename("broken.php", 2, "a"));

        assertFalse(result.success());
        assertEquals(NtsErrorCode.Category.PARSE, result.errorType());
        assertTrue(result.error().startsWith("Parse error: "), result.error());
    }

    @Test
    void testVariableNotFound() {
        RefactoringResult result = engine.execute("rename_variable", rename("ok.php", 2, "zzz"));

        assertEquals(NtsErrorCode.Category.NOT_FOUND, result.errorType());
        assertEquals("Variable $zzz not found in top-level scope", result.error());
        assertFalse(result.suggestions().isEmpty());
    }

    @Test
    void testInternalInvariantFailureIsUnexpected() {
        RefactoringResult result = engine.execute("rename_variable", rename("ok.php", 2, "a"), () -> {
            throw new IllegalArgumentException("Nodes to replace must be contiguous siblings");
        });

        assertEquals(NtsErrorCode.Category.UNEXPECTED, result.errorType());
        assertEquals("Unexpected error: Nodes to replace must be contiguous siblings", result.error());
    }

    @Test
    void testUnexpectedFailure() {
        RefactoringResult result = engine.execute("rename_variable", rename("ok.php", 2, "a"), () -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(NtsErrorCode.Category.UNEXPECTED, result.errorType());
        assertEquals("Unexpected error: boom", result.error());

        JsonNode json = result.toJson(mapper);
        assertFalse(json.get("success").asBoolean());
        assertEquals("UNEXPECTED", json.get("errorType").asText());
        assertFalse(json.has("code"));
    }
}
