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
package ru.nts.tools.phprefactor.tools.refactoring.operations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.NtsException;
import ru.nts.tools.phprefactor.core.PathSanitizer;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringContext;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringException;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringResult;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для ExtractVariableOperation.
 */
class ExtractVariableOperationTest {

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private ExtractVariableOperation operation;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new ExtractVariableOperation();
        PathSanitizer.setRoot(tempDir);
    }

    private ObjectNode params(String file, int line, String variableName) {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", file);
        params.put("startLine", line);
        params.put("variableName", variableName);
        return params;
    }

    private RefactoringResult extract(String source, ObjectNode params) throws Exception {
        Files.writeString(tempDir.resolve(params.get("file").asText()), source);
        return operation.execute(params, new RefactoringContext());
    }

    @Test
    void testValidateParams_requiresSelection() {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", "a.php");
        params.put("variableName", "v");

        NtsException e = assertThrows(NtsException.class, () -> operation.validateParams(params));
        assertEquals("Required parameter missing: selectionRange", e.getMessage());
    }

    @Test
    void testValidateParams_rejectsMalformedRange() {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", "a.php");
        params.put("variableName", "v");
        params.put("selectionRange", "3-5");

        NtsException e = assertThrows(NtsException.class, () -> operation.validateParams(params));
        assertEquals(NtsErrorCode.PARAM_INVALID, e.getCode());
    }

    @Test
    void testExtractInFunction() throws Exception {
        String source = """
                <?php
                function total($price, $qty) {
                    $sum = $price * $qty + 10;
                    return $sum;
                }
                """;

        RefactoringResult result = extract(source, params("total.php", 3, "subtotal"));

        assertTrue(result.success());
        assertEquals("""
                <?php
                function total($price, $qty) {
                    $subtotal = $price * $qty + 10;
                    $sum = $subtotal;
                    return $sum;
                }
                """, result.code());
        assertEquals(1, result.occurrences());
        assertEquals("Extracted '$price * $qty + 10' into $subtotal (1 occurrence(s)) in function total",
                result.summary());

        RefactoringResult.ChangeDetail declaration = result.details().get(0);
        assertEquals(3, declaration.line());
        assertEquals(5, declaration.column());
        assertEquals("$subtotal = $price * $qty + 10;", declaration.after());
        RefactoringResult.ChangeDetail replacement = result.details().get(1);
        assertEquals(12, replacement.column());
        assertEquals("$price * $qty + 10", replacement.before());
    }

    @Test
    void testExtractFunctionCallAtTopLevel() throws Exception {
        RefactoringResult result = extract("<?php\n$x = foo();\n", params("top.php", 2, "$y"));

        assertEquals("<?php\n$y = foo();\n$x = $y;\n", result.code());
        assertTrue(result.summary().endsWith("in top-level scope"));
    }

    @Test
    void testSingleLineRangeTakesWidestExpressionOnLine() throws Exception {
        String source = "<?php\nfunction f($a) {\n    $r = max($a, 1) * max($a, 1);\n    return $r;\n}\n";
        ObjectNode params = mapper.createObjectNode();
        params.put("file", "rep.php");
        params.put("selectionRange", "3:10-3:20");
        params.put("variableName", "m");

        RefactoringResult result = extract(source, params);

        // на одной строке колонки не сужают выбор
        assertEquals(1, result.occurrences());
        assertEquals("<?php\nfunction f($a) {\n    $m = max($a, 1) * max($a, 1);\n    $r = $m;\n    return $r;\n}\n",
                result.code());
    }

    @Test
    void testExpressionInConditionGoesBeforeIf() throws Exception {
        String source = "<?php\nif (count($items) > 10) {\n    echo 'many';\n}\n";

        RefactoringResult result = extract(source, params("if.php", 2, "tooMany"));

        assertEquals("<?php\n$tooMany = count($items) > 10;\nif ($tooMany) {\n    echo 'many';\n}\n", result.code());
    }

    @Test
    void testPropertyDefaultIsRejected() throws Exception {
        String source = "<?php\nclass A {\n    private $rate = 2 * 3;\n}\n";

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(source, params("prop.php", 3, "six")));

        assertEquals(NtsErrorCode.Category.INPUT, e.getCategory());
        assertTrue(e.getMessage().contains("not inside an executable statement"));
    }

    @Test
    void testExistingNameIsRejected() throws Exception {
        String source = "<?php\n$x = 1;\n$y = $x + 2;\n";

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(source, params("dup.php", 3, "x")));

        assertEquals(NtsErrorCode.INVALID_SELECTION, e.getCode());
        assertEquals("Cannot extract selection: variable $x already exists in top-level scope", e.getMessage());
        assertTrue(e.getSuggestions().stream().anyMatch(s -> s.contains("not used in top-level scope")));
    }

    @Test
    void testBlankLineHasNoExpression() throws Exception {
        String source = "<?php\n$a = 1 + 1;\n\n// note\n";

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(source, params("blank.php", 3, "v")));
        assertEquals(NtsErrorCode.Category.NOT_FOUND, e.getCategory());
        assertEquals("No expression found at 3:0-3:0", e.getMessage());

        assertThrows(RefactoringException.class, () -> extract(source, params("blank.php", 4, "v")));
    }
}
