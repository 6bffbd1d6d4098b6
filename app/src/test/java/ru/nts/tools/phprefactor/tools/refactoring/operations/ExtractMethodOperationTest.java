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
 * Тесты для ExtractMethodOperation.
 * Проверяет:
 * - параметры и возвращаемые значения по потоку переменных
 * - вызов через $this-> и self:: для методов
 * - отказ для return, разрезанных операторов и занятых имён
 */
class ExtractMethodOperationTest {

    private static final String REPORT = """
            <?php
            function report($items) {
                $total = 0;
                foreach ($items as $item) {
                    $total += $item;
                }
                echo $total;
            }
            """;

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private ExtractMethodOperation operation;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new ExtractMethodOperation();
        PathSanitizer.setRoot(tempDir);
    }

    private ObjectNode params(String file, int startLine, int endLine, String methodName) {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", file);
        params.put("startLine", startLine);
        params.put("endLine", endLine);
        params.put("methodName", methodName);
        return params;
    }

    private RefactoringResult extract(String source, ObjectNode params) throws Exception {
        Files.writeString(tempDir.resolve(params.get("file").asText()), source);
        return operation.execute(params, new RefactoringContext());
    }

    @Test
    void testValidateParams_requiresMethodName() {
        ObjectNode params = params("a.php", 1, 2, "x");
        params.remove("methodName");

        NtsException e = assertThrows(NtsException.class, () -> operation.validateParams(params));
        assertEquals(NtsErrorCode.PARAM_MISSING, e.getCode());
    }

    @Test
    void testValidateParams_rejectsInvertedRange() {
        assertThrows(NtsException.class, () -> operation.validateParams(params("a.php", 5, 3, "x")));
        assertThrows(NtsException.class, () -> operation.validateParams(params("a.php", 1, 2, "has space")));
    }

    @Test
    void testExtractFromFunction() throws Exception {
        RefactoringResult result = extract(REPORT, params("report.php", 3, 6, "sumItems"));

        assertTrue(result.success());
        assertEquals("""
                <?php
                function report($items) {
                    $total = sumItems($items);
                    echo $total;
                }

                function sumItems($items)
                {
                    $total = 0;
                    foreach ($items as $item) {
                        $total += $item;
                    }
                    return $total;
                }
                """, result.code());
        assertEquals(2, result.occurrences());
        assertEquals("Extracted 2 statement(s) from function report into function sumItems($items)", result.summary());

        RefactoringResult.ChangeDetail call = result.details().get(0);
        assertEquals(3, call.line());
        assertEquals(5, call.column());
        assertEquals("$total = sumItems($items);", call.after());
        RefactoringResult.ChangeDetail definition = result.details().get(1);
        assertEquals(7, definition.line());
        assertTrue(definition.after().startsWith("function sumItems($items)\n{"));
    }

    @Test
    void testExtractFromMethodUsesThis() throws Exception {
        String source = """
                <?php
                class Cart
                {
                    private $items = [];

                    public function total()
                    {
                        $sum = 0;
                        foreach ($this->items as $price) {
                            $sum += $price;
                        }
                        return $sum;
                    }
                }
                """;

        RefactoringResult result = extract(source, params("Cart.php", 8, 11, "sumPrices"));

        assertEquals("""
                <?php
                class Cart
                {
                    private $items = [];

                    public function total()
                    {
                        $sum = $this->sumPrices();
                        return $sum;
                    }

                    private function sumPrices()
                    {
                        $sum = 0;
                        foreach ($this->items as $price) {
                            $sum += $price;
                        }
                        return $sum;
                    }
                }
                """, result.code());
        assertTrue(result.summary().contains("into method sumPrices()"));
    }

    @Test
    void testExtractFromStaticMethodUsesSelf() throws Exception {
        String source = """
                <?php
                class MathUtil
                {
                    public static function run($n)
                    {
                        $double = $n * 2;
                        echo $double;
                    }
                }
                """;

        RefactoringResult result = extract(source, params("MathUtil.php", 6, 6, "twice"));

        assertTrue(result.code().contains("        $double = self::twice($n);\n        echo $double;"));
        assertTrue(result.code().contains("    private static function twice($n)\n    {\n        $double = $n * 2;\n"
                + "        return $double;\n    }"));
        assertTrue(result.summary().contains("static method twice($n)"));
    }

    @Test
    void testExtractAtTopLevelReturnsSeveralValues() throws Exception {
        String source = "<?php\n$a = 1;\n$b = 2;\necho $a + $b;\n";

        RefactoringResult result = extract(source, params("top.php", 2, 3, "init"));

        assertEquals("<?php\n[$a, $b] = init();\necho $a + $b;\n\nfunction init()\n{\n    $a = 1;\n    $b = 2;\n"
                + "    return [$a, $b];\n}\n", result.code());
    }

    @Test
    void testSelectionRangeColumnsAreIgnored() throws Exception {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", "range.php");
        params.put("selectionRange", "7:5-7:17");
        params.put("methodName", "show");

        RefactoringResult result = extract(REPORT, params);

        assertTrue(result.code().contains("    show($total);\n}"));
        assertTrue(result.code().endsWith("function show($total)\n{\n    echo $total;\n}\n"));
    }

    @Test
    void testHeaderOnlySelectionIsRejected() {
        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(REPORT, params("report.php", 4, 4, "loop")));

        assertEquals(NtsErrorCode.INVALID_SELECTION, e.getCode());
        assertEquals("Cannot extract selection: selection cuts the statement at line 4 in half", e.getMessage());
    }

    @Test
    void testReturnInsideSelectionIsRejected() {
        String source = "<?php\nfunction f($a) {\n    $b = $a;\n    return $b;\n}\n";

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(source, params("ret.php", 3, 4, "g")));

        assertEquals("Cannot extract selection: cannot extract code containing return statements (line 4)", e.getMessage());
    }

    @Test
    void testBreakLeavingSelectionIsRejected() {
        String source = """
                <?php
                function scan($values) {
                    foreach ($values as $v) {
                        if ($v > 3) {
                            break;
                        }
                        echo $v;
                    }
                }
                """;

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(source, params("scan.php", 4, 6, "check")));

        assertEquals(NtsErrorCode.INVALID_SELECTION, e.getCode());
        assertEquals("Cannot extract selection: cannot extract 'break' that targets a loop or switch "
                + "outside the selection (line 5)", e.getMessage());
    }

    @Test
    void testContinueWithLevelLeavingSelectionIsRejected() {
        String source = """
                <?php
                function grid($rows) {
                    foreach ($rows as $row) {
                        foreach ($row as $cell) {
                            if ($cell === null) {
                                continue 2;
                            }
                        }
                        echo count($row);
                    }
                }
                """;

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(source, params("grid.php", 4, 8, "cells")));

        assertTrue(e.getMessage().contains("cannot extract 'continue'"), e.getMessage());
    }

    @Test
    void testBreakInsideSelectedLoopIsAllowed() throws Exception {
        String source = """
                <?php
                function scan($values) {
                    foreach ($values as $v) {
                        if ($v > 3) {
                            break;
                        }
                        echo $v;
                    }
                }
                """;

        RefactoringResult result = extract(source, params("scan.php", 3, 8, "printSmall"));

        assertTrue(result.success());
        assertTrue(result.code().contains("    printSmall($values);\n}"));
        assertTrue(result.code().contains("            break;\n"));
    }

    @Test
    void testReturnInsideClosureIsAllowed() throws Exception {
        String source = "<?php\nfunction f($xs) {\n    $m = array_map(function ($x) { return $x * 2; }, $xs);\n"
                + "    return $m;\n}\n";

        RefactoringResult result = extract(source, params("map.php", 3, 3, "doubled"));

        assertTrue(result.code().contains("    $m = doubled($xs);\n"));
    }

    @Test
    void testClassMembersAndDeclarationsAreRejected() {
        String classSource = "<?php\nclass A\n{\n    private $x = 1;\n}\n";
        RefactoringException member = assertThrows(RefactoringException.class,
                () -> extract(classSource, params("A.php", 4, 4, "m")));
        assertTrue(member.getMessage().contains("class members"));

        String functionSource = "<?php\nfunction a() {\n    return 1;\n}\n";
        RefactoringException declaration = assertThrows(RefactoringException.class,
                () -> extract(functionSource, params("fn.php", 2, 4, "b")));
        assertTrue(declaration.getMessage().contains("cannot extract declarations"));
    }

    @Test
    void testNameClashIsRejected() {
        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(REPORT, params("report.php", 3, 6, "Report")));

        assertEquals("Cannot extract selection: function Report already exists at line 2", e.getMessage());
    }

    @Test
    void testCommentOnlyRangeFindsNothing() {
        String source = "<?php\nfunction f() {\n    // nothing here\n    $a = 1;\n}\n";

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> extract(source, params("c.php", 3, 3, "g")));

        assertEquals(NtsErrorCode.STATEMENTS_NOT_FOUND, e.getCode());
        assertEquals("No complete statements found in lines 3-3", e.getMessage());
    }
}
