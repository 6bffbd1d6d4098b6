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
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringEngine;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringException;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для RenameVariableOperation.
 * Переименование ограничено областью, найденной по строке; файл на диске не меняется.
 */
class RenameVariableOperationTest {

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private RenameVariableOperation operation;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new RenameVariableOperation();
        PathSanitizer.setRoot(tempDir);
    }

    private ObjectNode params(String file, int line, String oldName, String newName) {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", file);
        params.put("line", line);
        params.put("oldName", oldName);
        params.put("newName", newName);
        return params;
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(tempDir.resolve(name), content);
    }

    @Test
    void testValidateParams_requiresFile() {
        ObjectNode params = params("a.php", 1, "a", "b");
        params.remove("file");

        NtsException e = assertThrows(NtsException.class, () -> operation.validateParams(params));
        assertEquals(NtsErrorCode.PARAM_MISSING, e.getCode());
    }

    @Test
    void testValidateParams_rejectsEmptyName() {
        NtsException e = assertThrows(NtsException.class,
                () -> operation.validateParams(params("a.php", 1, "$", "b")));

        assertEquals(NtsErrorCode.EMPTY_NAME, e.getCode());
        assertEquals("Variable names cannot be empty", e.getMessage());
    }

    @Test
    void testValidateParams_rejectsThisAndBadIdentifiers() {
        assertThrows(NtsException.class, () -> operation.validateParams(params("a.php", 1, "a", "$this")));
        assertThrows(NtsException.class, () -> operation.validateParams(params("a.php", 1, "a", "1abc")));
        assertThrows(NtsException.class, () -> operation.validateParams(params("a.php", 0, "a", "b")));
    }

    @Test
    void testValidateParams_acceptsSigilAndStringLine() {
        ObjectNode params = params("a.php", 1, "$total", "$sum");
        params.put("line", "12");

        assertDoesNotThrow(() -> operation.validateParams(params));
    }

    @Test
    void testRenameInFunction() throws Exception {
        String source = "<?php\nfunction f(){ $a = 1; $b = $a + 2; return $b; }\n";
        write("f.php", source);

        RefactoringResult result = operation.execute(params("f.php", 2, "$a", "z"), new RefactoringContext());

        assertTrue(result.success());
        assertEquals("<?php\nfunction f(){ $z = 1; $b = $z + 2; return $b; }\n", result.code());
        assertEquals(2, result.occurrences());
        assertEquals("Renamed $a to $z: 2 occurrence(s) in function f", result.summary());
        assertEquals(2, result.details().size());
        RefactoringResult.ChangeDetail first = result.details().get(0);
        assertEquals(2, first.line());
        assertEquals(15, first.column());
        assertEquals("$a", first.before());
        assertEquals("$z", first.after());
        // файл на диске не изменяется
        assertEquals(source, Files.readString(tempDir.resolve("f.php")));
    }

    @Test
    void testTopLevelRename() throws Exception {
        write("top.php", "<?php\n$x = 1;\nfunction g(){ $x = 2; }\necho $x;\n");

        RefactoringResult result = operation.execute(params("top.php", 2, "x", "y"), new RefactoringContext());

        assertEquals("<?php\n$y = 1;\nfunction g(){ $x = 2; }\necho $y;\n", result.code());
        assertTrue(result.summary().endsWith("in top-level scope"));
    }

    @Test
    void testRenameInMethodKeepsProperty() throws Exception {
        write("Order.php", """
                <?php
                class Order
                {
                    private $total = 0;

                    public function add(int $total): void
                    {
                        $this->total += $total;
                    }
                }
                """);

        RefactoringResult result = operation.execute(params("Order.php", 8, "total", "amount"), new RefactoringContext());

        assertEquals(2, result.occurrences());
        assertTrue(result.code().contains("private $total = 0;"));
        assertTrue(result.code().contains("public function add(int $amount): void"));
        assertTrue(result.code().contains("$this->total += $amount;"));
    }

    @Test
    void testUnknownVariable() throws Exception {
        write("f.php", "<?php\nfunction f($a) { return $a; }\n");

        RefactoringException e = assertThrows(RefactoringException.class,
                () -> operation.execute(params("f.php", 2, "nope", "b"), new RefactoringContext()));

        assertEquals(NtsErrorCode.VARIABLE_NOT_FOUND, e.getCode());
        assertEquals("Variable $nope not found in function f", e.getMessage());
    }

    @Test
    void testThroughEngine() throws Exception {
        write("utf.php", "<?php\n$имя = 'мир';\necho \"Привет, $имя\";\n");

        RefactoringResult result = RefactoringEngine.getInstance()
                .execute("rename_variable", params("utf.php", 2, "имя", "name"));

        assertTrue(result.success(), String.valueOf(result.error()));
        assertEquals("<?php\n$name = 'мир';\necho \"Привет, $name\";\n", result.code());
    }
}
