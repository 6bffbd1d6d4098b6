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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.NtsException;
import ru.nts.tools.phprefactor.core.analysis.SelectionRange;

import static org.junit.jupiter.api.Assertions.*;

class OperationParamsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testSelectionFromRangeString() {
        ObjectNode params = mapper.createObjectNode();
        params.put("selectionRange", " 3:10 - 5:2 ");
        params.put("startLine", 99);

        SelectionRange range = OperationParams.requireSelection(params);

        assertEquals(new SelectionRange(3, 10, 5, 2), range);
        assertFalse(range.isSingleLine());
    }

    @Test
    void testSelectionFromLines() {
        ObjectNode params = mapper.createObjectNode();
        params.put("startLine", 4);
        params.put("startColumn", 7);

        assertEquals(new SelectionRange(4, 7, 4, 0), OperationParams.requireSelection(params));
    }

    @Test
    void testSelectionErrors() {
        ObjectNode inverted = mapper.createObjectNode();
        inverted.put("startLine", 5);
        inverted.put("endLine", 2);
        NtsException e = assertThrows(NtsException.class, () -> OperationParams.requireSelection(inverted));
        assertEquals(NtsErrorCode.PARAM_OUT_OF_RANGE, e.getCode());

        ObjectNode negative = mapper.createObjectNode();
        negative.put("startLine", 1);
        negative.put("endColumn", -3);
        assertThrows(NtsException.class, () -> OperationParams.requireSelection(negative));

        ObjectNode backwards = mapper.createObjectNode();
        backwards.put("selectionRange", "5:0-3:0");
        assertEquals(NtsErrorCode.PARAM_INVALID,
                assertThrows(NtsException.class, () -> OperationParams.requireSelection(backwards)).getCode());
    }

    @Test
    void testLineAcceptsNumericString() {
        ObjectNode params = mapper.createObjectNode();
        params.put("line", " 42 ");

        assertEquals(42, OperationParams.requireLine(params, "line"));

        params.put("line", 1.5);
        assertThrows(NtsException.class, () -> OperationParams.requireLine(params, "line"));
        params.put("line", "abc");
        assertThrows(NtsException.class, () -> OperationParams.requireLine(params, "line"));
    }

    @Test
    void testTextMustBeString() {
        ObjectNode params = mapper.createObjectNode();
        params.put("file", 12);

        NtsException e = assertThrows(NtsException.class, () -> OperationParams.requireText(params, "file"));
        assertEquals(NtsErrorCode.PARAM_INVALID, e.getCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"total", "$total", "$$total", "_tmp1", "имя"})
    void testValidVariableNames(String name) {
        ObjectNode params = mapper.createObjectNode();
        params.put("name", name);

        assertFalse(OperationParams.requireVariableName(params, "name").startsWith("$"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1st", "a-b", "a b", "$a.b"})
    void testInvalidVariableNames(String name) {
        ObjectNode params = mapper.createObjectNode();
        params.put("name", name);

        NtsException e = assertThrows(NtsException.class, () -> OperationParams.requireVariableName(params, "name"));
        assertEquals(NtsErrorCode.PARAM_INVALID, e.getCode());
    }

    @Test
    void testFunctionNameIsTrimmed() {
        ObjectNode params = mapper.createObjectNode();
        params.put("methodName", "  calculate ");

        assertEquals("calculate", OperationParams.requireFunctionName(params, "methodName"));

        params.put("methodName", "   ");
        assertEquals(NtsErrorCode.PARAM_MISSING,
                assertThrows(NtsException.class, () -> OperationParams.requireFunctionName(params, "methodName")).getCode());
    }
}
