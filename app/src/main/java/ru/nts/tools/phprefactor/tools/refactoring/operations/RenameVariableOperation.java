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

import com.fasterxml.jackson.databind.JsonNode;
import ru.nts.tools.phprefactor.core.NtsParamException;
import ru.nts.tools.phprefactor.core.analysis.Binding;
import ru.nts.tools.phprefactor.core.analysis.BindingRewriter;
import ru.nts.tools.phprefactor.core.analysis.ScopeBoundary;
import ru.nts.tools.phprefactor.core.analysis.ScopeLocator;
import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringContext;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringException;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringOperation;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringResult;

/**
 * Переименование локальной переменной.
 *
 * Область переименования определяется строкой {@code line}: ближайшая функция, метод,
 * замыкание или стрелочная функция, содержащая строку, либо верхний уровень файла.
 * Вложенные функции, которые объявляют переменную с тем же именем своим параметром, не затрагиваются.
 */
public class RenameVariableOperation implements RefactoringOperation {

    @Override
    public String getName() {
        return "rename_variable";
    }

    @Override
    public void validateParams(JsonNode params) {
        OperationParams.requireText(params, "file");
        OperationParams.requireLine(params, "line");
        OperationParams.requireVariableName(params, "oldName");
        String newName = OperationParams.requireVariableName(params, "newName");
        if ("this".equals(newName)) {
            throw NtsParamException.invalid("newName", "$this",
                    "variable name other than $this");
        }
    }

    @Override
    public RefactoringResult execute(JsonNode params, RefactoringContext context) throws RefactoringException {
        String file = OperationParams.requireText(params, "file");
        int line = OperationParams.requireLine(params, "line");
        String oldName = OperationParams.requireVariableName(params, "oldName");
        String newName = OperationParams.requireVariableName(params, "newName");

        RefactoringContext.SourceFile source = context.readSource(file);
        context.requireLine(source, line);
        SyntaxTree tree = context.parse(source);

        ScopeBoundary boundary = ScopeLocator.findScope(tree, line);
        String scope = boundary.describe(tree);
        Binding binding = BindingRewriter.rewrite(tree, oldName, newName, boundary);
        if (binding.isEmpty()) {
            throw RefactoringException.variableNotFound(oldName, scope);
        }

        RefactoringResult.Builder result = RefactoringResult.builder()
                .action(getName())
                .file(source.displayPath())
                .code(context.print(tree))
                .occurrences(binding.size())
                .summary(String.format("Renamed $%s to $%s: %d occurrence(s) in %s",
                        oldName, newName, binding.size(), scope));

        for (int id : binding.occurrences()) {
            SyntaxNode variable = tree.node(id);
            result.addDetail(new RefactoringResult.ChangeDetail(
                    variable.span().startLine(),
                    tree.columnOf(variable.printStart()),
                    "$" + oldName,
                    "$" + newName));
        }
        return result.build();
    }
}
