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
import ru.nts.tools.phprefactor.core.analysis.BindingRewriter;
import ru.nts.tools.phprefactor.core.analysis.ScopeBoundary;
import ru.nts.tools.phprefactor.core.analysis.ScopeLocator;
import ru.nts.tools.phprefactor.core.analysis.SelectionRange;
import ru.nts.tools.phprefactor.core.analysis.SpanMatcher;
import ru.nts.tools.phprefactor.core.analysis.StatementInserter;
import ru.nts.tools.phprefactor.core.tree.NodeKind;
import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringContext;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringException;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringOperation;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringResult;

import java.util.List;

/**
 * Операция извлечения выражения в переменную (extract variable / introduce variable).
 *
 * Выражение выбирается по диапазону: самое длинное выражение, пересекающее выделение.
 * Перед содержащим его оператором вставляется {@code $name = <expr>;}, а все вхождения
 * того же текста внутри оператора заменяются на {@code $name}.
 */
public class ExtractVariableOperation implements RefactoringOperation {

    @Override
    public String getName() {
        return "extract_variable";
    }

    @Override
    public void validateParams(JsonNode params) {
        OperationParams.requireText(params, "file");
        OperationParams.requireSelection(params);
        String name = OperationParams.requireVariableName(params, "variableName");
        if ("this".equals(name)) {
            throw NtsParamException.invalid("variableName", "$this", "variable name other than $this");
        }
    }

    @Override
    public RefactoringResult execute(JsonNode params, RefactoringContext context) throws RefactoringException {
        String file = OperationParams.requireText(params, "file");
        SelectionRange range = OperationParams.requireSelection(params);
        String name = OperationParams.requireVariableName(params, "variableName");

        RefactoringContext.SourceFile source = context.readSource(file);
        context.requireLine(source, range.endLine());
        SyntaxTree tree = context.parse(source);

        SpanMatcher.ExpressionMatch match = SpanMatcher.findBestExpression(tree, range);
        if (!match.isFound()) {
            throw RefactoringException.expressionNotFound(range);
        }
        SyntaxNode expression = match.expression().orElseThrow();
        SyntaxNode anchor = StatementInserter.insertionAnchor(tree, match.statement().orElse(expression));
        if (anchor == null || anchor.kind() == NodeKind.FUNCTION || anchor.kind() == NodeKind.METHOD
                || "declaration_list".equals(tree.parent(anchor).type())) {
            throw RefactoringException.invalidSelection(
                    "expression at " + range + " is not inside an executable statement");
        }

        ScopeBoundary scope = ScopeLocator.enclosingScope(tree, anchor);
        if (!BindingRewriter.resolve(tree, name, scope).isEmpty()) {
            throw RefactoringException.invalidSelection(
                    "variable $" + name + " already exists in " + scope.describe(tree))
                    .addSuggestion("Choose a variable name that is not used in " + scope.describe(tree));
        }

        String expressionText = tree.text(expression);
        int declarationLine = anchor.span().startLine();
        int declarationColumn = tree.indentationOf(anchor).length() + 1;

        List<SyntaxNode> replaced = StatementInserter.replaceOccurrences(tree, anchor, expressionText, "$" + name);
        StatementInserter.insertDeclaration(tree, anchor, name, expressionText);

        RefactoringResult.Builder result = RefactoringResult.builder()
                .action(getName())
                .file(source.displayPath())
                .code(context.print(tree))
                .occurrences(replaced.size())
                .summary(String.format("Extracted '%s' into $%s (%d occurrence(s)) in %s",
                        abbreviate(expressionText), name, replaced.size(), scope.describe(tree)));

        result.addDetail(new RefactoringResult.ChangeDetail(
                declarationLine, declarationColumn, "", "$" + name + " = " + expressionText + ";"));
        for (SyntaxNode node : replaced) {
            result.addDetail(new RefactoringResult.ChangeDetail(
                    node.span().startLine(),
                    tree.columnOf(node.printStart()),
                    tree.text(node),
                    "$" + name));
        }
        return result.build();
    }

    private static String abbreviate(String text) {
        String singleLine = text.replaceAll("\\s+", " ").trim();
        return singleLine.length() > 60 ? singleLine.substring(0, 57) + "..." : singleLine;
    }
}
