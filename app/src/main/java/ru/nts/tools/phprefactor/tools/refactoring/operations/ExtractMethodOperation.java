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
import ru.nts.tools.phprefactor.core.analysis.ScopeBoundary;
import ru.nts.tools.phprefactor.core.analysis.ScopeLocator;
import ru.nts.tools.phprefactor.core.analysis.SelectionRange;
import ru.nts.tools.phprefactor.core.analysis.StatementSelection;
import ru.nts.tools.phprefactor.core.analysis.VariableFlow;
import ru.nts.tools.phprefactor.core.tree.NodeKind;
import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringContext;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringException;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringOperation;
import ru.nts.tools.phprefactor.tools.refactoring.RefactoringResult;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Операция извлечения метода (extract method).
 * Выделенные целые операторы переносятся в новую функцию или метод,
 * а на их месте остаётся вызов.
 *
 * Параметры новой функции - переменные, которые используются в выделении и встречаются в области до него.
 * Возвращаются переменные, которые выделение записывает и которые читаются после него.
 */
public class ExtractMethodOperation implements RefactoringOperation {

    private static final String INDENT = "    ";

    private static final Set<String> LOOP_TYPES = Set.of(
            "for_statement", "foreach_statement", "while_statement", "do_statement", "switch_statement");

    @Override
    public String getName() {
        return "extract_method";
    }

    @Override
    public void validateParams(JsonNode params) {
        OperationParams.requireText(params, "file");
        OperationParams.requireFunctionName(params, "methodName");
        lineRange(params);
    }

    @Override
    public RefactoringResult execute(JsonNode params, RefactoringContext context) throws RefactoringException {
        String file = OperationParams.requireText(params, "file");
        String methodName = OperationParams.requireFunctionName(params, "methodName");
        SelectionRange range = lineRange(params);

        RefactoringContext.SourceFile source = context.readSource(file);
        context.requireLine(source, range.endLine());
        SyntaxTree tree = context.parse(source);

        StatementSelection selection = StatementSelection.select(tree, range.startLine(), range.endLine());
        if (selection.isCut()) {
            throw RefactoringException.invalidSelection("selection cuts the statement at line "
                    + selection.cut().span().startLine() + " in half")
                    .addSuggestion("Select whole statements, from the first line of a statement to its last line");
        }
        if (!selection.isFound()) {
            throw RefactoringException.statementsNotFound(range.startLine(), range.endLine());
        }
        checkExtractable(tree, selection);

        ScopeBoundary boundary = ScopeLocator.enclosingScope(tree, selection.container());
        SyntaxNode scopeRoot = boundary.isTopLevel() ? tree.root() : boundary.node(tree);
        checkNameIsFree(tree, scopeRoot, methodName);

        VariableFlow flow = VariableFlow.analyze(tree, scopeRoot, selection.statements());
        String arguments = flow.parameters().stream().map(v -> "$" + v).collect(Collectors.joining(", "));

        boolean method = scopeRoot.kind() == NodeKind.METHOD;
        boolean isStatic = method && tree.childOfType(scopeRoot, "static_modifier") != null;
        SyntaxNode member = insertionPoint(tree, scopeRoot);
        String memberIndent = tree.indentationOf(member);

        String definition = buildDefinition(tree, selection, flow, methodName, arguments, method, isStatic, memberIndent);
        String call = buildCall(flow, methodName, arguments, method, isStatic);

        String selectedText = tree.slice(selection.first().printStart(), selection.last().printEnd());
        int callLine = selection.first().span().startLine();
        int callColumn = tree.columnOf(selection.first().printStart());

        // Вставка раньше замены: member может оказаться последним выделенным оператором
        tree.insertAfter(member, "\n\n" + definition);
        tree.replace(selection.statements(), call);
        String code = context.print(tree);

        String kind = method ? (isStatic ? "static method" : "method") : "function";
        return RefactoringResult.builder()
                .action(getName())
                .file(source.displayPath())
                .code(code)
                .occurrences(selection.statements().size())
                .summary(String.format("Extracted %d statement(s) from %s into %s %s(%s)",
                        selection.statements().size(), boundary.describe(tree), kind, methodName, arguments))
                .addDetail(new RefactoringResult.ChangeDetail(callLine, callColumn, selectedText, call))
                .addDetail(new RefactoringResult.ChangeDetail(lineOf(code, definition), memberIndent.length() + 1, "", definition.trim()))
                .build();
    }

    /**
     * Диапазон строк из startLine/endLine или из selectionRange (колонки игнорируются).
     */
    private static SelectionRange lineRange(JsonNode params) {
        SelectionRange selection = OperationParams.requireSelection(params);
        return SelectionRange.ofLines(selection.startLine(), selection.endLine());
    }

    private static void checkExtractable(SyntaxTree tree, StatementSelection selection) throws RefactoringException {
        if ("declaration_list".equals(selection.container().type())) {
            throw RefactoringException.invalidSelection("class members cannot be extracted into a method");
        }
        for (SyntaxNode statement : selection.statements()) {
            if (statement.kind() == NodeKind.FUNCTION || statement.type().endsWith("_declaration")
                    || "namespace_definition".equals(statement.type())) {
                throw RefactoringException.invalidSelection("cannot extract declarations ("
                        + statement.type() + " at line " + statement.span().startLine() + ")");
            }
            SyntaxNode jump = findEscapingJump(tree, statement, 0);
            if (jump != null && "return_statement".equals(jump.type())) {
                throw RefactoringException.invalidSelection("cannot extract code containing return statements (line "
                        + jump.span().startLine() + ")");
            }
            if (jump != null) {
                String keyword = "break_statement".equals(jump.type()) ? "break" : "continue";
                throw RefactoringException.invalidSelection("cannot extract '" + keyword
                        + "' that targets a loop or switch outside the selection (line " + jump.span().startLine() + ")");
            }
        }
    }

    /**
     * return, break или continue, уводящие управление за пределы выделения.
     * Внутри вложенных функций и замыканий они допустимы; break/continue допустимы,
     * пока их уровень не превышает число циклов и switch, открытых внутри выделения.
     *
     * @param loops число циклов и switch между выделением и node
     */
    private static SyntaxNode findEscapingJump(SyntaxTree tree, SyntaxNode node, int loops) {
        if ("return_statement".equals(node.type())) {
            return node;
        }
        if (("break_statement".equals(node.type()) || "continue_statement".equals(node.type()))
                && jumpLevel(tree, node) > loops) {
            return node;
        }
        if (node.kind().isScopeIntroducing()) {
            return null;
        }
        int nested = LOOP_TYPES.contains(node.type()) ? loops + 1 : loops;
        for (SyntaxNode child : tree.children(node)) {
            SyntaxNode found = findEscapingJump(tree, child, nested);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Уровень break N / continue N; без аргумента - 1.
     */
    private static int jumpLevel(SyntaxTree tree, SyntaxNode jump) {
        SyntaxNode level = tree.childOfType(jump, "integer");
        if (level == null) {
            return 1;
        }
        String digits = tree.text(level).trim();
        return digits.matches("\\d{1,9}") ? Integer.parseInt(digits) : Integer.MAX_VALUE;
    }

    /**
     * Имя функций PHP нечувствительно к регистру. Для метода проверяются члены того же класса,
     * для функции - все функции файла.
     */
    private static void checkNameIsFree(SyntaxTree tree, SyntaxNode scopeRoot, String name) throws RefactoringException {
        boolean method = scopeRoot.kind() == NodeKind.METHOD;
        SyntaxNode searchRoot = method ? tree.parent(scopeRoot) : tree.root();
        SyntaxNode existing = findDeclaration(tree, searchRoot, name, method ? NodeKind.METHOD : NodeKind.FUNCTION);
        if (existing != null) {
            throw RefactoringException.invalidSelection((method ? "method " : "function ") + name
                    + " already exists at line " + existing.span().startLine())
                    .addSuggestion("Choose a different methodName");
        }
    }

    private static SyntaxNode findDeclaration(SyntaxTree tree, SyntaxNode node, String name, NodeKind kind) {
        if (node.kind() == kind) {
            SyntaxNode nameNode = tree.childOfType(node, "name");
            if (nameNode != null && tree.text(nameNode).equalsIgnoreCase(name)) {
                return node;
            }
        }
        for (SyntaxNode child : tree.children(node)) {
            SyntaxNode found = findDeclaration(tree, child, name, kind);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Узел, после которого вставляется новое определение: сам метод или функция,
     * иначе последний оператор верхнего уровня.
     */
    private static SyntaxNode insertionPoint(SyntaxTree tree, SyntaxNode scopeRoot) {
        if (scopeRoot.kind() == NodeKind.METHOD || scopeRoot.kind() == NodeKind.FUNCTION) {
            return scopeRoot;
        }
        List<SyntaxNode> topLevel = tree.children(tree.root());
        for (int i = topLevel.size() - 1; i >= 0; i--) {
            SyntaxNode node = topLevel.get(i);
            if (node.hasSpan() && (node.kind().isStatement() || node.kind() == NodeKind.BLOCK)) {
                return node;
            }
        }
        throw new IllegalStateException("File has no top-level statements");
    }

    private static String buildDefinition(SyntaxTree tree, StatementSelection selection, VariableFlow flow,
                                          String name, String arguments, boolean method, boolean isStatic,
                                          String memberIndent) {
        String bodyIndent = memberIndent + INDENT;
        StringBuilder sb = new StringBuilder();
        sb.append(memberIndent);
        if (method) {
            sb.append(isStatic ? "private static function " : "private function ");
        } else {
            sb.append("function ");
        }
        sb.append(name).append('(').append(arguments).append(")\n");
        sb.append(memberIndent).append("{\n");

        String baseIndent = tree.indentationOf(selection.first());
        String body = tree.slice(selection.first().printStart(), selection.last().printEnd());
        String[] lines = body.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0 && line.startsWith(baseIndent)) {
                line = line.substring(baseIndent.length());
            }
            if (line.isBlank()) {
                sb.append('\n');
            } else {
                sb.append(bodyIndent).append(line.stripTrailing()).append('\n');
            }
        }

        List<String> returns = flow.returns();
        if (returns.size() == 1) {
            sb.append(bodyIndent).append("return $").append(returns.get(0)).append(";\n");
        } else if (returns.size() > 1) {
            sb.append(bodyIndent).append("return ").append(variableList(returns)).append(";\n");
        }
        sb.append(memberIndent).append('}');
        return sb.toString();
    }

    private static String buildCall(VariableFlow flow, String name, String arguments, boolean method, boolean isStatic) {
        String callee;
        if (method) {
            callee = (isStatic ? "self::" : "$this->") + name + "(" + arguments + ")";
        } else {
            callee = name + "(" + arguments + ")";
        }
        List<String> returns = flow.returns();
        if (returns.isEmpty()) {
            return callee + ";";
        }
        if (returns.size() == 1) {
            return "$" + returns.get(0) + " = " + callee + ";";
        }
        return variableList(returns) + " = " + callee + ";";
    }

    /**
     * Номер строки (1-based), с которой определение начинается в новом исходнике.
     */
    private static int lineOf(String code, String definition) {
        int at = code.lastIndexOf(definition);
        int line = 1;
        for (int i = 0; i < at; i++) {
            if (code.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String variableList(List<String> names) {
        return names.stream().map(v -> "$" + v).collect(Collectors.joining(", ", "[", "]"));
    }
}
