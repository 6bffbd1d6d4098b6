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
package ru.nts.tools.phprefactor.core.treesitter;

import org.treesitter.TSNode;
import ru.nts.tools.phprefactor.core.tree.NodeKind;
import ru.nts.tools.phprefactor.core.tree.SourceSpan;
import ru.nts.tools.phprefactor.core.tree.SyntaxNode;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Переводит CST tree-sitter-php в арену {@link SyntaxTree}.
 *
 * В арену попадают только именованные узлы; ключевые слова, операторы и скобки остаются
 * в исходном тексте между узлами и восстанавливаются принтером.
 * Комментарии пропускаются по той же причине.
 */
public final class PhpTreeBuilder {

    /**
     * Объявления и части составных операторов, которые не оканчиваются на "_statement".
     */
    private static final Set<String> STATEMENT_TYPES = Set.of(
            "class_declaration", "interface_declaration", "trait_declaration", "enum_declaration",
            "namespace_definition", "namespace_use_declaration", "const_declaration",
            "property_declaration", "use_declaration", "enum_case", "function_static_declaration",
            "global_declaration", "else_clause", "else_if_clause", "catch_clause", "finally_clause"
    );

    private static final Set<String> EXPRESSION_TYPES = Set.of(
            "binary_expression", "unary_op_expression", "update_expression", "cast_expression",
            "conditional_expression", "parenthesized_expression", "sequence_expression",
            "augmented_assignment_expression", "reference_assignment_expression",
            "function_call_expression", "member_call_expression", "nullsafe_member_call_expression",
            "scoped_call_expression", "member_access_expression", "nullsafe_member_access_expression",
            "scoped_property_access_expression", "class_constant_access_expression",
            "subscript_expression", "object_creation_expression", "array_creation_expression",
            "list_literal", "clone_expression", "match_expression", "print_intrinsic",
            "include_expression", "include_once_expression", "require_expression", "require_once_expression",
            "error_suppression_expression", "throw_expression", "yield_expression", "shell_command_expression",
            "string", "encapsed_string", "heredoc", "nowdoc", "integer", "float", "boolean", "null"
    );

    private final byte[] source;
    private final SyntaxTree tree;

    private PhpTreeBuilder(String content) {
        this.source = content.getBytes(StandardCharsets.UTF_8);
        this.tree = new SyntaxTree(content);
    }

    /**
     * Строит арену из корня дерева tree-sitter.
     *
     * @param root    корневой узел (program)
     * @param content исходник, по которому строилось дерево
     */
    public static SyntaxTree build(TSNode root, String content) {
        PhpTreeBuilder builder = new PhpTreeBuilder(content);
        builder.visit(root, SyntaxNode.NO_NODE, false);
        return builder.tree;
    }

    /**
     * Категория узла по типу грамматики tree-sitter-php.
     */
    public static NodeKind classify(String type) {
        switch (type) {
            case "program":
                return NodeKind.PROGRAM;
            case "compound_statement":
            case "colon_block":
            case "declaration_list":
                return NodeKind.BLOCK;
            case "function_definition":
                return NodeKind.FUNCTION;
            case "method_declaration":
                return NodeKind.METHOD;
            case "anonymous_function":
            case "anonymous_function_creation_expression":
                return NodeKind.CLOSURE;
            case "arrow_function":
                return NodeKind.ARROW_FUNCTION;
            case "assignment_expression":
                return NodeKind.ASSIGNMENT;
            case "variable_name":
                return NodeKind.VARIABLE;
            default:
                break;
        }
        if (type.endsWith("_statement") || STATEMENT_TYPES.contains(type)) {
            return NodeKind.STATEMENT;
        }
        if (EXPRESSION_TYPES.contains(type)) {
            return NodeKind.EXPRESSION;
        }
        return NodeKind.OTHER;
    }

    private void visit(TSNode node, int parentId, boolean propertyName) {
        String type = node.getType();
        SourceSpan span = spanOf(node);

        if ("variable_name".equals(type)) {
            TSNode name = propertyName ? null : findChild(node, "name");
            if (name != null) {
                tree.addVariable(type, span, parentId, text(name), name.getStartByte(), name.getEndByte());
            } else {
                // $prop в объявлении свойства и Class::$prop - не локальные переменные
                tree.addNode(NodeKind.OTHER, type, span, parentId);
            }
            return;
        }

        int id = tree.addNode(classify(type), type, span, parentId);

        boolean afterScopeResolution = false;
        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;

            if (!child.isNamed()) {
                if ("::".equals(child.getType())) {
                    afterScopeResolution = true;
                }
                continue;
            }
            if ("comment".equals(child.getType())) continue;

            boolean property = "property_element".equals(type)
                    || ("scoped_property_access_expression".equals(type) && afterScopeResolution);
            visit(child, id, property);
        }
    }

    private SourceSpan spanOf(TSNode node) {
        int startLine = node.getStartPoint().getRow() + 1; // tree-sitter: 0-based -> 1-based
        int endLine = node.getEndPoint().getRow() + 1;
        return new SourceSpan(startLine, Math.max(startLine, endLine), node.getStartByte(), node.getEndByte());
    }

    private static TSNode findChild(TSNode node, String type) {
        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private String text(TSNode node) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= source.length && start < end) {
            return new String(source, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }
}
