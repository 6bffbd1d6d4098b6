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
import org.treesitter.TSTree;
import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.NtsException;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;

import java.util.stream.Collectors;

/**
 * Разбор исходника PHP в арену узлов.
 * Дерево с ERROR или MISSING узлами считается ошибкой разбора: частично разобранный файл не рефакторится.
 */
public final class PhpParser {

    private final TreeSitterManager treeManager;

    public PhpParser() {
        this(TreeSitterManager.getInstance());
    }

    public PhpParser(TreeSitterManager treeManager) {
        this.treeManager = treeManager;
    }

    /**
     * @param source исходный текст файла
     * @return арена узлов
     * @throws NtsException с кодом PARSE_ERROR, если исходник содержит синтаксические ошибки
     */
    public SyntaxTree parse(String source) {
        TSTree tsTree = treeManager.parse(source);
        TSNode root = tsTree.getRootNode();

        SyntaxChecker.SyntaxCheckResult check = SyntaxChecker.check(root, source);
        if (check.hasErrors()) {
            String details = check.errors().stream()
                    .map(SyntaxChecker.SyntaxError::toString)
                    .collect(Collectors.joining("; "));
            throw new NtsException(NtsErrorCode.PARSE_ERROR, "details", details);
        }

        return PhpTreeBuilder.build(root, source);
    }
}
