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

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPhp;
import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.NtsException;
import ru.nts.tools.phprefactor.core.PathSanitizer;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Менеджер tree-sitter парсера PHP.
 * TSLanguage загружается лениво один раз, TSParser не thread-safe и поэтому хранится в ThreadLocal.
 * Деревья не кэшируются: каждая операция рефакторинга разбирает файл заново.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Максимальный размер исходника для парсинга в байтах UTF-8, совпадает с лимитом чтения файла.
     */
    public static final long MAX_PARSE_SIZE_BYTES = PathSanitizer.MAX_TEXT_FILE_SIZE;

    private volatile TSLanguage language;

    private final ThreadLocal<TSParser> parser = ThreadLocal.withInitial(() -> {
        TSParser p = new TSParser();
        p.setLanguage(getLanguage());
        return p;
    });

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Грамматика PHP (включая HTML-вставки вне тегов &lt;?php ?&gt;).
     */
    public TSLanguage getLanguage() {
        TSLanguage result = language;
        if (result == null) {
            synchronized (this) {
                result = language;
                if (result == null) {
                    result = new TreeSitterPhp();
                    language = result;
                }
            }
        }
        return result;
    }

    /**
     * Парсит строку содержимого и возвращает CST дерево.
     *
     * @param content исходный код PHP
     * @return дерево tree-sitter (может содержать ERROR узлы, см. {@link SyntaxChecker})
     * @throws NtsException SOURCE_TOO_LARGE, если исходник в UTF-8 превышает лимит размера
     */
    public TSTree parse(String content) {
        long size = content.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_PARSE_SIZE_BYTES) {
            throw new NtsException(NtsErrorCode.SOURCE_TOO_LARGE,
                    Map.<String, Object>of("size", size, "maxAllowed", MAX_PARSE_SIZE_BYTES));
        }
        TSTree tree = parser.get().parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse PHP content");
        }
        return tree;
    }
}
