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
package ru.nts.tools.phprefactor.tools.refactoring;

import ru.nts.tools.phprefactor.core.EncodingUtils;
import ru.nts.tools.phprefactor.core.FileUtils;
import ru.nts.tools.phprefactor.core.NtsErrorCode;
import ru.nts.tools.phprefactor.core.NtsException;
import ru.nts.tools.phprefactor.core.NtsParamException;
import ru.nts.tools.phprefactor.core.PathSanitizer;
import ru.nts.tools.phprefactor.core.tree.SyntaxTree;
import ru.nts.tools.phprefactor.core.tree.TreePrinter;
import ru.nts.tools.phprefactor.core.treesitter.PhpParser;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Map;

/**
 * Контекст выполнения операции рефакторинга.
 * Предоставляет чтение исходника, парсер и принтер. Создаётся заново для каждого запроса.
 */
public class RefactoringContext {

    private final PhpParser parser;
    private final TreePrinter printer;

    /**
     * Прочитанный исходный файл.
     *
     * @param path        абсолютный путь
     * @param displayPath путь в том виде, в котором его передал клиент
     * @param content     текст файла без BOM
     * @param charset     кодировка файла
     */
    public record SourceFile(Path path, String displayPath, String content, Charset charset) {

        public int lineCount() {
            return content.split("\n", -1).length;
        }
    }

    public RefactoringContext() {
        this(new PhpParser(), new TreePrinter());
    }

    public RefactoringContext(PhpParser parser, TreePrinter printer) {
        this.parser = parser;
        this.printer = printer;
    }

    /**
     * Читает файл целиком.
     *
     * @throws NtsException FILE_NOT_FOUND, FILE_NOT_READABLE, FILE_TOO_LARGE, FILE_IS_BINARY или IO_ERROR
     * @throws SecurityException если путь ведёт за пределы корня проекта
     */
    public SourceFile readSource(String file) {
        Path path = PathSanitizer.sanitize(file);
        FileUtils.checkReadable(path, file);
        try {
            PathSanitizer.checkFileSize(path);
            EncodingUtils.TextFileContent text = EncodingUtils.readTextFile(path);
            return new SourceFile(path, file, text.content(), text.charset());
        } catch (IOException e) {
            throw new NtsException(NtsErrorCode.IO_ERROR, Map.of("details", file + ": " + e.getMessage()), e);
        }
    }

    /**
     * Проверяет, что строка существует в файле.
     *
     * @throws NtsParamException PARAM_LINE_EXCEEDS
     */
    public void requireLine(SourceFile source, int line) {
        int total = source.lineCount();
        if (line > total) {
            throw NtsParamException.lineExceeds(line, total, source.displayPath());
        }
    }

    public SyntaxTree parse(SourceFile source) {
        return parser.parse(source.content());
    }

    public String print(SyntaxTree tree) {
        return printer.print(tree);
    }
}
