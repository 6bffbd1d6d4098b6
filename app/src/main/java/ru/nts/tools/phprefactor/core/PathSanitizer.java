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
package ru.nts.tools.phprefactor.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Нормализация и проверка путей, переданных клиентом.
 * Все файлы рефакторинга должны лежать внутри корня проекта (переменная окружения PROJECT_ROOT,
 * по умолчанию - рабочая директория процесса).
 */
public class PathSanitizer {

    /**
     * Текущий корень проекта. Все операции ограничиваются этим путем.
     */
    private static Path root = initialRoot();

    /**
     * Максимально допустимый размер исходного файла (10 MB).
     */
    public static final long MAX_TEXT_FILE_SIZE = 10 * 1024 * 1024;

    private static Path initialRoot() {
        String env = System.getenv("PROJECT_ROOT");
        if (env != null && !env.isBlank()) {
            return Paths.get(env).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }

    /**
     * Переопределяет корень проекта.
     * В основном используется в модульных тестах для изоляции тестового окружения во временных папках.
     *
     * @param newRoot Новый путь, который будет считаться корнем "песочницы".
     */
    public static void setRoot(Path newRoot) {
        root = newRoot.toAbsolutePath().normalize();
    }

    /**
     * Выполняет санитарную проверку и нормализацию пути.
     * Гарантирует, что итоговый абсолютный путь находится строго внутри корня проекта.
     *
     * @param requestedPath Путь, переданный клиентом (абсолютный, относительный или содержащий '..').
     *
     * @return Абсолютный нормализованный объект {@link Path}.
     *
     * @throws SecurityException Если путь ведет за пределы корня.
     */
    public static Path sanitize(String requestedPath) {
        Path target;
        // Предварительная нормализация разделителей для Windows
        String normalizedRequest = requestedPath.replace('\\', '/');
        Path requested = Paths.get(normalizedRequest);

        if (requested.isAbsolute()) {
            target = requested.toAbsolutePath().normalize();
        } else {
            target = root.resolve(normalizedRequest).toAbsolutePath().normalize();
        }

        // Проверка Path Traversal: итоговый путь обязан начинаться с префикса корня
        if (!target.startsWith(root)) {
            throw new SecurityException("Access denied: path is outside of project root: " + requestedPath + " (Root: " + root + ")");
        }

        return target;
    }

    /**
     * Проверяет файл на соответствие лимиту размера.
     *
     * @param path Путь к проверяемому файлу.
     *
     * @throws IOException       Если возникла ошибка при определении размера файла.
     * @throws NtsFileException  Если размер файла превышает {@link #MAX_TEXT_FILE_SIZE}.
     */
    public static void checkFileSize(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            long size = Files.size(path);
            if (size > MAX_TEXT_FILE_SIZE) {
                throw NtsFileException.tooLarge(path, size, MAX_TEXT_FILE_SIZE);
            }
        }
    }

    /**
     * Возвращает текущий абсолютный путь к корню проекта.
     */
    public static Path getRoot() {
        return root;
    }
}
