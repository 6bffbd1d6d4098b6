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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.phprefactor.core.NtsErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат операции рефакторинга.
 * Успешный результат несёт полный новый исходник файла (code), а не diff: файл на диске не изменяется.
 */
public record RefactoringResult(
        boolean success,
        String action,
        String file,
        String code,
        String summary,
        int occurrences,
        List<ChangeDetail> details,
        String error,
        NtsErrorCode.Category errorType,
        List<String> suggestions
) {

    /**
     * Детали конкретного изменения.
     */
    public record ChangeDetail(
            int line,
            int column,
            String before,
            String after
    ) {}

    // Builder pattern для удобного создания результата
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String action;
        private String file;
        private String code;
        private String summary;
        private int occurrences;
        private List<ChangeDetail> details = new ArrayList<>();

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder occurrences(int occurrences) {
            this.occurrences = occurrences;
            return this;
        }

        public Builder addDetail(ChangeDetail detail) {
            this.details.add(detail);
            return this;
        }

        public Builder details(List<ChangeDetail> details) {
            this.details = details;
            return this;
        }

        public RefactoringResult build() {
            return new RefactoringResult(true, action, file, code, summary, occurrences,
                    List.copyOf(details), null, null, List.of());
        }
    }

    // Фабричные методы
    public static RefactoringResult failure(String action, NtsErrorCode.Category errorType,
                                            String error, List<String> suggestions) {
        return new RefactoringResult(false, action, null, null, null, 0, List.of(),
                error, errorType, suggestions != null ? List.copyOf(suggestions) : List.of());
    }

    /**
     * JSON-представление: {success, code?, file?, error?, errorType?, summary?, occurrences?, ...}.
     */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode json = mapper.createObjectNode();
        json.put("success", success);
        if (action != null) {
            json.put("action", action);
        }
        if (success) {
            json.put("file", file);
            json.put("code", code);
            if (summary != null) {
                json.put("summary", summary);
            }
            json.put("occurrences", occurrences);
            if (!details.isEmpty()) {
                ArrayNode changes = json.putArray("changes");
                for (ChangeDetail detail : details) {
                    ObjectNode detailNode = changes.addObject();
                    detailNode.put("line", detail.line());
                    if (detail.column() > 0) {
                        detailNode.put("column", detail.column());
                    }
                    detailNode.put("before", detail.before());
                    detailNode.put("after", detail.after());
                }
            }
        } else {
            json.put("error", error);
            json.put("errorType", errorType.name());
            if (!suggestions.isEmpty()) {
                ArrayNode array = json.putArray("suggestions");
                suggestions.forEach(array::add);
            }
        }
        return json;
    }
}
