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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Base exception class for the PHP refactoring tools.
 * Provides structured error reporting with error codes and context.
 *
 * <p>Usage:
 * <pre>
 * throw new NtsException(NtsErrorCode.PARSE_ERROR, "details", "Syntax error on line 3");
 * </pre>
 */
public class NtsException extends RuntimeException {

    private final NtsErrorCode code;
    private final Map<String, Object> context;

    public NtsException(NtsErrorCode code) {
        super(code.getMessage());
        this.code = code;
        this.context = Collections.emptyMap();
    }

    public NtsException(NtsErrorCode code, Map<String, Object> context) {
        super(code.getMessage());
        this.code = code;
        this.context = context != null ? new HashMap<>(context) : Collections.emptyMap();
    }

    public NtsException(NtsErrorCode code, String key, Object value) {
        super(code.getMessage());
        this.code = code;
        this.context = Map.of(key, value);
    }

    public NtsException(NtsErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new HashMap<>(context) : Collections.emptyMap();
    }

    public NtsErrorCode getCode() {
        return code;
    }

    public NtsErrorCode.Category getCategory() {
        return code.getCategory();
    }

    /**
     * Returns the single-line user-facing message.
     */
    @Override
    public String getMessage() {
        return code.formatMessage(context);
    }

    /**
     * Returns the solution hint with context placeholders resolved.
     */
    public String getSolution() {
        return code.formatSolution(context);
    }
}
