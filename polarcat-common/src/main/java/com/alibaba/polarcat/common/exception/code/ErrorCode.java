/*
 * Copyright [2013-2021], Alibaba Group Holding Limited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.polarcat.common.exception.code;

import java.text.MessageFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Error codes raised by the categorical executor.
 * <p>
 * Rendered messages have the form {@code ERR-CODE: [PXC-<code>][<name>] <message>}.
 */
public enum ErrorCode {

    ERR_CONFIG(ErrorType.Config, 4000, "invalid config {0}, value={1}"),

    ERR_EXECUTOR(ErrorType.Executor, 4700, "{0}"),

    ERR_OUT_OF_MEMORY(ErrorType.Executor, 4702, "Failed to allocate memory for {0}"),

    ERR_INCOMPATIBLE_CATEGORICAL_SOURCES(ErrorType.Executor, 4720,
        "Cannot compare categoricals originating from different sources. "
            + "Consider setting a global string cache. {0}"),

    ERR_CATEGORICAL_CODE_OUT_OF_RANGE(ErrorType.Executor, 4721,
        "Categorical code {0} is out of range for a dictionary of size {1}"),

    ERR_CATEGORICAL_DICTIONARY_FULL(ErrorType.Executor, 4722,
        "Categorical dictionary reached the maximum size {0}");

    private static final String PREFIX = "ERR-CODE: ";

    private static final Pattern PATTERN = Pattern.compile("ERR-CODE: \\[PXC-(\\d+)]\\[([A-Z_]+)] ");

    private final ErrorType type;
    private final int code;
    private final String template;

    ErrorCode(ErrorType type, int code, String template) {
        this.type = type;
        this.code = code;
        this.template = template;
    }

    public int getCode() {
        return code;
    }

    public ErrorType getType() {
        return type;
    }

    public String getMessage(String... params) {
        String message;
        if (params == null || params.length == 0) {
            message = template.replaceAll("\\s*\\{\\d+}", "");
        } else {
            message = MessageFormat.format(template.replace("'", "''"), (Object[]) params);
        }
        return PREFIX + "[PXC-" + code + "][" + name() + "] " + message.trim();
    }

    public static boolean match(String message) {
        return extract(message) != -1;
    }

    /**
     * Extract the numeric code of the first rendered error in the message, or -1.
     */
    public static int extract(String message) {
        if (message == null || message.isEmpty()) {
            return -1;
        }
        Matcher matcher = PATTERN.matcher(message);
        if (matcher.find()) {
            return Integer.parseInt(matcher.group(1));
        }
        return -1;
    }

    public enum ErrorType {
        Config,
        Executor
    }
}
