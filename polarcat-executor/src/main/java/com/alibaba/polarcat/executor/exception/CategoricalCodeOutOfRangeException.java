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

package com.alibaba.polarcat.executor.exception;

import com.alibaba.polarcat.common.exception.PolarCatRuntimeException;
import com.alibaba.polarcat.common.exception.code.ErrorCode;

public class CategoricalCodeOutOfRangeException extends PolarCatRuntimeException {

    private static final long serialVersionUID = 6045287712386349952L;

    private final int categoricalCode;

    public CategoricalCodeOutOfRangeException(int categoricalCode, int dictionarySize) {
        super(ErrorCode.ERR_CATEGORICAL_CODE_OUT_OF_RANGE, String.valueOf(categoricalCode),
            String.valueOf(dictionarySize));
        this.categoricalCode = categoricalCode;
    }

    public int getCategoricalCode() {
        return categoricalCode;
    }
}
