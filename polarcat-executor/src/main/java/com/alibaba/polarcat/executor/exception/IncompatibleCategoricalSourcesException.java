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

/**
 * Raised when two categorical columns are combined whose codes come from different dictionaries.
 */
public class IncompatibleCategoricalSourcesException extends PolarCatRuntimeException {

    private static final long serialVersionUID = -3358036524712810547L;

    public IncompatibleCategoricalSourcesException(String... params) {
        super(ErrorCode.ERR_INCOMPATIBLE_CATEGORICAL_SOURCES, params);
    }
}
