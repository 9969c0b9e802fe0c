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

package com.alibaba.polarcat.executor.categorical;

import com.alibaba.polarcat.executor.exception.IncompatibleCategoricalSourcesException;

/**
 * Encodes the strings of one categorical column being built.
 * <p>
 * Obtained from {@link StringCache#newEncoder()}, which fixes the RevMap for the whole column.
 * A local dictionary is owned by the encoder and stops changing once the column is built.
 */
public final class CategoricalEncoder {

    private final RevMap revMap;

    CategoricalEncoder(RevMap revMap) {
        this.revMap = revMap;
    }

    /**
     * @throws IncompatibleCategoricalSourcesException if a new string reaches a global
     * RevMap whose generation finished after the encoder was created
     */
    public int encode(String value) {
        if (revMap.isLocal()) {
            return revMap.encodeLocal(value);
        }
        int code = StringCache.getInstance().encode(revMap, value);
        if (code == StringDictionary.NOT_FOUND) {
            throw new IncompatibleCategoricalSourcesException(
                "global string cache " + revMap.describe() + " finished while encoding a categorical column");
        }
        return code;
    }

    public RevMap getRevMap() {
        return revMap;
    }
}
