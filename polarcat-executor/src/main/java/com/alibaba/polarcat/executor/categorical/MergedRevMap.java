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

/**
 * Outcome of reconciling the RevMaps of two categorical columns.
 * <p>
 * Codes of the left column are valid in {@link #getRevMap()} as they are, codes of the right
 * column go through {@link #translateRight(int)}.
 */
public final class MergedRevMap {

    private final RevMap revMap;

    /**
     * null means identity
     */
    private final int[] rightTranslation;

    MergedRevMap(RevMap revMap, int[] rightTranslation) {
        this.revMap = revMap;
        this.rightTranslation = rightTranslation;
    }

    public RevMap getRevMap() {
        return revMap;
    }

    public boolean isIdentity() {
        return rightTranslation == null;
    }

    public int translateRight(int code) {
        return rightTranslation == null ? code : rightTranslation[code];
    }
}
