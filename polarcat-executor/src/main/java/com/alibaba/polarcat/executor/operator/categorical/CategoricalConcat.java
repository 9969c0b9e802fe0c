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

package com.alibaba.polarcat.executor.operator.categorical;

import com.alibaba.polarcat.executor.categorical.MergedRevMap;
import com.alibaba.polarcat.executor.categorical.RevMapMerger;
import com.alibaba.polarcat.executor.chunk.CategoricalBlock;
import com.google.common.base.Preconditions;

import java.util.List;

/**
 * Vertical concatenation of categorical blocks.
 * <p>
 * Blocks of the same source keep their codes. Two independent local blocks are re-encoded
 * against the union of their dictionaries, the left codes unchanged and the strings only found
 * on the right appended after them.
 */
public final class CategoricalConcat {

    private CategoricalConcat() {
    }

    public static CategoricalBlock append(CategoricalBlock first, CategoricalBlock second) {
        MergedRevMap merged = RevMapMerger.merge(first.getRevMap(), second.getRevMap(), RevMapMerger.Mode.APPEND);

        final int firstCount = first.getPositionCount();
        final int positionCount = firstCount + second.getPositionCount();
        boolean[] valueIsNull = new boolean[positionCount];
        int[] codes = new int[positionCount];
        boolean hasNull = false;
        for (int position = 0; position < firstCount; position++) {
            if (first.isNull(position)) {
                valueIsNull[position] = true;
                hasNull = true;
            } else {
                codes[position] = first.getInt(position);
            }
        }
        for (int position = 0; position < second.getPositionCount(); position++) {
            if (second.isNull(position)) {
                valueIsNull[firstCount + position] = true;
                hasNull = true;
            } else {
                codes[firstCount + position] = merged.translateRight(second.getInt(position));
            }
        }
        return new CategoricalBlock(merged.getRevMap(), 0, positionCount, hasNull ? valueIsNull : null, codes);
    }

    public static CategoricalBlock concat(List<CategoricalBlock> blocks) {
        Preconditions.checkArgument(!blocks.isEmpty(), "nothing to concatenate");
        CategoricalBlock result = blocks.get(0);
        for (int i = 1; i < blocks.size(); i++) {
            result = append(result, blocks.get(i));
        }
        return result;
    }
}
