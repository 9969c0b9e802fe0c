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

import com.alibaba.polarcat.executor.categorical.StringCache;
import com.alibaba.polarcat.executor.chunk.Block;
import com.alibaba.polarcat.executor.chunk.CategoricalBlock;
import com.alibaba.polarcat.executor.chunk.CategoricalBlockBuilder;
import com.alibaba.polarcat.executor.chunk.StringBlock;
import com.alibaba.polarcat.executor.chunk.StringBlockBuilder;
import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Casts between string and categorical blocks.
 */
public final class CategoricalCasts {

    private static final int EXPECTED_STRING_LENGTH = 16;

    private CategoricalCasts() {
    }

    /**
     * Encode a string block. Nulls stay null; the RevMap is the global string cache when a
     * scope is open, otherwise a new local dictionary.
     */
    public static CategoricalBlock castToCategorical(Block strings) {
        final int positionCount = strings.getPositionCount();
        CategoricalBlockBuilder builder = new CategoricalBlockBuilder(positionCount);
        for (int position = 0; position < positionCount; position++) {
            if (strings.isNull(position)) {
                builder.appendNull();
            } else {
                builder.writeString(strings.getString(position));
            }
        }
        return builder.build().cast(CategoricalBlock.class);
    }

    /**
     * Decode every code back to its string.
     *
     * @throws com.alibaba.polarcat.executor.exception.CategoricalCodeOutOfRangeException if a
     * code is unknown to the RevMap
     */
    public static StringBlock castToString(CategoricalBlock block) {
        final int positionCount = block.getPositionCount();
        StringBlockBuilder builder = new StringBlockBuilder(positionCount, EXPECTED_STRING_LENGTH);
        for (int position = 0; position < positionCount; position++) {
            block.writePositionTo(position, builder);
        }
        return builder.build().cast(StringBlock.class);
    }

    /**
     * A null literal cast to categorical: every position null, under the RevMap a new column
     * would get right now.
     */
    public static CategoricalBlock nullCategorical(int positionCount) {
        Preconditions.checkArgument(positionCount >= 0);
        boolean[] valueIsNull = new boolean[positionCount];
        Arrays.fill(valueIsNull, true);
        return new CategoricalBlock(StringCache.getInstance().currentRevMap(), 0, positionCount, valueIsNull,
            new int[positionCount]);
    }
}
