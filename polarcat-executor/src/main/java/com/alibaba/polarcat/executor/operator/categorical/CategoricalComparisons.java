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

import com.alibaba.polarcat.common.exception.PolarCatRuntimeException;
import com.alibaba.polarcat.common.exception.code.ErrorCode;
import com.alibaba.polarcat.executor.categorical.RevMap;
import com.alibaba.polarcat.executor.categorical.RevMapMerger;
import com.alibaba.polarcat.executor.categorical.StringDictionary;
import com.alibaba.polarcat.executor.chunk.BooleanBlock;
import com.alibaba.polarcat.executor.chunk.CategoricalBlock;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.Arrays;
import java.util.Collection;

/**
 * Equality of categorical blocks, against each other or against string literals.
 * <p>
 * Two blocks must share a source. Literals are looked up in the block's own RevMap, so a
 * literal comparison never fails on the source check.
 */
public final class CategoricalComparisons {

    private CategoricalComparisons() {
    }

    public static BooleanBlock equal(CategoricalBlock left, CategoricalBlock right) {
        return compare(left, right, false);
    }

    public static BooleanBlock notEqual(CategoricalBlock left, CategoricalBlock right) {
        return compare(left, right, true);
    }

    public static BooleanBlock equalLiteral(CategoricalBlock block, String literal) {
        return compareLiteral(block, literal, false);
    }

    public static BooleanBlock notEqualLiteral(CategoricalBlock block, String literal) {
        return compareLiteral(block, literal, true);
    }

    /**
     * Membership test against a set of strings. A null position is never a member.
     */
    public static BooleanBlock isIn(CategoricalBlock block, Collection<String> values) {
        RevMap revMap = block.getRevMap();
        IntOpenHashSet codes = new IntOpenHashSet(values.size());
        for (String value : values) {
            int code = revMap.lookup(value);
            if (code != StringDictionary.NOT_FOUND) {
                codes.add(code);
            }
        }
        final int positionCount = block.getPositionCount();
        boolean[] result = new boolean[positionCount];
        if (!codes.isEmpty()) {
            for (int position = 0; position < positionCount; position++) {
                result[position] = !block.isNull(position) && codes.contains(block.getInt(position));
            }
        }
        return new BooleanBlock(0, positionCount, null, result);
    }

    private static BooleanBlock compare(CategoricalBlock left, CategoricalBlock right, boolean negate) {
        checkSameLength(left.getPositionCount(), right.getPositionCount());
        RevMapMerger.checkSameSource(left.getRevMap(), right.getRevMap(), RevMapMerger.Mode.COMPARE);

        final int positionCount = left.getPositionCount();
        boolean[] valueIsNull = new boolean[positionCount];
        boolean[] result = new boolean[positionCount];
        boolean hasNull = false;
        for (int position = 0; position < positionCount; position++) {
            if (left.isNull(position) || right.isNull(position)) {
                valueIsNull[position] = true;
                hasNull = true;
            } else {
                result[position] = (left.getInt(position) == right.getInt(position)) != negate;
            }
        }
        return new BooleanBlock(0, positionCount, hasNull ? valueIsNull : null, result);
    }

    private static BooleanBlock compareLiteral(CategoricalBlock block, String literal, boolean negate) {
        final int positionCount = block.getPositionCount();
        boolean[] valueIsNull = new boolean[positionCount];
        boolean[] result = new boolean[positionCount];
        if (literal == null) {
            Arrays.fill(valueIsNull, true);
            return new BooleanBlock(0, positionCount, valueIsNull, result);
        }

        int code = block.getRevMap().lookup(literal);
        boolean hasNull = false;
        for (int position = 0; position < positionCount; position++) {
            if (block.isNull(position)) {
                valueIsNull[position] = true;
                hasNull = true;
            } else {
                result[position] = (code != StringDictionary.NOT_FOUND && block.getInt(position) == code) != negate;
            }
        }
        return new BooleanBlock(0, positionCount, hasNull ? valueIsNull : null, result);
    }

    static void checkSameLength(int leftCount, int rightCount) {
        if (leftCount != rightCount) {
            throw new PolarCatRuntimeException(ErrorCode.ERR_EXECUTOR,
                "block length mismatch: " + leftCount + " vs " + rightCount);
        }
    }
}
