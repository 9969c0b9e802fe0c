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

import com.alibaba.polarcat.executor.categorical.RevMap;
import com.alibaba.polarcat.executor.categorical.RevMapMerger;
import com.alibaba.polarcat.executor.chunk.BooleanBlock;
import com.alibaba.polarcat.executor.chunk.CategoricalBlock;

/**
 * Row-wise selection between categorical values, {@code when cond then a otherwise b}.
 * <p>
 * A null condition selects the otherwise branch.
 */
public final class CategoricalConditionals {

    private CategoricalConditionals() {
    }

    public static CategoricalBlock ifThenElse(BooleanBlock condition, CategoricalBlock thenBlock,
                                              CategoricalBlock elseBlock) {
        CategoricalComparisons.checkSameLength(condition.getPositionCount(), thenBlock.getPositionCount());
        CategoricalComparisons.checkSameLength(condition.getPositionCount(), elseBlock.getPositionCount());
        RevMapMerger.checkSameSource(thenBlock.getRevMap(), elseBlock.getRevMap(), RevMapMerger.Mode.COMPARE);

        final int positionCount = condition.getPositionCount();
        boolean[] valueIsNull = new boolean[positionCount];
        int[] codes = new int[positionCount];
        boolean hasNull = false;
        for (int position = 0; position < positionCount; position++) {
            CategoricalBlock source = condition.isTrue(position) ? thenBlock : elseBlock;
            if (source.isNull(position)) {
                valueIsNull[position] = true;
                hasNull = true;
            } else {
                codes[position] = source.getInt(position);
            }
        }
        return new CategoricalBlock(thenBlock.getRevMap(), 0, positionCount, hasNull ? valueIsNull : null, codes);
    }

    public static CategoricalBlock ifThenElse(BooleanBlock condition, String thenLiteral, CategoricalBlock elseBlock) {
        return selectWithLiteral(condition, thenLiteral, true, elseBlock);
    }

    public static CategoricalBlock ifThenElse(BooleanBlock condition, CategoricalBlock thenBlock, String elseLiteral) {
        return selectWithLiteral(condition, elseLiteral, false, thenBlock);
    }

    /**
     * Shift the values by {@code periods} positions, towards the end when positive, and fill the
     * positions left empty with the literal. A null literal leaves them null.
     */
    public static CategoricalBlock shiftAndFill(CategoricalBlock block, int periods, String fillLiteral) {
        RevMap revMap = block.getRevMap();
        int fillCode = fillLiteral == null ? 0 : revMap.extendWith(fillLiteral);

        final int positionCount = block.getPositionCount();
        boolean[] valueIsNull = new boolean[positionCount];
        int[] codes = new int[positionCount];
        boolean hasNull = false;
        for (int position = 0; position < positionCount; position++) {
            // widen before subtracting, periods may be any int
            long source = (long) position - periods;
            if (source < 0 || source >= positionCount) {
                if (fillLiteral == null) {
                    valueIsNull[position] = true;
                    hasNull = true;
                } else {
                    codes[position] = fillCode;
                }
            } else if (block.isNull((int) source)) {
                valueIsNull[position] = true;
                hasNull = true;
            } else {
                codes[position] = block.getInt((int) source);
            }
        }
        return new CategoricalBlock(revMap, 0, positionCount, hasNull ? valueIsNull : null, codes);
    }

    /**
     * The literal is encoded against the RevMap of the block, appending it when it is new. The
     * result keeps the source of the block.
     */
    private static CategoricalBlock selectWithLiteral(BooleanBlock condition, String literal,
                                                      boolean literalWhenTrue, CategoricalBlock block) {
        CategoricalComparisons.checkSameLength(condition.getPositionCount(), block.getPositionCount());

        RevMap revMap = block.getRevMap();
        int literalCode = literal == null ? 0 : revMap.extendWith(literal);

        final int positionCount = condition.getPositionCount();
        boolean[] valueIsNull = new boolean[positionCount];
        int[] codes = new int[positionCount];
        boolean hasNull = false;
        for (int position = 0; position < positionCount; position++) {
            boolean pickLiteral = condition.isTrue(position) == literalWhenTrue;
            if (pickLiteral ? literal == null : block.isNull(position)) {
                valueIsNull[position] = true;
                hasNull = true;
            } else {
                codes[position] = pickLiteral ? literalCode : block.getInt(position);
            }
        }
        return new CategoricalBlock(revMap, 0, positionCount, hasNull ? valueIsNull : null, codes);
    }
}
