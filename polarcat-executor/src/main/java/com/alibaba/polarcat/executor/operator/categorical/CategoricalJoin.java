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
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hash join on categorical keys. Codes are only comparable within one source, so the RevMaps
 * are checked before the hash table is built. Null keys never match.
 */
public final class CategoricalJoin {

    private static final Logger logger = LoggerFactory.getLogger(CategoricalJoin.class);

    /**
     * position of the missing side of an unmatched row
     */
    public static final int NO_POSITION = -1;

    public enum JoinType {
        INNER,
        LEFT,
        OUTER
    }

    private CategoricalJoin() {
    }

    /**
     * Join the two key blocks.
     * <p>
     * INNER and LEFT emit rows in left order, each left row followed by its matches in right
     * order. OUTER probes the right side in order, emitting matched pairs and right-only rows,
     * then appends the unmatched left rows in left order.
     */
    public static JoinResult joinOn(CategoricalBlock left, CategoricalBlock right, JoinType joinType) {
        MergedRevMap merged = RevMapMerger.merge(left.getRevMap(), right.getRevMap(), RevMapMerger.Mode.JOIN);

        IntArrayList leftPositions = new IntArrayList();
        IntArrayList rightPositions = new IntArrayList();
        switch (joinType) {
        case INNER:
        case LEFT:
            probeLeft(left, right, merged, joinType == JoinType.LEFT, leftPositions, rightPositions);
            break;
        case OUTER:
            probeRightThenLeft(left, right, merged, leftPositions, rightPositions);
            break;
        default:
            throw new UnsupportedOperationException("join type " + joinType);
        }

        if (logger.isDebugEnabled()) {
            logger.debug(joinType + " join of " + left.getPositionCount() + " and " + right.getPositionCount()
                + " categorical keys produced " + leftPositions.size() + " rows");
        }
        return new JoinResult(buildKeys(left, right, merged, leftPositions, rightPositions), merged,
            leftPositions.toIntArray(), rightPositions.toIntArray());
    }

    private static void probeLeft(CategoricalBlock left, CategoricalBlock right, MergedRevMap merged,
                                  boolean keepUnmatched, IntArrayList leftPositions, IntArrayList rightPositions) {
        Int2ObjectOpenHashMap<IntArrayList> table = buildTable(right, merged, true);
        for (int position = 0; position < left.getPositionCount(); position++) {
            IntArrayList matches = left.isNull(position) ? null : table.get(left.getInt(position));
            if (matches != null) {
                for (int i = 0; i < matches.size(); i++) {
                    leftPositions.add(position);
                    rightPositions.add(matches.getInt(i));
                }
            } else if (keepUnmatched) {
                leftPositions.add(position);
                rightPositions.add(NO_POSITION);
            }
        }
    }

    private static void probeRightThenLeft(CategoricalBlock left, CategoricalBlock right, MergedRevMap merged,
                                           IntArrayList leftPositions, IntArrayList rightPositions) {
        Int2ObjectOpenHashMap<IntArrayList> table = buildTable(left, merged, false);
        boolean[] leftMatched = new boolean[left.getPositionCount()];
        for (int position = 0; position < right.getPositionCount(); position++) {
            IntArrayList matches =
                right.isNull(position) ? null : table.get(merged.translateRight(right.getInt(position)));
            if (matches == null) {
                leftPositions.add(NO_POSITION);
                rightPositions.add(position);
                continue;
            }
            for (int i = 0; i < matches.size(); i++) {
                int leftPosition = matches.getInt(i);
                leftMatched[leftPosition] = true;
                leftPositions.add(leftPosition);
                rightPositions.add(position);
            }
        }
        for (int position = 0; position < leftMatched.length; position++) {
            if (!leftMatched[position]) {
                leftPositions.add(position);
                rightPositions.add(NO_POSITION);
            }
        }
    }

    private static Int2ObjectOpenHashMap<IntArrayList> buildTable(CategoricalBlock block, MergedRevMap merged,
                                                                  boolean isRight) {
        Int2ObjectOpenHashMap<IntArrayList> table = new Int2ObjectOpenHashMap<>();
        for (int position = 0; position < block.getPositionCount(); position++) {
            if (block.isNull(position)) {
                continue;
            }
            int code = isRight ? merged.translateRight(block.getInt(position)) : block.getInt(position);
            IntArrayList positions = table.get(code);
            if (positions == null) {
                positions = new IntArrayList(1);
                table.put(code, positions);
            }
            positions.add(position);
        }
        return table;
    }

    private static CategoricalBlock buildKeys(CategoricalBlock left, CategoricalBlock right, MergedRevMap merged,
                                              IntArrayList leftPositions, IntArrayList rightPositions) {
        final int positionCount = leftPositions.size();
        boolean[] valueIsNull = new boolean[positionCount];
        int[] codes = new int[positionCount];
        boolean hasNull = false;
        for (int i = 0; i < positionCount; i++) {
            int leftPosition = leftPositions.getInt(i);
            int rightPosition = rightPositions.getInt(i);
            if (leftPosition != NO_POSITION && !left.isNull(leftPosition)) {
                codes[i] = left.getInt(leftPosition);
            } else if (rightPosition != NO_POSITION && !right.isNull(rightPosition)) {
                codes[i] = merged.translateRight(right.getInt(rightPosition));
            } else {
                valueIsNull[i] = true;
                hasNull = true;
            }
        }
        return new CategoricalBlock(merged.getRevMap(), 0, positionCount, hasNull ? valueIsNull : null, codes);
    }

    public static final class JoinResult {
        private final CategoricalBlock keys;
        private final MergedRevMap translation;
        private final int[] leftPositions;
        private final int[] rightPositions;

        JoinResult(CategoricalBlock keys, MergedRevMap translation, int[] leftPositions, int[] rightPositions) {
            this.keys = keys;
            this.translation = translation;
            this.leftPositions = leftPositions;
            this.rightPositions = rightPositions;
        }

        /**
         * Coalesced join keys, under the RevMap shared by both inputs.
         */
        public CategoricalBlock getKeys() {
            return keys;
        }

        /**
         * How the codes of the right input map into the RevMap of {@link #getKeys()}.
         */
        public MergedRevMap getTranslation() {
            return translation;
        }

        /**
         * Left row of every output row, {@link #NO_POSITION} when there is none.
         */
        public int[] getLeftPositions() {
            return leftPositions;
        }

        public int[] getRightPositions() {
            return rightPositions;
        }

        public int getPositionCount() {
            return leftPositions.length;
        }
    }
}
