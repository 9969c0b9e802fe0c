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

import com.alibaba.polarcat.executor.chunk.CategoricalBlock;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Grouped statistics over the codes of a categorical block.
 */
public final class CategoricalAggregates {

    private CategoricalAggregates() {
    }

    /**
     * Occurrences of every value, null included, most frequent first. Ties keep the order in
     * which the values first appear.
     */
    public static List<ValueCount> valueCounts(CategoricalBlock block) {
        // group ids are handed out in first-seen order
        Int2IntOpenHashMap groupOfCode = new Int2IntOpenHashMap();
        groupOfCode.defaultReturnValue(-1);
        IntArrayList groupCodes = new IntArrayList();
        IntArrayList groupCounts = new IntArrayList();
        int nullGroup = -1;

        for (int position = 0; position < block.getPositionCount(); position++) {
            int group;
            if (block.isNull(position)) {
                if (nullGroup == -1) {
                    nullGroup = groupCounts.size();
                    groupCodes.add(-1);
                    groupCounts.add(0);
                }
                group = nullGroup;
            } else {
                int code = block.getInt(position);
                group = groupOfCode.get(code);
                if (group == -1) {
                    group = groupCounts.size();
                    groupOfCode.put(code, group);
                    groupCodes.add(code);
                    groupCounts.add(0);
                }
            }
            groupCounts.set(group, groupCounts.getInt(group) + 1);
        }

        List<ValueCount> result = new ArrayList<>(groupCounts.size());
        for (int group = 0; group < groupCounts.size(); group++) {
            String value = group == nullGroup ? null : block.getRevMap().decode(groupCodes.getInt(group));
            result.add(new ValueCount(value, groupCounts.getInt(group)));
        }
        // stable sort keeps the first-seen order of ties
        result.sort(Comparator.comparingInt(ValueCount::getCount).reversed());
        return result;
    }

    /**
     * Distinct non-null values in the order they first appear.
     */
    public static List<String> uniqueValues(CategoricalBlock block) {
        IntOpenHashSet seen = new IntOpenHashSet();
        List<String> result = new ArrayList<>();
        for (int position = 0; position < block.getPositionCount(); position++) {
            if (block.isNull(position)) {
                continue;
            }
            int code = block.getInt(position);
            if (seen.add(code)) {
                result.add(block.getRevMap().decode(code));
            }
        }
        return result;
    }

    /**
     * Categories carry no order, so the maximum of a categorical block is always null.
     */
    public static String max(CategoricalBlock block) {
        return null;
    }

    /**
     * See {@link #max(CategoricalBlock)}.
     */
    public static String min(CategoricalBlock block) {
        return null;
    }

    public static final class ValueCount {
        private final String value;
        private final int count;

        public ValueCount(String value, int count) {
            this.value = value;
            this.count = count;
        }

        /**
         * The value, null for the group of null positions.
         */
        public String getValue() {
            return value;
        }

        public int getCount() {
            return count;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            ValueCount that = (ValueCount) o;
            return count == that.count && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, count);
        }

        @Override
        public String toString() {
            return value + "=" + count;
        }
    }
}
