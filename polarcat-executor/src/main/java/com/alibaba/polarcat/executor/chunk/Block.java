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

package com.alibaba.polarcat.executor.chunk;

/**
 * Columnar, position addressed data block.
 */
public interface Block extends CastableBlock {
    public static final int NULL_HASH_CODE = 0;

    /**
     * Is the specified position null?
     *
     * @throws IllegalArgumentException if this position is not valid
     */
    boolean isNull(int position);

    default int getInt(int position) {
        throw new UnsupportedOperationException(getClass().getName());
    }

    default String getString(int position) {
        throw new UnsupportedOperationException(getClass().getName());
    }

    default boolean getBoolean(int position) {
        throw new UnsupportedOperationException(getClass().getName());
    }

    default int hashCode(int position) {
        if (isNull(position)) {
            return 0;
        }
        return getObject(position).hashCode();
    }

    /**
     * Hash code of the value at the position, independent of how the value is stored.
     */
    long hashCodeUseXxhash(int pos);

    default boolean equals(int position, Block other, int otherPosition) {
        boolean n1 = isNull(position);
        boolean n2 = other.isNull(otherPosition);
        if (n1 && n2) {
            return true;
        } else if (n1 != n2) {
            return false;
        }
        return getObject(position).equals(other.getObject(otherPosition));
    }

    /**
     * May this block contain null values? False means it has no null values for sure.
     */
    boolean mayHaveNull();

    Object getObject(int position);

    /**
     * Estimate the memory size except the shared dictionary
     */
    long estimateSize();

    int getPositionCount();

    /**
     * Write the value at the position to the block builder.
     */
    void writePositionTo(int position, BlockBuilder blockBuilder);
}
