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

public abstract class AbstractBlockBuilder implements BlockBuilder {

    final int initialCapacity;
    final protected BatchedArrayList.BatchBooleanArrayList valueIsNull;
    protected boolean containsNull;

    public AbstractBlockBuilder(int initialCapacity) {
        this.initialCapacity = initialCapacity;
        this.valueIsNull = new BatchedArrayList.BatchBooleanArrayList(initialCapacity);
        this.containsNull = false;
    }

    @Override
    public int getPositionCount() {
        return valueIsNull.size();
    }

    @Override
    public boolean isNull(int position) {
        checkReadablePosition(position);
        return valueIsNull.getBoolean(position);
    }

    @Override
    public void ensureCapacity(int capacity) {
        valueIsNull.ensureCapacity(capacity);
    }

    protected void appendNullInternal() {
        valueIsNull.add(true);
        containsNull = true;
    }

    @Override
    public boolean mayHaveNull() {
        return containsNull;
    }

    protected void checkReadablePosition(int position) {
        if (position < 0 || position >= getPositionCount()) {
            throw new IllegalArgumentException("position is not valid:" + position + "," + getPositionCount());
        }
    }

    protected int getCapacity() {
        return Math.max(valueIsNull.elements().length, initialCapacity);
    }

    @Override
    public long estimateSize() {
        return getMemoryUsage();
    }

    @Override
    public final long hashCodeUseXxhash(int pos) {
        throw new UnsupportedOperationException("Block builder not support hash code calculation ");
    }

    @Override
    public void writePositionTo(int position, BlockBuilder blockBuilder) {
        throw new UnsupportedOperationException(getClass().getName());
    }
}
