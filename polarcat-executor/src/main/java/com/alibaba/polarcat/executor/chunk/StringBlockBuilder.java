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

import com.google.common.base.Preconditions;
import org.openjdk.jol.info.ClassLayout;

import java.util.Arrays;

/**
 * String Block Builder
 */
public class StringBlockBuilder extends AbstractBlockBuilder {
    private static final long INSTANCE_SIZE = ClassLayout.parseClass(StringBlockBuilder.class).instanceSize();

    private final int initialStringLength;
    final BatchedArrayList.BatchIntArrayList offsets; // records where the chars end at
    final BatchedArrayList.BatchCharArrayList data;

    public StringBlockBuilder(int capacity, int expectedStringLength) {
        super(capacity);
        this.offsets = new BatchedArrayList.BatchIntArrayList(capacity);
        this.data = new BatchedArrayList.BatchCharArrayList(capacity * expectedStringLength);
        this.initialStringLength = expectedStringLength;
    }

    @Override
    public long getMemoryUsage() {
        return INSTANCE_SIZE
            + offsets.getMemoryUsage()
            + data.getMemoryUsage()
            + valueIsNull.getMemoryUsage();
    }

    @Override
    public void writeString(String value) {
        data.add(value);
        valueIsNull.add(false);
        offsets.add(data.size());
    }

    @Override
    public String getString(int position) {
        checkReadablePosition(position);
        int beginOffset = beginOffset(position);
        int endOffset = endOffset(position);
        return new String(data.elements(), beginOffset, endOffset - beginOffset);
    }

    @Override
    public Object getObject(int position) {
        return isNull(position) ? null : getString(position);
    }

    @Override
    public void writeObject(Object value) {
        if (value == null) {
            appendNull();
            return;
        }
        Preconditions.checkArgument(value instanceof String);
        writeString((String) value);
    }

    @Override
    public void ensureCapacity(int capacity) {
        super.ensureCapacity(capacity);
        offsets.ensureCapacity(capacity);
        data.ensureCapacity(capacity * initialStringLength);
    }

    @Override
    public Block build() {
        char[] validData = Arrays.copyOf(data.elements(), data.size());
        int[] validOffsets = Arrays.copyOf(offsets.elements(), offsets.size());
        boolean[] nulls = mayHaveNull() ? Arrays.copyOf(valueIsNull.elements(), getPositionCount()) : null;
        return new StringBlock(0, getPositionCount(), nulls, validOffsets, validData);
    }

    @Override
    public void appendNull() {
        appendNullInternal();
        offsets.add(data.size());
    }

    @Override
    public BlockBuilder newBlockBuilder() {
        return new StringBlockBuilder(getCapacity(), initialStringLength);
    }

    int beginOffset(int position) {
        return position > 0 ? offsets.getInt(position - 1) : 0;
    }

    int endOffset(int position) {
        return offsets.getInt(position);
    }
}
