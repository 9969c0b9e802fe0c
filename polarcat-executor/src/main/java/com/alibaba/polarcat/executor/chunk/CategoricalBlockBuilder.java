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

import com.alibaba.polarcat.executor.categorical.CategoricalEncoder;
import com.alibaba.polarcat.executor.categorical.RevMap;
import com.alibaba.polarcat.executor.categorical.StringCache;
import com.google.common.base.Preconditions;
import org.openjdk.jol.info.ClassLayout;

import java.util.Arrays;

/**
 * Categorical Block Builder
 * <p>
 * The RevMap is chosen once, when the builder is created: the live global string cache when a
 * scope is open, otherwise a new local dictionary owned by the built block.
 */
public class CategoricalBlockBuilder extends AbstractBlockBuilder {
    private static final long INSTANCE_SIZE = ClassLayout.parseClass(CategoricalBlockBuilder.class).instanceSize();

    private final BatchedArrayList.BatchIntArrayList codes;
    private final CategoricalEncoder encoder;

    public CategoricalBlockBuilder(int capacity) {
        super(capacity);
        this.codes = new BatchedArrayList.BatchIntArrayList(capacity);
        this.encoder = StringCache.getInstance().newEncoder();
    }

    @Override
    public void writeString(String value) {
        Preconditions.checkNotNull(value);
        codes.add(encoder.encode(value));
        valueIsNull.add(false);
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
    public void appendNull() {
        appendNullInternal();
        codes.add(0);
    }

    @Override
    public int getInt(int position) {
        checkReadablePosition(position);
        return codes.getInt(position);
    }

    @Override
    public String getString(int position) {
        return getRevMap().decode(getInt(position));
    }

    @Override
    public Object getObject(int position) {
        return isNull(position) ? null : getString(position);
    }

    @Override
    public void ensureCapacity(int capacity) {
        super.ensureCapacity(capacity);
        codes.ensureCapacity(capacity);
    }

    @Override
    public Block build() {
        int positionCount = getPositionCount();
        boolean[] nulls = mayHaveNull() ? Arrays.copyOf(valueIsNull.elements(), positionCount) : null;
        return new CategoricalBlock(getRevMap(), 0, positionCount, nulls,
            Arrays.copyOf(codes.elements(), positionCount));
    }

    @Override
    public BlockBuilder newBlockBuilder() {
        return new CategoricalBlockBuilder(getCapacity());
    }

    public RevMap getRevMap() {
        return encoder.getRevMap();
    }

    @Override
    public long getMemoryUsage() {
        return INSTANCE_SIZE + codes.getMemoryUsage() + valueIsNull.getMemoryUsage();
    }
}
