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

import static io.airlift.slice.SizeOf.sizeOf;

/**
 * Boolean Block
 */
public class BooleanBlock extends AbstractBlock {

    private static final long INSTANCE_SIZE = ClassLayout.parseClass(BooleanBlock.class).instanceSize();

    private final boolean[] values;

    public BooleanBlock(int arrayOffset, int positionCount, boolean[] valueIsNull, boolean[] values) {
        super(arrayOffset, positionCount, valueIsNull);
        this.values = Preconditions.checkNotNull(values);
        updateSizeInfo();
    }

    /**
     * Designed for test purpose
     */
    public static BooleanBlock of(Boolean... values) {
        boolean[] valueIsNull = new boolean[values.length];
        boolean[] booleans = new boolean[values.length];
        boolean hasNull = false;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                valueIsNull[i] = true;
                hasNull = true;
            } else {
                booleans[i] = values[i];
            }
        }
        return new BooleanBlock(0, values.length, hasNull ? valueIsNull : null, booleans);
    }

    @Override
    public boolean getBoolean(int position) {
        checkReadablePosition(position);
        return values[position + arrayOffset];
    }

    @Override
    public Object getObject(int position) {
        return isNull(position) ? null : getBoolean(position);
    }

    /**
     * True only when the position is not null and holds true.
     */
    public boolean isTrue(int position) {
        return !isNull(position) && values[position + arrayOffset];
    }

    @Override
    public void writePositionTo(int position, BlockBuilder blockBuilder) {
        if (isNull(position)) {
            blockBuilder.appendNull();
        } else {
            blockBuilder.writeBoolean(getBoolean(position));
        }
    }

    @Override
    public long hashCodeUseXxhash(int pos) {
        if (isNull(pos)) {
            return NULL_HASH_CODE;
        }
        return Boolean.hashCode(getBoolean(pos));
    }

    @Override
    public int hashCode(int position) {
        if (isNull(position)) {
            return 0;
        }
        return Boolean.hashCode(values[position + arrayOffset]);
    }

    @Override
    public void updateSizeInfo() {
        estimatedSize = INSTANCE_SIZE + sizeOf(isNull) + sizeOf(values);
    }
}
