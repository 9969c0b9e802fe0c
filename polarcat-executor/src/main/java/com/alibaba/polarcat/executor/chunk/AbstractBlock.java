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

/**
 * Abstract random accessible data block.
 */
public abstract class AbstractBlock implements Block {

    final int arrayOffset;
    final int positionCount;

    /**
     * the memory size allocated for this block
     */
    long estimatedSize;

    protected boolean[] isNull;

    AbstractBlock(int arrayOffset, int positionCount, boolean[] valueIsNull) {
        Preconditions.checkArgument(positionCount >= 0);
        Preconditions.checkArgument(arrayOffset >= 0);

        this.positionCount = positionCount;
        this.arrayOffset = arrayOffset;
        this.isNull = valueIsNull;
    }

    @Override
    public long estimateSize() {
        return estimatedSize;
    }

    @Override
    public int getPositionCount() {
        return positionCount;
    }

    @Override
    public boolean mayHaveNull() {
        return isNull != null;
    }

    @Override
    public boolean isNull(int position) {
        checkReadablePosition(position);
        return isNull != null && isNull[position + arrayOffset];
    }

    void checkReadablePosition(int position) {
        if (position < 0 || position >= positionCount) {
            throw new IllegalArgumentException("position is not valid:" + position + "," + positionCount);
        }
    }

    public abstract void updateSizeInfo();
}
