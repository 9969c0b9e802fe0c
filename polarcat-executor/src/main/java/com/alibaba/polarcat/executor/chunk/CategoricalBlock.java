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

import com.alibaba.polarcat.executor.categorical.RevMap;
import com.google.common.base.Preconditions;
import io.airlift.slice.Slices;
import io.airlift.slice.XxHash64;
import org.openjdk.jol.info.ClassLayout;

import java.nio.charset.StandardCharsets;

import static io.airlift.slice.SizeOf.sizeOf;

/**
 * Categorical Block: integer codes and the RevMap that translates them back to strings.
 * <p>
 * The RevMap is shared with the blocks derived from this one and is not part of the estimated size.
 */
public class CategoricalBlock extends AbstractBlock {

    private static final long INSTANCE_SIZE = ClassLayout.parseClass(CategoricalBlock.class).instanceSize();

    private final int[] codes;
    private final RevMap revMap;

    public CategoricalBlock(RevMap revMap, int arrayOffset, int positionCount, boolean[] valueIsNull, int[] codes) {
        super(arrayOffset, positionCount, valueIsNull);
        this.revMap = Preconditions.checkNotNull(revMap);
        this.codes = Preconditions.checkNotNull(codes);
        updateSizeInfo();
    }

    public static CategoricalBlock from(CategoricalBlock other, int selSize, int[] selection) {
        int[] newCodes = new int[selSize];
        for (int i = 0; i < selSize; i++) {
            int j = selection == null ? i : selection[i];
            newCodes[i] = other.codes[j + other.arrayOffset];
        }
        boolean[] newNulls;
        if (other.isNull == null) {
            newNulls = null;
        } else if (other.arrayOffset == 0) {
            newNulls = BlockUtils.copyNullArray(other.isNull, selection, selSize);
        } else {
            newNulls = new boolean[selSize];
            for (int i = 0; i < selSize; i++) {
                newNulls[i] = other.isNull(selection == null ? i : selection[i]);
            }
        }
        return new CategoricalBlock(other.revMap, 0, selSize, newNulls, newCodes);
    }

    /**
     * Keep the positions where the mask is true. The result shares the RevMap.
     */
    public CategoricalBlock filter(BooleanBlock mask) {
        Preconditions.checkArgument(mask.getPositionCount() == positionCount,
            "mask length " + mask.getPositionCount() + " does not match block length " + positionCount);
        int[] selection = new int[positionCount];
        int selSize = 0;
        for (int i = 0; i < positionCount; i++) {
            if (mask.isTrue(i)) {
                selection[selSize++] = i;
            }
        }
        return from(this, selSize, selection);
    }

    /**
     * Take the given positions, -1 producing null. The result shares the RevMap.
     */
    public CategoricalBlock copyPositions(int[] positions) {
        int[] newCodes = new int[positions.length];
        boolean[] newNulls = new boolean[positions.length];
        boolean hasNull = false;
        for (int i = 0; i < positions.length; i++) {
            int position = positions[i];
            if (position < 0 || isNull(position)) {
                newNulls[i] = true;
                hasNull = true;
            } else {
                newCodes[i] = codes[position + arrayOffset];
            }
        }
        return new CategoricalBlock(revMap, 0, positions.length, hasNull ? newNulls : null, newCodes);
    }

    public RevMap getRevMap() {
        return revMap;
    }

    /**
     * The code at the position. Meaningless for a null position.
     */
    @Override
    public int getInt(int position) {
        checkReadablePosition(position);
        return codes[position + arrayOffset];
    }

    @Override
    public String getString(int position) {
        return revMap.decode(getInt(position));
    }

    @Override
    public Object getObject(int position) {
        return isNull(position) ? null : getString(position);
    }

    @Override
    public void writePositionTo(int position, BlockBuilder blockBuilder) {
        if (isNull(position)) {
            blockBuilder.appendNull();
        } else {
            blockBuilder.writeString(getString(position));
        }
    }

    /**
     * Hash of the decoded string, equal to the one of a {@link StringBlock} holding the same value.
     */
    @Override
    public long hashCodeUseXxhash(int pos) {
        if (isNull(pos)) {
            return NULL_HASH_CODE;
        }
        byte[] rawBytes = getString(pos).getBytes(StandardCharsets.UTF_8);
        return XxHash64.hash(Slices.wrappedBuffer(rawBytes), 0, rawBytes.length);
    }

    /**
     * Hash of the decoded string, so that it agrees with {@link #equals(int, Block, int)} against
     * blocks of other sources and with {@link StringBlock#hashCode(int)}.
     */
    @Override
    public int hashCode(int position) {
        if (isNull(position)) {
            return 0;
        }
        String value = getString(position);
        int result = 1;
        for (int i = 0; i < value.length(); i++) {
            result = 31 * result + value.charAt(i);
        }
        return result;
    }

    @Override
    public boolean equals(int position, Block other, int otherPosition) {
        if (other instanceof CategoricalBlock && revMap.isSameSource(((CategoricalBlock) other).revMap)) {
            boolean n1 = isNull(position);
            boolean n2 = other.isNull(otherPosition);
            if (n1 || n2) {
                return n1 == n2;
            }
            return getInt(position) == other.getInt(otherPosition);
        }
        return super.equals(position, other, otherPosition);
    }

    @Override
    public void updateSizeInfo() {
        estimatedSize = INSTANCE_SIZE + sizeOf(isNull) + sizeOf(codes);
    }
}
