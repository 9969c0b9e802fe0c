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
import io.airlift.slice.Slices;
import io.airlift.slice.XxHash64;
import org.openjdk.jol.info.ClassLayout;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import static io.airlift.slice.SizeOf.sizeOf;

/**
 * String Block
 */
public class StringBlock extends AbstractBlock {

    private static final long INSTANCE_SIZE = ClassLayout.parseClass(StringBlock.class).instanceSize();

    /**
     * records where the chars of each position end at
     */
    private final int[] offsets;
    private final char[] data;

    StringBlock(int arrayOffset, int positionCount, boolean[] valueIsNull, int[] offsets, char[] data) {
        super(arrayOffset, positionCount, valueIsNull);
        this.offsets = Preconditions.checkNotNull(offsets);
        this.data = data;
        updateSizeInfo();
    }

    /**
     * Designed for test purpose
     */
    public static StringBlock of(String... values) {
        int totalLength = Arrays.stream(values).filter(Objects::nonNull).mapToInt(String::length).sum();
        StringBlockBuilder builder = new StringBlockBuilder(values.length, totalLength);
        for (String value : values) {
            if (value != null) {
                builder.writeString(value);
            } else {
                builder.appendNull();
            }
        }
        return builder.build().cast(StringBlock.class);
    }

    public static StringBlock from(StringBlock other, int selSize, int[] selection) {
        if (selection == null) {
            Preconditions.checkArgument(selSize <= other.positionCount);
        }
        StringBlockBuilder builder = new StringBlockBuilder(selSize,
            other.data == null ? 0 : other.data.length / (other.positionCount + 1) + 1);
        for (int i = 0; i < selSize; i++) {
            other.writePositionTo(selection == null ? i : selection[i], builder);
        }
        return builder.build().cast(StringBlock.class);
    }

    @Override
    public String getString(int position) {
        checkReadablePosition(position);

        int beginOffset = beginOffset(position);
        int endOffset = endOffset(position);
        return new String(data, beginOffset, endOffset - beginOffset);
    }

    @Override
    public Object getObject(int position) {
        return isNull(position) ? null : getString(position);
    }

    @Override
    public void writePositionTo(int position, BlockBuilder blockBuilder) {
        if (blockBuilder instanceof StringBlockBuilder) {
            writePositionTo(position, (StringBlockBuilder) blockBuilder);
        } else if (isNull(position)) {
            blockBuilder.appendNull();
        } else {
            blockBuilder.writeString(getString(position));
        }
    }

    private void writePositionTo(int position, StringBlockBuilder b) {
        if (isNull(position)) {
            b.appendNull();
        } else {
            int beginOffset = beginOffset(position);
            int endOffset = endOffset(position);

            b.valueIsNull.add(false);
            b.data.addElements(b.data.size(), data, beginOffset, endOffset - beginOffset);
            b.offsets.add(b.data.size());
        }
    }

    @Override
    public long hashCodeUseXxhash(int pos) {
        if (isNull(pos)) {
            return NULL_HASH_CODE;
        } else {
            byte[] rawBytes = getString(pos).getBytes(StandardCharsets.UTF_8);
            return XxHash64.hash(Slices.wrappedBuffer(rawBytes), 0, rawBytes.length);
        }
    }

    @Override
    public int hashCode(int position) {
        if (isNull(position)) {
            return 0;
        }
        int result = 1;
        for (int i = beginOffset(position); i < endOffset(position); i++) {
            result = 31 * result + data[i];
        }
        return result;
    }

    @Override
    public boolean equals(int position, Block other, int otherPosition) {
        if (!(other instanceof StringBlock)) {
            return super.equals(position, other, otherPosition);
        }
        StringBlock that = (StringBlock) other;
        boolean n1 = isNull(position);
        boolean n2 = that.isNull(otherPosition);
        if (n1 && n2) {
            return true;
        } else if (n1 != n2) {
            return false;
        }
        int pos1 = beginOffset(position);
        int len1 = endOffset(position) - pos1;
        int pos2 = that.beginOffset(otherPosition);
        int len2 = that.endOffset(otherPosition) - pos2;
        return Arrays.equals(data, pos1, pos1 + len1, that.data, pos2, pos2 + len2);
    }

    private int beginOffset(int position) {
        return position + arrayOffset > 0 ? offsets[position + arrayOffset - 1] : 0;
    }

    private int endOffset(int position) {
        return offsets[position + arrayOffset];
    }

    @Override
    public void updateSizeInfo() {
        estimatedSize = INSTANCE_SIZE
            + sizeOf(isNull)
            + sizeOf(data)
            + sizeOf(offsets);
    }
}
