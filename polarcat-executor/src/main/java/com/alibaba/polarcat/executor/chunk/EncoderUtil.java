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

import io.airlift.slice.SliceInput;
import io.airlift.slice.SliceOutput;

public final class EncoderUtil {

    private EncoderUtil() {
    }

    /**
     * Append the null flags of the block as a stream of bits, most significant bit first.
     *
     * @return the number of null positions
     */
    public static int encodeNullsAsBits(SliceOutput sliceOutput, Block block) {
        int nullsCnt = 0;
        final int positionCount = block.getPositionCount();
        for (int start = 0; start < positionCount; start += 8) {
            int value = 0;
            int mask = 0b1000_0000;
            int end = Math.min(start + 8, positionCount);
            for (int position = start; position < end; position++) {
                if (block.isNull(position)) {
                    value |= mask;
                    nullsCnt++;
                }
                mask >>>= 1;
            }
            sliceOutput.appendByte(value);
        }
        return nullsCnt;
    }

    /**
     * Decode the bit stream created by encodeNullsAsBits.
     */
    public static boolean[] decodeNullBits(SliceInput sliceInput, int positionCount) {
        boolean[] valueIsNull = new boolean[positionCount];
        for (int start = 0; start < positionCount; start += 8) {
            byte value = sliceInput.readByte();
            int mask = 0b1000_0000;
            int end = Math.min(start + 8, positionCount);
            for (int position = start; position < end; position++) {
                valueIsNull[position] = (value & mask) != 0;
                mask >>>= 1;
            }
        }
        return valueIsNull;
    }
}
