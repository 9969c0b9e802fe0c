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
import com.alibaba.polarcat.executor.categorical.StringCache;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import io.airlift.slice.SliceInput;
import io.airlift.slice.SliceOutput;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static com.alibaba.polarcat.executor.chunk.EncoderUtil.decodeNullBits;
import static com.alibaba.polarcat.executor.chunk.EncoderUtil.encodeNullsAsBits;

/**
 * Writes the strings a categorical block refers to, never the codes of its RevMap, so the
 * block can be read back into whatever string cache scope the reader has open.
 * <p>
 * Layout: position count, null bits, dictionary size, dictionary strings as length prefixed
 * UTF-8, one code per position into that dictionary.
 */
public class CategoricalBlockEncoding implements BlockEncoding {
    private static final Charset UTF8 = StandardCharsets.UTF_8;

    private static final String NAME = "CATEGORICAL";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void writeBlock(SliceOutput sliceOutput, Block block) {
        CategoricalBlock categoricalBlock = block.cast(CategoricalBlock.class);
        int positionCount = block.getPositionCount();
        sliceOutput.appendInt(positionCount);
        encodeNullsAsBits(sliceOutput, block);

        // renumber the codes in use in first-seen order
        Int2IntOpenHashMap renumbered = new Int2IntOpenHashMap();
        renumbered.defaultReturnValue(-1);
        ObjectArrayList<String> dictionary = new ObjectArrayList<>();
        int[] codes = new int[positionCount];
        for (int position = 0; position < positionCount; position++) {
            if (categoricalBlock.isNull(position)) {
                continue;
            }
            int code = categoricalBlock.getInt(position);
            int newCode = renumbered.get(code);
            if (newCode == -1) {
                newCode = dictionary.size();
                dictionary.add(categoricalBlock.getString(position));
                renumbered.put(code, newCode);
            }
            codes[position] = newCode;
        }

        sliceOutput.appendInt(dictionary.size());
        for (String value : dictionary) {
            byte[] bytes = value.getBytes(UTF8);
            sliceOutput.appendInt(bytes.length);
            sliceOutput.appendBytes(bytes);
        }
        for (int position = 0; position < positionCount; position++) {
            sliceOutput.appendInt(codes[position]);
        }
    }

    @Override
    public Block readBlock(SliceInput sliceInput) {
        int positionCount = sliceInput.readInt();
        boolean[] valueIsNull = decodeNullBits(sliceInput, positionCount);

        CategoricalEncoder encoder = StringCache.getInstance().newEncoder();
        int dictionarySize = sliceInput.readInt();
        int[] translation = new int[dictionarySize];
        for (int i = 0; i < dictionarySize; i++) {
            byte[] bytes = new byte[sliceInput.readInt()];
            sliceInput.readBytes(bytes);
            translation[i] = encoder.encode(new String(bytes, UTF8));
        }

        boolean hasNull = false;
        int[] codes = new int[positionCount];
        for (int position = 0; position < positionCount; position++) {
            int code = sliceInput.readInt();
            if (valueIsNull[position]) {
                hasNull = true;
            } else {
                codes[position] = translation[code];
            }
        }
        return new CategoricalBlock(encoder.getRevMap(), 0, positionCount, hasNull ? valueIsNull : null, codes);
    }
}
