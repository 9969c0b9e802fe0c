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

package com.alibaba.polarcat.executor.categorical;

import com.alibaba.polarcat.common.exception.PolarCatRuntimeException;
import com.alibaba.polarcat.common.exception.code.ErrorCode;
import com.alibaba.polarcat.common.memory.MemoryCountable;
import com.alibaba.polarcat.common.properties.CategoricalConfig;
import com.alibaba.polarcat.executor.exception.CategoricalCodeOutOfRangeException;
import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.HashCommon;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import org.openjdk.jol.info.ClassLayout;

import static io.airlift.slice.SizeOf.sizeOf;
import static io.airlift.slice.SizeOf.sizeOfCharArray;
import static io.airlift.slice.SizeOf.sizeOfIntArray;
import static io.airlift.slice.SizeOf.sizeOfObjectArray;

/**
 * Append-only mapping between strings and dense integer codes.
 * <p>
 * Codes are handed out in first-seen order starting from 0 and are never reused, so a code
 * stays valid for the whole life of the dictionary. The class is not thread safe: the global
 * dictionary is guarded by {@link StringCache}, a local one is only written while its column
 * is being built.
 */
public class StringDictionary implements MemoryCountable {

    private static final long INSTANCE_SIZE = ClassLayout.parseClass(StringDictionary.class).instanceSize();
    private static final long STRING_INSTANCE_SIZE = ClassLayout.parseClass(String.class).instanceSize();

    public static final int NOT_FOUND = -1;

    private final ObjectArrayList<String> values;
    private final Object2IntOpenHashMap<String> codes;
    private final int maxSize;

    /**
     * bytes retained by the interned strings themselves
     */
    private long stringBytes;

    public StringDictionary() {
        this(CategoricalConfig.getInstance().getLocalDictionaryCapacity());
    }

    public StringDictionary(int initialCapacity) {
        this(initialCapacity, CategoricalConfig.getInstance().getMaxDictionarySize());
    }

    StringDictionary(int initialCapacity, int maxSize) {
        Preconditions.checkArgument(initialCapacity >= 0, "initial capacity must not be negative");
        Preconditions.checkArgument(maxSize > 0, "max size must be positive");
        this.maxSize = maxSize;
        this.values = new ObjectArrayList<>(initialCapacity);
        this.codes = new Object2IntOpenHashMap<>(initialCapacity);
        this.codes.defaultReturnValue(NOT_FOUND);
    }

    /**
     * Return the code of the string, assigning the next free code when it is new.
     */
    public int encode(String value) {
        Preconditions.checkNotNull(value, "null can not be encoded into a dictionary");
        int code = codes.getInt(value);
        if (code != NOT_FOUND) {
            return code;
        }
        code = values.size();
        if (code >= maxSize) {
            throw new PolarCatRuntimeException(ErrorCode.ERR_CATEGORICAL_DICTIONARY_FULL, String.valueOf(maxSize));
        }
        try {
            values.add(value);
            codes.put(value, code);
        } catch (OutOfMemoryError e) {
            // keep both structures consistent for the codes issued so far
            values.size(code);
            codes.removeInt(value);
            throw new PolarCatRuntimeException(ErrorCode.ERR_OUT_OF_MEMORY, e, "categorical dictionary");
        }
        stringBytes += STRING_INSTANCE_SIZE + sizeOfCharArray(value.length());
        return code;
    }

    /**
     * Code of the string, or {@link #NOT_FOUND}. Never modifies the dictionary.
     */
    public int lookup(String value) {
        if (value == null) {
            return NOT_FOUND;
        }
        return codes.getInt(value);
    }

    public String decode(int code) {
        if (code < 0 || code >= values.size()) {
            throw new CategoricalCodeOutOfRangeException(code, values.size());
        }
        return values.get(code);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Read-only view over the strings in code order.
     */
    public ObjectList<String> values() {
        return ObjectLists.unmodifiable(values);
    }

    public StringDictionary copy() {
        StringDictionary copy = new StringDictionary(values.size(), maxSize);
        for (String value : values) {
            copy.encode(value);
        }
        return copy;
    }

    /**
     * Build the union of this dictionary and {@code other} without touching either of them.
     * <p>
     * Codes of this dictionary keep their value in the result, strings only found in
     * {@code other} are appended in the order of their codes in {@code other}.
     */
    public MergeResult merge(StringDictionary other) {
        Preconditions.checkNotNull(other);
        StringDictionary merged = new StringDictionary(values.size() + other.size(), maxSize);
        for (String value : values) {
            merged.encode(value);
        }
        int[] translation = new int[other.size()];
        for (int code = 0; code < translation.length; code++) {
            translation[code] = merged.encode(other.values.get(code));
        }
        return new MergeResult(merged, translation);
    }

    @Override
    public long getMemoryUsage() {
        int tableSize = HashCommon.arraySize(Math.max(codes.size(), 1), 0.75f);
        return INSTANCE_SIZE
            + sizeOf(values.elements())
            + sizeOfObjectArray(tableSize + 1)
            + sizeOfIntArray(tableSize + 1)
            + stringBytes;
    }

    @Override
    public String toString() {
        return "StringDictionary{size=" + values.size() + "}";
    }

    public static final class MergeResult {
        private final StringDictionary dictionary;
        private final int[] translation;

        MergeResult(StringDictionary dictionary, int[] translation) {
            this.dictionary = dictionary;
            this.translation = translation;
        }

        public StringDictionary getDictionary() {
            return dictionary;
        }

        /**
         * Maps every code of the merged-in dictionary to its code in {@link #getDictionary()}.
         */
        public int[] getTranslation() {
            return translation;
        }
    }
}
