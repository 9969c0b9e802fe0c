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

import com.alibaba.polarcat.common.memory.MemoryCountable;
import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.chars.CharArrayList;
import it.unimi.dsi.fastutil.chars.CharArrays;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.openjdk.jol.info.ClassLayout;

import static io.airlift.slice.SizeOf.sizeOf;

/**
 * Growable primitive lists used by the block builders, accounting for the memory they hold.
 */
public interface BatchedArrayList extends MemoryCountable {

    class BatchIntArrayList extends IntArrayList implements BatchedArrayList {
        private static final long INSTANCE_SIZE = ClassLayout.parseClass(BatchIntArrayList.class).instanceSize();

        public BatchIntArrayList(int capacity) {
            super(capacity);
        }

        @Override
        public long getMemoryUsage() {
            return INSTANCE_SIZE + sizeOf(a);
        }
    }

    class BatchBooleanArrayList extends BooleanArrayList implements BatchedArrayList {
        private static final long INSTANCE_SIZE = ClassLayout.parseClass(BatchBooleanArrayList.class).instanceSize();

        public BatchBooleanArrayList(int capacity) {
            super(capacity);
        }

        @Override
        public long getMemoryUsage() {
            return INSTANCE_SIZE + sizeOf(a);
        }
    }

    class BatchCharArrayList extends CharArrayList implements BatchedArrayList {
        private static final long INSTANCE_SIZE = ClassLayout.parseClass(BatchCharArrayList.class).instanceSize();

        public BatchCharArrayList(int capacity) {
            super(capacity);
        }

        public void add(String value) {
            int length = value.length();
            this.a = CharArrays.ensureCapacity(this.a, this.size + length, this.size);
            value.getChars(0, length, this.a, this.size);
            this.size += length;
        }

        @Override
        public long getMemoryUsage() {
            return INSTANCE_SIZE + sizeOf(a);
        }
    }
}
