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

public interface BlockBuilder extends Block, MemoryCountable {

    /**
     * Builds the block. This method can be called only once.
     */
    Block build();

    default void writeInt(int value) {
        throw new UnsupportedOperationException(getClass().getName());
    }

    default void writeString(String value) {
        throw new UnsupportedOperationException(getClass().getName());
    }

    default void writeBoolean(boolean value) {
        throw new UnsupportedOperationException(getClass().getName());
    }

    default void ensureCapacity(int capacity) {
        throw new UnsupportedOperationException(getClass().getName());
    }

    void writeObject(Object value);

    void appendNull();

    /**
     * Creates an empty block builder of the same kind.
     */
    BlockBuilder newBlockBuilder();
}
