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

/**
 * Serializes one kind of block to and from a binary stream.
 */
public interface BlockEncoding {

    String getName();

    void writeBlock(SliceOutput sliceOutput, Block block);

    Block readBlock(SliceInput sliceInput);
}
