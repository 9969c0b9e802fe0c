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

public interface CastableBlock {

    /**
     * Cast this block to the concrete block class, failing when it is not one.
     */
    default <T extends Block> T cast(Class<T> clazz) {
        if (!isInstanceOf(clazz)) {
            throw new ClassCastException(getClass().getName() + " can not be cast to " + clazz.getName());
        }
        return clazz.cast(this);
    }

    default boolean isInstanceOf(Class clazz) {
        return clazz.isInstance(this);
    }
}
