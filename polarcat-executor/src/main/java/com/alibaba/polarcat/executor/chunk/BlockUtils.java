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

import java.util.Arrays;

public abstract class BlockUtils {

    public static boolean[] copyNullArray(boolean[] values, int[] selection, int positionCount) {
        if (values == null) {
            return null;
        }
        if (selection == null) {
            return Arrays.copyOf(values, positionCount);
        } else {
            boolean[] target = new boolean[positionCount];
            boolean hasNull = false;
            for (int i = 0; i < positionCount; i++) {
                target[i] = values[selection[i]];
                hasNull |= target[i];
            }
            // NOTE: destroy the boolean array if it does not have null.
            return hasNull ? target : null;
        }
    }
}
