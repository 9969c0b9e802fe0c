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

package com.alibaba.polarcat.common.properties;

/**
 * Names of the categorical settings, usable as system property keys.
 */
public class CategoricalProperties {

    /**
     * initial slot count of a dictionary owned by a single column
     */
    public static final String CATEGORICAL_LOCAL_DICTIONARY_CAPACITY = "CATEGORICAL_LOCAL_DICTIONARY_CAPACITY";

    /**
     * initial slot count of the dictionary of a global string cache scope
     */
    public static final String CATEGORICAL_GLOBAL_DICTIONARY_CAPACITY = "CATEGORICAL_GLOBAL_DICTIONARY_CAPACITY";

    /**
     * upper bound of distinct strings in any dictionary
     */
    public static final String CATEGORICAL_MAX_DICTIONARY_SIZE = "CATEGORICAL_MAX_DICTIONARY_SIZE";

    public static final String CATEGORICAL_WARN_LOCAL_COMPARE = "CATEGORICAL_WARN_LOCAL_COMPARE";
}
