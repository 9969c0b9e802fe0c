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

import com.alibaba.polarcat.common.exception.PolarCatRuntimeException;
import com.alibaba.polarcat.common.exception.code.ErrorCode;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;

import java.util.List;

import static com.alibaba.polarcat.common.properties.CategoricalProperties.CATEGORICAL_GLOBAL_DICTIONARY_CAPACITY;
import static com.alibaba.polarcat.common.properties.CategoricalProperties.CATEGORICAL_LOCAL_DICTIONARY_CAPACITY;
import static com.alibaba.polarcat.common.properties.CategoricalProperties.CATEGORICAL_MAX_DICTIONARY_SIZE;
import static com.alibaba.polarcat.common.properties.CategoricalProperties.CATEGORICAL_WARN_LOCAL_COMPARE;

public class CategoricalConfig {

    public static final List<String> SUPPORTED_KEYS = ImmutableList.of(
        CATEGORICAL_LOCAL_DICTIONARY_CAPACITY,
        CATEGORICAL_GLOBAL_DICTIONARY_CAPACITY,
        CATEGORICAL_MAX_DICTIONARY_SIZE,
        CATEGORICAL_WARN_LOCAL_COMPARE);

    public static CategoricalConfig getInstance() {
        return instance;
    }

    private CategoricalConfig() {
    }

    public void loadValue(Logger logger, String key, String value) {
        if (key != null && value != null) {
            try {
                switch (key.toUpperCase()) {
                case CATEGORICAL_LOCAL_DICTIONARY_CAPACITY:
                    localDictionaryCapacity = checkPositive(key, value,
                        parseValue(value, Integer.class, DEFAULT_LOCAL_DICTIONARY_CAPACITY));
                    break;
                case CATEGORICAL_GLOBAL_DICTIONARY_CAPACITY:
                    globalDictionaryCapacity = checkPositive(key, value,
                        parseValue(value, Integer.class, DEFAULT_GLOBAL_DICTIONARY_CAPACITY));
                    break;
                case CATEGORICAL_MAX_DICTIONARY_SIZE:
                    maxDictionarySize = checkPositive(key, value,
                        parseValue(value, Integer.class, DEFAULT_MAX_DICTIONARY_SIZE));
                    break;
                case CATEGORICAL_WARN_LOCAL_COMPARE:
                    warnLocalCompare = parseValue(value, Boolean.class, DEFAULT_WARN_LOCAL_COMPARE);
                    break;
                default:
                    logger.warn("unknown categorical config:" + key + ",value=" + value);
                }
            } catch (NumberFormatException | PolarCatRuntimeException e) {
                logger.warn("invalid categorical config:" + key + ",value=" + value + ", keep "
                    + currentValue(key), e);
            }
        }
    }

    /**
     * Load every supported key found in the JVM system properties.
     */
    public void loadSystemProperties(Logger logger) {
        for (String key : SUPPORTED_KEYS) {
            String value = System.getProperty(key);
            if (value != null) {
                logger.info("load categorical config from system properties:" + key + "=" + value);
                loadValue(logger, key, value);
            }
        }
    }

    /**
     * Restore every setting to its default.
     */
    public void reset() {
        localDictionaryCapacity = DEFAULT_LOCAL_DICTIONARY_CAPACITY;
        globalDictionaryCapacity = DEFAULT_GLOBAL_DICTIONARY_CAPACITY;
        maxDictionarySize = DEFAULT_MAX_DICTIONARY_SIZE;
        warnLocalCompare = DEFAULT_WARN_LOCAL_COMPARE;
    }

    private Object currentValue(String key) {
        switch (key.toUpperCase()) {
        case CATEGORICAL_LOCAL_DICTIONARY_CAPACITY:
            return localDictionaryCapacity;
        case CATEGORICAL_GLOBAL_DICTIONARY_CAPACITY:
            return globalDictionaryCapacity;
        case CATEGORICAL_MAX_DICTIONARY_SIZE:
            return maxDictionarySize;
        default:
            return warnLocalCompare;
        }
    }

    private static int checkPositive(String key, String value, int parsed) {
        if (parsed <= 0) {
            throw new PolarCatRuntimeException(ErrorCode.ERR_CONFIG, key, value);
        }
        return parsed;
    }

    private static final int DEFAULT_LOCAL_DICTIONARY_CAPACITY = 16;
    private volatile int localDictionaryCapacity = DEFAULT_LOCAL_DICTIONARY_CAPACITY;

    public int getLocalDictionaryCapacity() {
        return localDictionaryCapacity;
    }

    private static final int DEFAULT_GLOBAL_DICTIONARY_CAPACITY = 1024;
    private volatile int globalDictionaryCapacity = DEFAULT_GLOBAL_DICTIONARY_CAPACITY;

    public int getGlobalDictionaryCapacity() {
        return globalDictionaryCapacity;
    }

    // largest array length most VMs accept
    private static final int DEFAULT_MAX_DICTIONARY_SIZE = Integer.MAX_VALUE - 8;
    private volatile int maxDictionarySize = DEFAULT_MAX_DICTIONARY_SIZE;

    public int getMaxDictionarySize() {
        return maxDictionarySize;
    }

    private static final boolean DEFAULT_WARN_LOCAL_COMPARE = true;
    private volatile boolean warnLocalCompare = DEFAULT_WARN_LOCAL_COMPARE;

    public boolean isWarnLocalCompare() {
        return warnLocalCompare;
    }

    @SuppressWarnings("unchecked")
    public static <T> T parseValue(String value, Class<T> type, T defaultValue) {
        if (value == null) {
            return defaultValue;
        } else if (type == String.class) {
            return (T) value;
        } else if (type == Integer.class) {
            return (T) (Integer.valueOf(value.trim()));
        } else if (type == Long.class) {
            return (T) (Long.valueOf(value.trim()));
        } else if (type == Boolean.class) {
            return (T) (Boolean.valueOf(value.trim()));
        } else {
            return defaultValue;
        }
    }

    private static CategoricalConfig instance = new CategoricalConfig();
}
