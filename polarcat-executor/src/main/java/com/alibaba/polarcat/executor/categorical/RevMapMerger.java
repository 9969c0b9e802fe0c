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

import com.alibaba.polarcat.common.properties.CategoricalConfig;
import com.alibaba.polarcat.executor.exception.IncompatibleCategoricalSourcesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether two categorical columns can meet, and under which RevMap.
 * <p>
 * Columns of the same source always merge with their codes unchanged. Two independent local
 * columns may only be appended, which re-encodes the right one against the union of both
 * dictionaries. Every other combination fails before any row is touched.
 */
public final class RevMapMerger {

    private static final Logger logger = LoggerFactory.getLogger(RevMapMerger.class);

    public enum Mode {
        COMPARE,
        JOIN,
        APPEND
    }

    private RevMapMerger() {
    }

    public static MergedRevMap merge(RevMap left, RevMap right, Mode mode) {
        if (left.isSameSource(right)) {
            return new MergedRevMap(left, null);
        }
        if (mode == Mode.APPEND && left.isLocal() && right.isLocal()) {
            StringDictionary.MergeResult result = left.mergeLocal(right);
            if (logger.isDebugEnabled()) {
                logger.debug("merge local categorical dictionaries of size " + left.size() + " and "
                    + right.size() + " into " + result.getDictionary().size());
            }
            return new MergedRevMap(RevMap.local(result.getDictionary()), result.getTranslation());
        }
        throw incompatible(left, right, mode);
    }

    /**
     * Fail unless both RevMaps come from the same source.
     */
    public static void checkSameSource(RevMap left, RevMap right, Mode mode) {
        if (!left.isSameSource(right)) {
            throw incompatible(left, right, mode);
        }
    }

    private static IncompatibleCategoricalSourcesException incompatible(RevMap left, RevMap right, Mode mode) {
        String detail = mode.name().toLowerCase() + " of " + left.describe() + " and " + right.describe();
        if (left.isLocal() && right.isLocal() && !StringCache.isCacheActive()
            && CategoricalConfig.getInstance().isWarnLocalCompare()) {
            logger.warn("categorical columns were built outside of a global string cache scope: " + detail);
        } else if (logger.isDebugEnabled()) {
            logger.debug("incompatible categorical sources: " + detail);
        }
        return new IncompatibleCategoricalSourcesException(detail);
    }
}
