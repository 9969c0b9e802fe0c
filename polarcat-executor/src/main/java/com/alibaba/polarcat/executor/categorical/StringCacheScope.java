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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of one open scope of the global string cache.
 * <p>
 * Releasing is idempotent and never throws, so the handle is meant for try-with-resources:
 * <pre>
 * try (StringCacheScope scope = StringCache.enterCacheScope()) {
 *     ...
 * }
 * </pre>
 */
public final class StringCacheScope implements AutoCloseable {

    private final StringCache cache;
    private final long generation;
    private final AtomicBoolean released = new AtomicBoolean(false);

    StringCacheScope(StringCache cache, long generation) {
        this.cache = cache;
        this.generation = generation;
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            cache.exitScope(generation);
        }
    }

    @Override
    public void close() {
        release();
    }

    public boolean isReleased() {
        return released.get();
    }

    public long getGeneration() {
        return generation;
    }
}
