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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process wide string cache shared by the categorical columns built while a scope is open.
 * <p>
 * Scopes are depth counted: the cache becomes active when the first scope is entered and is
 * reset when the last one is released. Every reset starts a new generation, and categorical
 * columns only compare directly when they were encoded in the same generation.
 * <p>
 * The dictionary, the generation and the depth are guarded by one read-write lock. A finished
 * generation keeps its dictionary frozen so that columns built in it can still be decoded.
 */
public final class StringCache {

    private static final Logger logger = LoggerFactory.getLogger(StringCache.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private StringDictionary dictionary;
    private long generation;
    private int depth;

    public static StringCache getInstance() {
        return instance;
    }

    private StringCache() {
        this.dictionary = newGlobalDictionary();
    }

    /**
     * Open a scope of the global string cache. Release it with try-with-resources.
     */
    public static StringCacheScope enterCacheScope() {
        return getInstance().enterScope();
    }

    public static boolean isCacheActive() {
        return getInstance().isActive();
    }

    public StringCacheScope enterScope() {
        final long scopeGeneration;
        lock.writeLock().lock();
        try {
            if (depth == 0 && logger.isDebugEnabled()) {
                logger.debug("enable global string cache, generation=" + generation);
            }
            depth++;
            scopeGeneration = generation;
        } finally {
            lock.writeLock().unlock();
        }
        return new StringCacheScope(this, scopeGeneration);
    }

    /**
     * Exit one scope. Called exactly once per scope by {@link StringCacheScope#release()}.
     */
    void exitScope(long scopeGeneration) {
        lock.writeLock().lock();
        try {
            if (depth == 0 || scopeGeneration != generation) {
                logger.warn("ignore release of string cache scope of finished generation " + scopeGeneration
                    + ", current generation=" + generation);
                return;
            }
            depth--;
            if (depth == 0) {
                logger.info("global string cache generation " + generation + " finished with "
                    + dictionary.size() + " strings");
                resetInternal();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Close every open scope and start a new generation. Scope handles still held by callers
     * become no-ops.
     */
    public void teardown() {
        lock.writeLock().lock();
        try {
            if (depth > 0) {
                logger.warn("tear down global string cache with " + depth + " open scopes, generation="
                    + generation);
                depth = 0;
                resetInternal();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void resetInternal() {
        dictionary = newGlobalDictionary();
        generation++;
    }

    private static StringDictionary newGlobalDictionary() {
        return new StringDictionary(CategoricalConfig.getInstance().getGlobalDictionaryCapacity());
    }

    public boolean isActive() {
        lock.readLock().lock();
        try {
            return depth > 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getDepth() {
        lock.readLock().lock();
        try {
            return depth;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getGeneration() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The RevMap a new categorical column should encode into: the live global one when a scope
     * is open, otherwise a fresh local one. The global cache is not touched when inactive.
     */
    public RevMap currentRevMap() {
        lock.readLock().lock();
        try {
            if (depth > 0) {
                return RevMap.global(generation, dictionary);
            }
        } finally {
            lock.readLock().unlock();
        }
        return RevMap.local(new StringDictionary());
    }

    /**
     * Encoder for a new categorical column, bound to {@link #currentRevMap()}.
     */
    public CategoricalEncoder newEncoder() {
        return new CategoricalEncoder(currentRevMap());
    }

    /**
     * Encode into the dictionary of a global RevMap. Strings already known are always found, new
     * strings are only added while the generation of the RevMap is live.
     *
     * @return the code, or {@link StringDictionary#NOT_FOUND} when the generation has finished
     */
    int encode(RevMap revMap, String value) {
        return encode(revMap, value, false);
    }

    /**
     * Append a literal to the dictionary of a global RevMap, also when its generation has
     * finished. Codes already handed out are unchanged, so the columns of that generation stay
     * comparable with each other.
     */
    int extend(RevMap revMap, String value) {
        return encode(revMap, value, true);
    }

    private int encode(RevMap revMap, String value, boolean allowFinished) {
        lock.writeLock().lock();
        try {
            StringDictionary target = revMap.getDictionary();
            int code = target.lookup(value);
            if (code != StringDictionary.NOT_FOUND) {
                return code;
            }
            if (!allowFinished && (depth == 0 || revMap.getGeneration() != generation)) {
                return StringDictionary.NOT_FOUND;
            }
            return target.encode(value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    int lookup(StringDictionary target, String value) {
        lock.readLock().lock();
        try {
            return target.lookup(value);
        } finally {
            lock.readLock().unlock();
        }
    }

    String decode(StringDictionary target, int code) {
        lock.readLock().lock();
        try {
            return target.decode(code);
        } finally {
            lock.readLock().unlock();
        }
    }

    int size(StringDictionary target) {
        lock.readLock().lock();
        try {
            return target.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    StringDictionary copy(StringDictionary target) {
        lock.readLock().lock();
        try {
            return target.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final StringCache instance = new StringCache();
}
