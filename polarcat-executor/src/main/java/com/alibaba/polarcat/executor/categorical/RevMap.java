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

import com.google.common.base.Preconditions;

/**
 * Reverse mapping from the codes of a categorical column to its strings.
 * <p>
 * A GLOBAL RevMap views the dictionary of one generation of the {@link StringCache}. A LOCAL
 * RevMap owns a private dictionary, shared only by the columns derived from the same build.
 */
public final class RevMap {

    public enum Kind {
        GLOBAL,
        LOCAL
    }

    private static final long NO_GENERATION = -1L;

    private final Kind kind;
    private final long generation;
    private final StringDictionary dictionary;

    private RevMap(Kind kind, long generation, StringDictionary dictionary) {
        this.kind = kind;
        this.generation = generation;
        this.dictionary = Preconditions.checkNotNull(dictionary);
    }

    static RevMap global(long generation, StringDictionary dictionary) {
        Preconditions.checkArgument(generation >= 0);
        return new RevMap(Kind.GLOBAL, generation, dictionary);
    }

    public static RevMap local(StringDictionary dictionary) {
        return new RevMap(Kind.LOCAL, NO_GENERATION, dictionary);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isGlobal() {
        return kind == Kind.GLOBAL;
    }

    public boolean isLocal() {
        return kind == Kind.LOCAL;
    }

    public long getGeneration() {
        Preconditions.checkState(kind == Kind.GLOBAL, "local RevMap has no generation");
        return generation;
    }

    StringDictionary getDictionary() {
        return dictionary;
    }

    /**
     * Were the codes of both RevMaps assigned by the same dictionary?
     */
    public boolean isSameSource(RevMap other) {
        switch (kind) {
        case GLOBAL:
            return other.kind == Kind.GLOBAL && generation == other.generation;
        case LOCAL:
            return other.kind == Kind.LOCAL && dictionary == other.dictionary;
        default:
            throw new AssertionError("unknown RevMap kind " + kind);
        }
    }

    public String decode(int code) {
        switch (kind) {
        case GLOBAL:
            return StringCache.getInstance().decode(dictionary, code);
        case LOCAL:
            synchronized (dictionary) {
                return dictionary.decode(code);
            }
        default:
            throw new AssertionError("unknown RevMap kind " + kind);
        }
    }

    /**
     * Code of the string, or {@link StringDictionary#NOT_FOUND}. Never adds the string.
     */
    public int lookup(String value) {
        switch (kind) {
        case GLOBAL:
            return StringCache.getInstance().lookup(dictionary, value);
        case LOCAL:
            synchronized (dictionary) {
                return dictionary.lookup(value);
            }
        default:
            throw new AssertionError("unknown RevMap kind " + kind);
        }
    }

    public int size() {
        switch (kind) {
        case GLOBAL:
            return StringCache.getInstance().size(dictionary);
        case LOCAL:
            synchronized (dictionary) {
                return dictionary.size();
            }
        default:
            throw new AssertionError("unknown RevMap kind " + kind);
        }
    }

    /**
     * Write a string into a local dictionary. Readers of the same dictionary go through the
     * monitor of the dictionary as well.
     */
    int encodeLocal(String value) {
        Preconditions.checkState(kind == Kind.LOCAL, "global RevMap is written through the StringCache");
        synchronized (dictionary) {
            return dictionary.encode(value);
        }
    }

    StringDictionary copyDictionary() {
        switch (kind) {
        case GLOBAL:
            return StringCache.getInstance().copy(dictionary);
        case LOCAL:
            synchronized (dictionary) {
                return dictionary.copy();
            }
        default:
            throw new AssertionError("unknown RevMap kind " + kind);
        }
    }

    /**
     * Union of two local dictionaries, see {@link StringDictionary#merge(StringDictionary)}.
     */
    StringDictionary.MergeResult mergeLocal(RevMap right) {
        Preconditions.checkState(kind == Kind.LOCAL && right.kind == Kind.LOCAL);
        // copy first so that only one monitor is held at a time
        StringDictionary rightValues = right.copyDictionary();
        synchronized (dictionary) {
            return dictionary.merge(rightValues);
        }
    }

    /**
     * Make the string known to this RevMap and return its code.
     * <p>
     * The string is appended to the dictionary of this RevMap, so every code handed out before
     * keeps its value and columns sharing the RevMap stay comparable. For a global RevMap this
     * holds also after its generation has finished.
     */
    public int extendWith(String value) {
        Preconditions.checkNotNull(value);
        switch (kind) {
        case GLOBAL:
            return StringCache.getInstance().extend(this, value);
        case LOCAL:
            return encodeLocal(value);
        default:
            throw new AssertionError("unknown RevMap kind " + kind);
        }
    }

    public String describe() {
        return kind == Kind.GLOBAL ? "global(generation=" + generation + ")" : "local";
    }

    @Override
    public String toString() {
        return "RevMap{" + describe() + ", size=" + size() + "}";
    }
}
