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

import com.alibaba.polarcat.executor.exception.IncompatibleCategoricalSourcesException;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class RevMapMergerTest {

    @After
    public void tearDown() {
        StringCache.getInstance().teardown();
    }

    private static RevMap localOf(String... values) {
        StringDictionary dictionary = new StringDictionary();
        for (String value : values) {
            dictionary.encode(value);
        }
        return RevMap.local(dictionary);
    }

    @Test
    public void testSameGlobalGeneration() {
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            RevMap left = StringCache.getInstance().currentRevMap();
            RevMap right = StringCache.getInstance().currentRevMap();
            for (RevMapMerger.Mode mode : RevMapMerger.Mode.values()) {
                MergedRevMap merged = RevMapMerger.merge(left, right, mode);
                Assert.assertTrue(merged.isIdentity());
                Assert.assertSame(left, merged.getRevMap());
                Assert.assertEquals(5, merged.translateRight(5));
            }
        }
    }

    @Test
    public void testDifferentGlobalGenerations() {
        RevMap first;
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            first = StringCache.getInstance().currentRevMap();
        }
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            RevMap second = StringCache.getInstance().currentRevMap();
            for (RevMapMerger.Mode mode : RevMapMerger.Mode.values()) {
                try {
                    RevMapMerger.merge(first, second, mode);
                    Assert.fail("generations differ for " + mode);
                } catch (IncompatibleCategoricalSourcesException e) {
                    Assert.assertTrue(e.getMessage().contains("Cannot compare categoricals originating from "
                        + "different sources. Consider setting a global string cache."));
                }
            }
        }
    }

    @Test
    public void testGlobalAgainstLocal() {
        RevMap local = localOf("a");
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            RevMap global = StringCache.getInstance().currentRevMap();
            for (RevMapMerger.Mode mode : RevMapMerger.Mode.values()) {
                try {
                    RevMapMerger.merge(global, local, mode);
                    Assert.fail();
                } catch (IncompatibleCategoricalSourcesException expected) {
                    // global against local never merges
                }
                try {
                    RevMapMerger.merge(local, global, mode);
                    Assert.fail();
                } catch (IncompatibleCategoricalSourcesException expected) {
                    // either order
                }
            }
        }
    }

    @Test
    public void testSameLocalDictionary() {
        RevMap left = localOf("a", "b");
        RevMap right = RevMap.local(left.getDictionary());
        Assert.assertTrue(RevMapMerger.merge(left, right, RevMapMerger.Mode.COMPARE).isIdentity());
        RevMapMerger.checkSameSource(left, right, RevMapMerger.Mode.JOIN);
    }

    @Test
    public void testIndependentLocalsFailToCompareAndJoin() {
        RevMap left = localOf("a", "b");
        RevMap right = localOf("a", "b");
        for (RevMapMerger.Mode mode : Arrays.asList(RevMapMerger.Mode.COMPARE, RevMapMerger.Mode.JOIN)) {
            try {
                RevMapMerger.merge(left, right, mode);
                Assert.fail("identical content is still a different source");
            } catch (IncompatibleCategoricalSourcesException expected) {
                // independent local dictionaries
            }
        }
    }

    @Test
    public void testIndependentLocalsAppend() {
        RevMap left = localOf("foo", "bar");
        RevMap right = localOf("baz", "bar");
        MergedRevMap merged = RevMapMerger.merge(left, right, RevMapMerger.Mode.APPEND);
        Assert.assertFalse(merged.isIdentity());
        Assert.assertTrue(merged.getRevMap().isLocal());
        Assert.assertFalse(merged.getRevMap().isSameSource(left));
        Assert.assertEquals(Arrays.asList("foo", "bar", "baz"), merged.getRevMap().getDictionary().values());
        Assert.assertEquals(2, merged.translateRight(0));
        Assert.assertEquals(1, merged.translateRight(1));
    }

    @Test
    public void testExtendLocalWithKnownLiteral() {
        RevMap revMap = localOf("a", "b");
        Assert.assertEquals(1, revMap.extendWith("b"));
        Assert.assertEquals(2, revMap.size());
    }

    @Test
    public void testExtendLocalWithNewLiteral() {
        RevMap revMap = localOf("a", "b");
        RevMap sibling = RevMap.local(revMap.getDictionary());
        Assert.assertEquals(2, revMap.extendWith("c"));
        Assert.assertEquals(3, revMap.size());
        Assert.assertEquals(0, revMap.lookup("a"));
        Assert.assertEquals(1, revMap.lookup("b"));
        Assert.assertEquals("c", sibling.decode(2));
        Assert.assertTrue(sibling.isSameSource(revMap));
    }

    @Test
    public void testExtendLiveGlobal() {
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            RevMap revMap = StringCache.getInstance().currentRevMap();
            Assert.assertEquals(0, revMap.extendWith("literal"));
            Assert.assertEquals(0, StringCache.getInstance().currentRevMap().lookup("literal"));
        }
    }

    @Test
    public void testExtendFinishedGlobal() {
        RevMap revMap;
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalEncoder encoder = StringCache.getInstance().newEncoder();
            encoder.encode("x");
            revMap = encoder.getRevMap();
        }
        Assert.assertEquals(1, revMap.extendWith("y"));
        Assert.assertTrue(revMap.isGlobal());
        Assert.assertEquals(0, revMap.lookup("x"));
        Assert.assertEquals("y", revMap.decode(1));

        // the next generation does not see the literal
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            Assert.assertEquals(StringDictionary.NOT_FOUND, StringCache.getInstance().currentRevMap().lookup("y"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testLocalHasNoGeneration() {
        localOf().getGeneration();
    }
}
