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

package com.alibaba.polarcat.executor.operator.categorical;

import com.alibaba.polarcat.executor.categorical.RevMap;
import com.alibaba.polarcat.executor.categorical.StringCache;
import com.alibaba.polarcat.executor.categorical.StringCacheScope;
import com.alibaba.polarcat.executor.categorical.StringDictionary;
import com.alibaba.polarcat.executor.chunk.BooleanBlock;
import com.alibaba.polarcat.executor.chunk.CategoricalBlock;
import com.alibaba.polarcat.executor.chunk.StringBlock;
import com.alibaba.polarcat.executor.exception.CategoricalCodeOutOfRangeException;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class CategoricalCastsTest {

    @After
    public void tearDown() {
        StringCache.getInstance().teardown();
    }

    @Test
    public void testRoundTripWithNulls() {
        StringBlock strings = StringBlock.of("a", null, "b", "a", null);
        CategoricalBlock categorical = CategoricalCasts.castToCategorical(strings);
        StringBlock decoded = CategoricalCasts.castToString(categorical);

        Assert.assertEquals(5, decoded.getPositionCount());
        for (int i = 0; i < strings.getPositionCount(); i++) {
            Assert.assertEquals(strings.getObject(i), decoded.getObject(i));
        }
        Assert.assertEquals(categorical.getInt(0), categorical.getInt(3));
        Assert.assertEquals(2, categorical.getRevMap().size());
    }

    @Test
    public void testRoundTripInScope() {
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            StringBlock strings = StringBlock.of("x", null, "y");
            CategoricalBlock categorical = CategoricalCasts.castToCategorical(strings);
            Assert.assertTrue(categorical.getRevMap().isGlobal());
            StringBlock decoded = CategoricalCasts.castToString(categorical);
            Assert.assertEquals("x", decoded.getString(0));
            Assert.assertTrue(decoded.isNull(1));
            Assert.assertEquals("y", decoded.getString(2));
        }
    }

    @Test
    public void testStableUnderGrowth() {
        String[] values = new String[1500];
        for (int i = 0; i < values.length; i++) {
            values[i] = String.valueOf(i);
        }
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalBlock categorical = CategoricalCasts.castToCategorical(StringBlock.of(values));
            StringBlock decoded = CategoricalCasts.castToString(categorical);
            for (int i = 0; i < values.length; i++) {
                Assert.assertEquals(values[i], decoded.getString(i));
            }

            BooleanBlock mask = CategoricalComparisons.isIn(categorical, Arrays.asList("1", "2"));
            CategoricalBlock filtered = categorical.filter(mask);
            Assert.assertEquals(2, filtered.getPositionCount());
            Assert.assertEquals("1", filtered.getString(0));
            Assert.assertEquals("2", filtered.getString(1));
        }
    }

    @Test
    public void testDecodeOutOfRange() {
        StringDictionary dictionary = new StringDictionary();
        dictionary.encode("only");
        CategoricalBlock block = new CategoricalBlock(RevMap.local(dictionary), 0, 2, null, new int[] {0, 3});
        try {
            CategoricalCasts.castToString(block);
            Assert.fail("code 3 is unknown");
        } catch (CategoricalCodeOutOfRangeException e) {
            Assert.assertEquals(3, e.getCategoricalCode());
        }
    }

    @Test
    public void testNullLiteralCast() {
        CategoricalBlock local = CategoricalCasts.nullCategorical(3);
        Assert.assertEquals(3, local.getPositionCount());
        Assert.assertTrue(local.getRevMap().isLocal());
        for (int i = 0; i < 3; i++) {
            Assert.assertTrue(local.isNull(i));
        }

        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalBlock global = CategoricalCasts.nullCategorical(2);
            CategoricalBlock values = CategoricalCasts.castToCategorical(StringBlock.of("a", "b"));
            Assert.assertTrue(global.getRevMap().isSameSource(values.getRevMap()));
            CategoricalBlock selected = CategoricalConditionals.ifThenElse(BooleanBlock.of(true, false), global, values);
            Assert.assertTrue(selected.isNull(0));
            Assert.assertEquals("b", selected.getString(1));
        }
    }
}
