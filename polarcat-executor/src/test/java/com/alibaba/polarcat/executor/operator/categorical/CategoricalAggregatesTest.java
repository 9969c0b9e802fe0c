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

import com.alibaba.polarcat.executor.categorical.StringCache;
import com.alibaba.polarcat.executor.chunk.CategoricalBlock;
import com.alibaba.polarcat.executor.chunk.StringBlock;
import com.alibaba.polarcat.executor.operator.categorical.CategoricalAggregates.ValueCount;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CategoricalAggregatesTest {

    @After
    public void tearDown() {
        StringCache.getInstance().teardown();
    }

    @Test
    public void testValueCountsWithNulls() {
        CategoricalBlock block = CategoricalCasts.castToCategorical(
            StringBlock.of("doctor", null, "waiter", null, "doctor", null));
        List<ValueCount> counts = CategoricalAggregates.valueCounts(block);
        Assert.assertEquals(Arrays.asList(new ValueCount(null, 3), new ValueCount("doctor", 2),
            new ValueCount("waiter", 1)), counts);
    }

    @Test
    public void testValueCountsTiesKeepFirstSeenOrder() {
        CategoricalBlock block = CategoricalCasts.castToCategorical(StringBlock.of("c", "a", "b", "a", "c", "b"));
        List<ValueCount> counts = CategoricalAggregates.valueCounts(block);
        Assert.assertEquals(Arrays.asList(new ValueCount("c", 2), new ValueCount("a", 2), new ValueCount("b", 2)),
            counts);
    }

    @Test
    public void testEmpty() {
        CategoricalBlock block = CategoricalCasts.castToCategorical(StringBlock.of());
        Assert.assertEquals(Collections.emptyList(), CategoricalAggregates.valueCounts(block));
        Assert.assertEquals(Collections.emptyList(), CategoricalAggregates.uniqueValues(block));
    }

    @Test
    public void testUniqueValuesSkipNulls() {
        CategoricalBlock block = CategoricalCasts.castToCategorical(StringBlock.of(null, "q", "p", "q", null));
        Assert.assertEquals(Arrays.asList("q", "p"), CategoricalAggregates.uniqueValues(block));
    }

    @Test
    public void testMinMaxAreNull() {
        CategoricalBlock block = CategoricalCasts.castToCategorical(StringBlock.of("c", "b", "a", "c"));
        Assert.assertNull(CategoricalAggregates.max(block));
        Assert.assertNull(CategoricalAggregates.min(block));
    }
}
