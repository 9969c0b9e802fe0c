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

import com.alibaba.polarcat.common.exception.PolarCatRuntimeException;
import com.alibaba.polarcat.common.exception.code.ErrorCode;
import com.alibaba.polarcat.executor.categorical.StringCache;
import com.alibaba.polarcat.executor.categorical.StringCacheScope;
import com.alibaba.polarcat.executor.chunk.BooleanBlock;
import com.alibaba.polarcat.executor.chunk.CategoricalBlock;
import com.alibaba.polarcat.executor.chunk.StringBlock;
import com.alibaba.polarcat.executor.exception.IncompatibleCategoricalSourcesException;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class CategoricalComparisonsTest {

    @After
    public void tearDown() {
        StringCache.getInstance().teardown();
    }

    private static CategoricalBlock categorical(String... values) {
        return CategoricalCasts.castToCategorical(StringBlock.of(values));
    }

    private static void assertBooleans(BooleanBlock block, Boolean... expected) {
        Assert.assertEquals(expected.length, block.getPositionCount());
        for (int i = 0; i < expected.length; i++) {
            Assert.assertEquals("position " + i, expected[i], block.getObject(i));
        }
    }

    @Test
    public void testEqualInSameScope() {
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalBlock left = categorical("a", "b", null, "c");
            CategoricalBlock right = categorical("a", "c", "a", null);
            assertBooleans(CategoricalComparisons.equal(left, right), true, false, null, null);
            assertBooleans(CategoricalComparisons.notEqual(left, right), false, true, null, null);
        }
    }

    @Test
    public void testEqualSameLocalFamily() {
        CategoricalBlock block = categorical("a", "b", "a");
        CategoricalBlock derived = block.copyPositions(new int[] {2, 1, 1});
        assertBooleans(CategoricalComparisons.equal(block, derived), true, true, false);
    }

    @Test
    public void testCrossSourceComparisonFails() {
        CategoricalBlock left = categorical("a", "b");
        CategoricalBlock right = categorical("a", "b");
        try {
            CategoricalComparisons.equal(left, right);
            Assert.fail("independent local sources");
        } catch (IncompatibleCategoricalSourcesException e) {
            Assert.assertTrue(e.getMessage().contains("Cannot compare categoricals originating from different sources."));
            Assert.assertEquals(ErrorCode.ERR_INCOMPATIBLE_CATEGORICAL_SOURCES, e.getErrorCodeType());
        }

        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalBlock global = categorical("a", "b");
            try {
                CategoricalComparisons.equal(global, left);
                Assert.fail("global against local");
            } catch (IncompatibleCategoricalSourcesException expected) {
                // global against local
            }
        }
    }

    @Test
    public void testSeparateScopesFail() {
        CategoricalBlock first;
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            first = categorical("a");
        }
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalBlock second = categorical("a");
            try {
                CategoricalComparisons.notEqual(first, second);
                Assert.fail("different generations");
            } catch (IncompatibleCategoricalSourcesException expected) {
                // different generations
            }
        }
    }

    @Test
    public void testLengthMismatch() {
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            try {
                CategoricalComparisons.equal(categorical("a"), categorical("a", "b"));
                Assert.fail();
            } catch (PolarCatRuntimeException e) {
                Assert.assertEquals(ErrorCode.ERR_EXECUTOR, e.getErrorCodeType());
            }
        }
    }

    @Test
    public void testLiteralNeverFails() {
        CategoricalBlock local = categorical("a", null, "b");
        assertBooleans(CategoricalComparisons.equalLiteral(local, "a"), true, null, false);
        assertBooleans(CategoricalComparisons.equalLiteral(local, "zzz"), false, null, false);
        assertBooleans(CategoricalComparisons.notEqualLiteral(local, "zzz"), true, null, true);
        assertBooleans(CategoricalComparisons.equalLiteral(local, null), null, null, null);
        // looking up a literal does not grow the dictionary
        Assert.assertEquals(2, local.getRevMap().size());

        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalBlock global = categorical("b", "c");
            assertBooleans(CategoricalComparisons.equalLiteral(global, "c"), false, true);
            assertBooleans(CategoricalComparisons.notEqualLiteral(global, "never seen"), true, true);
            assertBooleans(CategoricalComparisons.equalLiteral(local, "b"), false, null, true);
        }
    }

    @Test
    public void testIsIn() {
        CategoricalBlock block = categorical("x", null, "y", "z");
        assertBooleans(CategoricalComparisons.isIn(block, Arrays.asList("y", "x", "w")), true, false, true, false);
        assertBooleans(CategoricalComparisons.isIn(block, Collections.emptyList()), false, false, false, false);
    }
}
