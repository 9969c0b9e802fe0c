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

package com.alibaba.polarcat.executor.chunk;

import com.alibaba.polarcat.executor.categorical.StringCache;
import com.alibaba.polarcat.executor.categorical.StringCacheScope;
import com.alibaba.polarcat.executor.exception.IncompatibleCategoricalSourcesException;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class CategoricalBlockTest {

    @After
    public void tearDown() {
        StringCache.getInstance().teardown();
    }

    private static CategoricalBlock build(String... values) {
        CategoricalBlockBuilder builder = new CategoricalBlockBuilder(values.length);
        for (String value : values) {
            builder.writeObject(value);
        }
        return builder.build().cast(CategoricalBlock.class);
    }

    @Test
    public void testBuildLocal() {
        CategoricalBlockBuilder builder = new CategoricalBlockBuilder(4);
        builder.writeString("b");
        builder.writeString("a");
        builder.appendNull();
        builder.writeString("b");
        Assert.assertTrue(builder.getRevMap().isLocal());
        Assert.assertEquals(4, builder.getPositionCount());
        Assert.assertEquals("a", builder.getObject(1));
        Assert.assertNull(builder.getObject(2));

        CategoricalBlock block = builder.build().cast(CategoricalBlock.class);
        Assert.assertEquals(0, block.getInt(0));
        Assert.assertEquals(1, block.getInt(1));
        Assert.assertEquals(0, block.getInt(3));
        Assert.assertTrue(block.isNull(2));
        Assert.assertEquals("b", block.getString(3));
        Assert.assertEquals(2, block.getRevMap().size());
    }

    @Test
    public void testEachLocalBuildIsItsOwnSource() {
        CategoricalBlock first = build("a");
        CategoricalBlock second = build("a");
        Assert.assertFalse(first.getRevMap().isSameSource(second.getRevMap()));
        // equality by value still holds across sources
        Assert.assertTrue(first.equals(0, second, 0));
    }

    @Test
    public void testBuildGlobal() {
        try (StringCacheScope scope = StringCache.enterCacheScope()) {
            CategoricalBlock first = build("x", "y");
            CategoricalBlock second = build("y", "z");
            Assert.assertTrue(first.getRevMap().isGlobal());
            Assert.assertTrue(first.getRevMap().isSameSource(second.getRevMap()));
            Assert.assertEquals(first.getInt(1), second.getInt(0));
            Assert.assertEquals(2, second.getInt(1));
            Assert.assertTrue(first.equals(1, second, 0));
        }
    }

    @Test
    public void testScopeEndingMidBuild() {
        StringCacheScope scope = StringCache.enterCacheScope();
        CategoricalBlockBuilder builder = new CategoricalBlockBuilder(2);
        builder.writeString("kept");
        scope.release();
        builder.writeString("kept");
        try {
            builder.writeString("new");
            Assert.fail("the global generation has finished");
        } catch (IncompatibleCategoricalSourcesException expected) {
            // no new string may enter a finished generation
        }
        CategoricalBlock block = builder.build().cast(CategoricalBlock.class);
        Assert.assertEquals(2, block.getPositionCount());
        Assert.assertEquals("kept", block.getString(1));
    }

    @Test
    public void testFilterSharesRevMap() {
        CategoricalBlock block = build("a", null, "b", "c");
        CategoricalBlock filtered = block.filter(BooleanBlock.of(true, true, null, true));
        Assert.assertEquals(3, filtered.getPositionCount());
        Assert.assertSame(block.getRevMap(), filtered.getRevMap());
        Assert.assertEquals("a", filtered.getString(0));
        Assert.assertTrue(filtered.isNull(1));
        Assert.assertEquals("c", filtered.getString(2));
    }

    @Test
    public void testCopyPositions() {
        CategoricalBlock block = build("a", "b");
        CategoricalBlock copy = block.copyPositions(new int[] {1, -1, 0, 1});
        Assert.assertSame(block.getRevMap(), copy.getRevMap());
        Assert.assertEquals("b", copy.getString(0));
        Assert.assertTrue(copy.isNull(1));
        Assert.assertEquals("a", copy.getString(2));
        Assert.assertEquals(copy.getInt(0), copy.getInt(3));
    }

    @Test
    public void testFromWithoutSelection() {
        CategoricalBlock block = build("a", "b", "c");
        CategoricalBlock prefix = CategoricalBlock.from(block, 2, null);
        Assert.assertEquals(2, prefix.getPositionCount());
        Assert.assertFalse(prefix.mayHaveNull());
        Assert.assertEquals("b", prefix.getString(1));
    }

    @Test
    public void testHashMatchesStringBlock() {
        CategoricalBlock block = build("foo", null);
        StringBlock strings = StringBlock.of("foo", null);
        Assert.assertEquals(strings.hashCodeUseXxhash(0), block.hashCodeUseXxhash(0));
        Assert.assertEquals(Block.NULL_HASH_CODE, block.hashCodeUseXxhash(1));
    }

    @Test
    public void testEqualValuesHashAlike() {
        CategoricalBlock block = build("hello", null);
        CategoricalBlock other = build("x", "hello");
        StringBlock strings = StringBlock.of("hello", null);

        Assert.assertTrue(block.equals(0, strings, 0));
        Assert.assertEquals(strings.hashCode(0), block.hashCode(0));
        Assert.assertTrue(block.equals(0, other, 1));
        Assert.assertEquals(other.hashCode(1), block.hashCode(0));
        Assert.assertTrue(block.equals(1, strings, 1));
        Assert.assertEquals(strings.hashCode(1), block.hashCode(1));
    }

    @Test
    public void testWritePositionToStringBuilder() {
        CategoricalBlock block = build("p", null);
        StringBlockBuilder builder = new StringBlockBuilder(2, 1);
        block.writePositionTo(0, builder);
        block.writePositionTo(1, builder);
        StringBlock strings = builder.build().cast(StringBlock.class);
        Assert.assertEquals("p", strings.getString(0));
        Assert.assertTrue(strings.isNull(1));
    }

    @Test(expected = ClassCastException.class)
    public void testCastToWrongBlock() {
        build("a").cast(StringBlock.class);
    }
}
