// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.hyperprune.catalog;

import org.hyperprune.analysis.DateLiteral;
import org.hyperprune.analysis.IntLiteral;
import org.hyperprune.analysis.NullLiteral;
import org.hyperprune.analysis.StringLiteral;
import org.hyperprune.common.AnalysisException;

import org.junit.Assert;
import org.junit.Test;

public class DimensionTest {

    @Test
    public void testOpenSliceRange() {
        Dimension time = Dimension.createOpen(1, "time", PrimitiveType.BIGINT, 100);
        Assert.assertArrayEquals(new long[] {0, 100}, time.calculateOpenSliceRange(0));
        Assert.assertArrayEquals(new long[] {100, 200}, time.calculateOpenSliceRange(199));
        Assert.assertArrayEquals(new long[] {-100, 0}, time.calculateOpenSliceRange(-1));
        Assert.assertArrayEquals(new long[] {-200, -100}, time.calculateOpenSliceRange(-101));

        long[] last = time.calculateOpenSliceRange(Long.MAX_VALUE - 1);
        Assert.assertEquals(Long.MAX_VALUE, last[1]);
        Assert.assertTrue(last[0] <= Long.MAX_VALUE - 1);
    }

    @Test
    public void testOpenSliceRangeAtTheEdges() {
        Dimension time = Dimension.createOpen(1, "time", PrimitiveType.BIGINT, 100);
        long[] first = time.calculateOpenSliceRange(Long.MIN_VALUE);
        Assert.assertEquals(Long.MIN_VALUE, first[0]);
        // the clamped first slice ends where the next one starts
        Assert.assertArrayEquals(new long[] {first[1], first[1] + 100}, time.calculateOpenSliceRange(first[1]));
        Assert.assertArrayEquals(first, time.calculateOpenSliceRange(first[1] - 1));

        long[] last = time.calculateOpenSliceRange(Long.MAX_VALUE);
        Assert.assertEquals(Long.MAX_VALUE, last[1]);
        Assert.assertArrayEquals(new long[] {last[0] - 100, last[0]}, time.calculateOpenSliceRange(last[0] - 1));
        DimensionSlice top = new DimensionSlice(3, 1, last[0], last[1]);
        Assert.assertTrue(top.contains(Long.MAX_VALUE));
        Assert.assertTrue(top.overlaps(Long.MAX_VALUE, Long.MAX_VALUE));
        Assert.assertFalse(top.contains(last[0] - 1));

        Dimension unit = Dimension.createOpen(2, "seq", PrimitiveType.BIGINT, 1);
        long[] max = unit.calculateOpenSliceRange(Long.MAX_VALUE);
        Assert.assertArrayEquals(new long[] {Long.MAX_VALUE, Long.MAX_VALUE}, max);
        Assert.assertTrue(new DimensionSlice(4, 2, max[0], max[1]).contains(Long.MAX_VALUE));
        Assert.assertArrayEquals(new long[] {Long.MAX_VALUE - 1, Long.MAX_VALUE},
                unit.calculateOpenSliceRange(Long.MAX_VALUE - 1));
    }

    @Test
    public void testBoundedSliceExcludesItsEnd() {
        DimensionSlice slice = new DimensionSlice(1, 1, 0, 100);
        Assert.assertTrue(slice.contains(99));
        Assert.assertFalse(slice.contains(100));
        Assert.assertFalse(slice.overlaps(100, 200));
        Assert.assertTrue(slice.overlaps(Long.MIN_VALUE, 0));
    }

    @Test
    public void testClosedSliceRange() {
        Dimension device = Dimension.createClosed(2, "device", PrimitiveType.VARCHAR, 3, 8);
        // 8 partitions in 3 slices: [0, 2), [2, 4), [4, 8)
        Assert.assertArrayEquals(new long[] {0, 2}, device.calculateClosedSliceRange(0));
        Assert.assertArrayEquals(new long[] {0, 2}, device.calculateClosedSliceRange(1));
        Assert.assertArrayEquals(new long[] {2, 4}, device.calculateClosedSliceRange(3));
        Assert.assertArrayEquals(new long[] {4, 8}, device.calculateClosedSliceRange(4));
        Assert.assertArrayEquals(new long[] {4, 8}, device.calculateClosedSliceRange(7));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClosedPartitionOutOfRange() {
        Dimension.createClosed(2, "device", PrimitiveType.VARCHAR, 3, 8).calculateClosedSliceRange(8);
    }

    @Test
    public void testInvalidDimensions() {
        try {
            Dimension.createOpen(1, "name", PrimitiveType.VARCHAR, 10);
            Assert.fail("open dimension on a string column");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("must be an integer or date type"));
        }
        try {
            Dimension.createOpen(1, "time", PrimitiveType.DATETIME, 0);
            Assert.fail("zero interval length");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("interval length must be positive"));
        }
        try {
            Dimension.createClosed(1, "device", PrimitiveType.INT, 5, 4);
            Assert.fail("more slices than partitions");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("number of slices"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedSliceRangeOfOpenDimension() {
        Dimension.createOpen(1, "time", PrimitiveType.INT, 10).calculateClosedSliceRange(0);
    }

    @Test
    public void testTimeValues() throws AnalysisException {
        Assert.assertEquals(42, TimeValues.toInternal(new IntLiteral(42), Type.INT));
        Assert.assertEquals(86_400_000_000L,
                TimeValues.toInternal(new DateLiteral("1970-01-02", Type.DATE), Type.DATE));
        Assert.assertEquals(1_000_000L,
                TimeValues.toInternal(new DateLiteral("1970-01-01 00:00:01", Type.DATETIME), Type.DATETIME));
    }

    @Test(expected = AnalysisException.class)
    public void testStringIsNotATimeValue() throws AnalysisException {
        TimeValues.toInternal(new StringLiteral("42"), Type.VARCHAR);
    }

    @Test(expected = AnalysisException.class)
    public void testIntegerIsNotADate() throws AnalysisException {
        TimeValues.toInternal(new IntLiteral(42), Type.DATE);
    }

    @Test(expected = AnalysisException.class)
    public void testNullIsNotATimeValue() throws AnalysisException {
        TimeValues.toInternal(NullLiteral.create(Type.INT), Type.INT);
    }
}
