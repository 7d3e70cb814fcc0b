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

package org.hyperprune.planner;

import org.hyperprune.analysis.IntLiteral;
import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.analysis.StringLiteral;
import org.hyperprune.catalog.ComparisonStrategy;
import org.hyperprune.catalog.Dimension;
import org.hyperprune.catalog.DimensionSliceSet;
import org.hyperprune.catalog.Hypertable;
import org.hyperprune.catalog.HypertableCatalog;
import org.hyperprune.catalog.PrimitiveType;
import org.hyperprune.catalog.SliceScanner;
import org.hyperprune.catalog.Type;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.UserException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import mockit.Expectations;
import mockit.Mocked;
import mockit.Verifications;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.Random;

public class ClosedDimensionRestrictionTest {
    private Dimension device;
    private ClosedDimensionRestriction restriction;

    @Before
    public void setUp() {
        device = Dimension.createClosed(2, "device", PrimitiveType.VARCHAR, 4, FixedPartitioningFunction.DEVICES);
        restriction = new ClosedDimensionRestriction(device);
    }

    private static DimensionValues values(boolean useOr, String... devices) {
        List<LiteralExpr> literals = Lists.newArrayList();
        for (String d : devices) {
            literals.add(new StringLiteral(d));
        }
        return new DimensionValues(literals, useOr, Type.VARCHAR);
    }

    private boolean addEqual(boolean useOr, String... devices) throws AnalysisException {
        return restriction.add(ComparisonStrategy.EQUAL, values(useOr, devices));
    }

    @Test
    public void testOnlyEquality() throws AnalysisException {
        for (ComparisonStrategy strategy : ComparisonStrategy.values()) {
            if (strategy != ComparisonStrategy.EQUAL) {
                Assert.assertFalse(restriction.add(strategy, values(false, "a")));
            }
        }
        Assert.assertEquals(ClosedDimensionRestriction.State.UNSET, restriction.getState());
    }

    @Test
    public void testSamePartition() throws AnalysisException {
        // a and b both hash to partition 2
        Assert.assertTrue(addEqual(false, "a"));
        Assert.assertTrue(addEqual(false, "b"));
        Assert.assertEquals(ClosedDimensionRestriction.State.RESTRICTED, restriction.getState());
        Assert.assertEquals(ImmutableSortedSet.of(2), restriction.getPartitions());
    }

    @Test
    public void testContradiction() throws AnalysisException {
        addEqual(false, "a");
        Assert.assertTrue(addEqual(false, "c"));
        Assert.assertEquals(ClosedDimensionRestriction.State.EMPTY, restriction.getState());
        Assert.assertTrue(restriction.getPartitions().isEmpty());

        // nothing brings a contradiction back
        Assert.assertTrue(addEqual(true, "a", "c"));
        Assert.assertEquals(ClosedDimensionRestriction.State.EMPTY, restriction.getState());
    }

    @Test
    public void testAllOverSeveralPartitions() throws AnalysisException {
        Assert.assertTrue(addEqual(false, "a", "b"));
        Assert.assertEquals(ImmutableSortedSet.of(2), restriction.getPartitions());
        Assert.assertTrue(addEqual(false, "a", "d"));
        Assert.assertEquals(ClosedDimensionRestriction.State.EMPTY, restriction.getState());
    }

    @Test
    public void testInList() throws AnalysisException {
        Assert.assertTrue(addEqual(true, "a", "c"));
        Assert.assertEquals(ImmutableSortedSet.of(2, 3), restriction.getPartitions());
        Assert.assertTrue(addEqual(true, "c", "d", "e"));
        Assert.assertEquals(ImmutableSortedSet.of(3), restriction.getPartitions());
        Assert.assertTrue(addEqual(true, "d", "e"));
        Assert.assertEquals(ClosedDimensionRestriction.State.EMPTY, restriction.getState());
    }

    @Test
    public void testEmptyInList() throws AnalysisException {
        Assert.assertTrue(addEqual(true));
        Assert.assertEquals(ClosedDimensionRestriction.State.EMPTY, restriction.getState());
    }

    @Test
    public void testOrderDoesNotMatter() throws AnalysisException {
        List<DimensionValues> clauses = Lists.newArrayList(values(true, "a", "c", "d"), values(true, "b", "c"),
                values(false, "a"), values(true, "a", "b", "c", "d", "e"), values(false, "b", "a"));
        Random random = new Random(7);
        for (int round = 0; round < 20; round++) {
            Collections.shuffle(clauses, random);
            setUp();
            for (DimensionValues clause : clauses) {
                restriction.add(ComparisonStrategy.EQUAL, clause);
            }
            Assert.assertEquals(ClosedDimensionRestriction.State.RESTRICTED, restriction.getState());
            Assert.assertEquals(ImmutableSortedSet.of(2), restriction.getPartitions());
        }
    }

    @Test
    public void testGetSlices() throws UserException {
        HypertableCatalog catalog = new HypertableCatalog();
        Dimension registered = Dimension.createClosed(0, "device", PrimitiveType.VARCHAR, 4,
                FixedPartitioningFunction.DEVICES);
        Hypertable hypertable = catalog.createHypertable("devices", Lists.newArrayList(registered));
        for (String d : new String[] {"a", "c", "d"}) {
            catalog.getOrCreateChunk(hypertable.getId(), ImmutableMap.of("device", new StringLiteral(d)));
        }
        ClosedDimensionRestriction onCatalog = new ClosedDimensionRestriction(registered);
        Assert.assertEquals(3, onCatalog.getSlices(catalog).size());

        onCatalog.add(ComparisonStrategy.EQUAL, values(true, "a", "c", "e"));
        DimensionSliceSet slices = onCatalog.getSlices(catalog);
        Assert.assertEquals(2, slices.size());
        Assert.assertEquals(2, slices.getSlices().get(0).getRangeStart());
        Assert.assertEquals(3, slices.getSlices().get(1).getRangeStart());

        onCatalog.add(ComparisonStrategy.EQUAL, values(false, "e"));
        Assert.assertTrue(onCatalog.getSlices(catalog).isEmpty());
    }

    @Test
    public void testEmptyDoesNotScan(@Mocked SliceScanner scanner) throws UserException {
        addEqual(false, "a", "c");
        Assert.assertTrue(restriction.getSlices(scanner).isEmpty());
        new Verifications() {
            {
                scanner.scanRange(anyLong, (ComparisonStrategy) any, anyLong, (ComparisonStrategy) any, anyLong,
                        anyInt);
                times = 0;
                scanner.scanAll(anyLong, anyInt);
                times = 0;
            }
        };
    }

    @Test(expected = IllegalStateException.class)
    public void testUnknownDimensionType(@Mocked Dimension dimension) {
        new Expectations() {
            {
                dimension.getType();
                result = null;
            }
        };
        DimensionRestriction.create(dimension);
        Assert.fail("No exception throws");
    }

    @Test(expected = AnalysisException.class)
    public void testUnknownValue() throws AnalysisException {
        restriction.add(ComparisonStrategy.EQUAL, DimensionValues.of(new IntLiteral(1)));
    }
}
