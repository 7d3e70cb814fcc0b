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

import org.hyperprune.analysis.IntLiteral;
import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.analysis.StringLiteral;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.MetaNotFoundException;
import org.hyperprune.common.UserException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class HypertableCatalogTest {
    private HypertableCatalog catalog;
    private Hypertable metrics;
    private Dimension time;
    private Dimension device;

    @Before
    public void setUp() {
        catalog = new HypertableCatalog();
        time = Dimension.createOpen(0, "time", PrimitiveType.BIGINT, 100);
        device = Dimension.createClosed(0, "device", PrimitiveType.VARCHAR, 2, 4);
        metrics = catalog.createHypertable("metrics", Lists.newArrayList(time, device));
    }

    private Chunk insert(long t, String d) throws UserException {
        Map<String, LiteralExpr> point = ImmutableMap.of(
                "time", new IntLiteral(t, Type.BIGINT), "device", new StringLiteral(d));
        return catalog.getOrCreateChunk(metrics.getId(), point);
    }

    @Test
    public void testCreateHypertable() throws MetaNotFoundException {
        Assert.assertTrue(time.getId() > 0);
        Assert.assertNotEquals(time.getId(), device.getId());
        Assert.assertEquals(metrics.getId(), time.getHypertableId());
        Assert.assertEquals(2, metrics.getSpace().getNumDimensions());
        Assert.assertSame(metrics, catalog.getHypertable("METRICS"));
        Assert.assertSame(metrics, catalog.getHypertable(metrics.getId()));
        Assert.assertSame(device, metrics.getSpace().getDimensionByColumn("Device"));
        Assert.assertNull(metrics.getSpace().getDimensionByColumn("value"));

        try {
            catalog.getHypertable("nope");
            Assert.fail("unknown hypertable");
        } catch (MetaNotFoundException e) {
            Assert.assertTrue(e.getMessage().contains("nope"));
        }
        try {
            catalog.createHypertable("metrics", Lists.newArrayList(
                    Dimension.createOpen(0, "time", PrimitiveType.BIGINT, 10)));
            Assert.fail("duplicated hypertable name");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("already exists"));
        }
        try {
            catalog.createHypertable("twice", Lists.newArrayList(
                    Dimension.createOpen(0, "time", PrimitiveType.BIGINT, 10),
                    Dimension.createClosed(0, "TIME", PrimitiveType.BIGINT, 1, 2)));
            Assert.fail("duplicated dimension column");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("more than one dimension"));
        }
    }

    @Test
    public void testGetOrCreateChunk() throws UserException {
        Chunk c1 = insert(10, "a");
        Assert.assertSame(c1, insert(99, "a"));
        Chunk c2 = insert(100, "a");
        Assert.assertNotEquals(c1.getId(), c2.getId());

        DimensionSlice timeSlice = catalog.getSlice(c2.getSliceId(time.getId()));
        Assert.assertEquals(100, timeSlice.getRangeStart());
        Assert.assertEquals(200, timeSlice.getRangeEnd());
        Assert.assertEquals(c1.getSliceId(device.getId()), c2.getSliceId(device.getId()));

        Assert.assertEquals(Lists.newArrayList(c1.getId(), c2.getId()), catalog.getAllChunkIds(metrics.getId()));
        try {
            catalog.getOrCreateChunk(metrics.getId(), ImmutableMap.of("time", new IntLiteral(1)));
            Assert.fail("no value for device");
        } catch (AnalysisException e) {
            Assert.assertTrue(e.getMessage().contains("device"));
        }
    }

    @Test(expected = MetaNotFoundException.class)
    public void testAllChunksOfUnknownHypertable() throws MetaNotFoundException {
        catalog.getAllChunkIds(12345);
    }

    @Test
    public void testCreateChunk() throws UserException {
        DimensionSlice t0 = catalog.getOrCreateSlice(time.getId(), 0, 100);
        DimensionSlice d0 = catalog.getOrCreateSlice(device.getId(), 0, 2);
        Chunk chunk = catalog.createChunk(metrics.getId(), Lists.newArrayList(t0.getId(), d0.getId()));
        Assert.assertEquals(t0.getId(), chunk.getSliceId(time.getId()));
        Assert.assertEquals(d0.getId(), chunk.getSliceId(device.getId()));
        Assert.assertSame(chunk, catalog.createChunk(metrics.getId(), Lists.newArrayList(t0.getId(), d0.getId())));
        Assert.assertEquals(Lists.newArrayList(chunk.getId()), catalog.getAllChunkIds(metrics.getId()));

        // a row in the same slices lands in the registered chunk
        String member = null;
        for (char c = 'a'; c <= 'z' && member == null; c++) {
            if (device.getPartitioning().apply(new StringLiteral(String.valueOf(c))) < 2) {
                member = String.valueOf(c);
            }
        }
        Assert.assertNotNull(member);
        Assert.assertSame(chunk, insert(42, member));
    }

    @Test
    public void testCreateChunkWithInvalidSlices() throws MetaNotFoundException {
        DimensionSlice t0 = catalog.getOrCreateSlice(time.getId(), 0, 100);
        DimensionSlice d0 = catalog.getOrCreateSlice(device.getId(), 0, 2);
        try {
            catalog.createChunk(metrics.getId(), Lists.newArrayList(t0.getId()));
            Assert.fail("one slice for two dimensions");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("expect 2 slices, got 1"));
        }
        try {
            catalog.createChunk(metrics.getId(), Lists.newArrayList(t0.getId(), 12345L));
            Assert.fail("unknown slice");
        } catch (MetaNotFoundException e) {
            Assert.assertTrue(e.getMessage().contains("12345"));
        }
        try {
            catalog.createChunk(metrics.getId(), Lists.newArrayList(d0.getId(), t0.getId()));
            Assert.fail("slices in the wrong dimensions");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("does not belong to dimension"));
        }
        try {
            catalog.createChunk(12345, Lists.newArrayList(t0.getId(), d0.getId()));
            Assert.fail("unknown hypertable");
        } catch (MetaNotFoundException e) {
            Assert.assertTrue(e.getMessage().contains("12345"));
        }
        Assert.assertTrue(catalog.getAllChunkIds(metrics.getId()).isEmpty());
    }

    @Test
    public void testScanRange() throws MetaNotFoundException {
        long dimId = time.getId();
        DimensionSlice s0 = catalog.getOrCreateSlice(dimId, 0, 100);
        DimensionSlice s1 = catalog.getOrCreateSlice(dimId, 100, 200);
        DimensionSlice s2 = catalog.getOrCreateSlice(dimId, 200, 300);
        Assert.assertSame(s1, catalog.getOrCreateSlice(dimId, 100, 200));

        // [100, 200)
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS, 200, ComparisonStrategy.GREATER_EQUAL, 100, 0),
                s1);
        // [100, 200]
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS_EQUAL, 200,
                ComparisonStrategy.GREATER_EQUAL, 100, 0), s1, s2);
        // (99, 100)
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS, 100, ComparisonStrategy.GREATER, 99, 0));
        // (99, +inf)
        assertSlices(catalog.scanRange(dimId, null, 0, ComparisonStrategy.GREATER, 99, 0), s1, s2);
        // (-inf, 0]
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS_EQUAL, 0, null, 0, 0), s0);
        // (-inf, 0)
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS, 0, null, 0, 0));
        // [150, 150]
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS_EQUAL, 150,
                ComparisonStrategy.GREATER_EQUAL, 150, 0), s1);
        // < MIN_VALUE and > MAX_VALUE hold for nothing
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS, Long.MIN_VALUE, null, 0, 0));
        assertSlices(catalog.scanRange(dimId, null, 0, ComparisonStrategy.GREATER, Long.MAX_VALUE, 0));

        assertSlices(catalog.scanAll(dimId, 0), s0, s1, s2);
        Assert.assertEquals(2, catalog.scanAll(dimId, 2).size());

        try {
            catalog.scanAll(-1, 0);
            Assert.fail("unknown dimension");
        } catch (MetaNotFoundException e) {
            Assert.assertTrue(e.getMessage().contains("-1"));
        }
        try {
            catalog.scanRange(dimId, ComparisonStrategy.GREATER, 1, null, 0, 0);
            Assert.fail("lower bound strategy given as upper bound");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("invalid upper strategy"));
        }
    }

    @Test
    public void testScanAtTheEdgesOfTheRange() throws UserException {
        Chunk top = insert(Long.MAX_VALUE, "a");
        Chunk bottom = insert(Long.MIN_VALUE, "a");
        long dimId = time.getId();
        DimensionSlice topSlice = catalog.getSlice(top.getSliceId(dimId));
        DimensionSlice bottomSlice = catalog.getSlice(bottom.getSliceId(dimId));
        Assert.assertEquals(Long.MAX_VALUE, topSlice.getRangeEnd());
        Assert.assertEquals(Long.MIN_VALUE, bottomSlice.getRangeStart());

        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS_EQUAL, Long.MAX_VALUE,
                ComparisonStrategy.GREATER_EQUAL, Long.MAX_VALUE, 0), topSlice);
        assertSlices(catalog.scanRange(dimId, null, 0, ComparisonStrategy.GREATER, Long.MAX_VALUE - 1, 0), topSlice);
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS_EQUAL, Long.MIN_VALUE,
                ComparisonStrategy.GREATER_EQUAL, Long.MIN_VALUE, 0), bottomSlice);
        assertSlices(catalog.scanRange(dimId, ComparisonStrategy.LESS, Long.MIN_VALUE + 1, null, 0, 0), bottomSlice);
    }

    private static void assertSlices(DimensionSliceSet actual, DimensionSlice... expected) {
        Assert.assertEquals(Lists.newArrayList(expected), actual.getSlices());
    }

    @Test
    public void testFindChunkIds() throws UserException {
        Chunk c1 = insert(10, "a");
        Chunk c2 = insert(110, "a");
        Chunk c3 = insert(210, "a");
        Hyperspace space = metrics.getSpace();

        DimensionSliceSet timeSlices = catalog.scanRange(time.getId(),
                ComparisonStrategy.LESS, 200, null, 0, 0);
        DimensionSliceSet deviceSlices = catalog.scanAll(device.getId(), 0);
        Assert.assertEquals(Lists.newArrayList(c1.getId(), c2.getId()),
                catalog.findChunkIds(space, Lists.newArrayList(timeSlices, deviceSlices)));

        // a device slice no chunk uses
        DimensionSlice unused = catalog.getOrCreateSlice(device.getId(), 100, 200);
        DimensionSliceSet onlyUnused = new DimensionSliceSet(Lists.newArrayList(unused));
        Assert.assertTrue(catalog.findChunkIds(space, Lists.newArrayList(timeSlices, onlyUnused)).isEmpty());

        Assert.assertEquals(Lists.newArrayList(c1.getId(), c2.getId(), c3.getId()),
                catalog.findChunkIds(space, Lists.newArrayList(catalog.scanAll(time.getId(), 0), deviceSlices)));
        try {
            catalog.findChunkIds(space, Lists.newArrayList(timeSlices));
            Assert.fail("one slice set for two dimensions");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("expect 2 candidate slice sets"));
        }
    }

    @Test
    public void testConcurrentReadsAndWrites() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = Lists.newArrayList();
            for (int w = 0; w < 2; w++) {
                final int writer = w;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        insert(writer * 100_000L + i * 10L, "d" + (i % 7));
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 2; r++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        DimensionSliceSet timeSlices = catalog.scanAll(time.getId(), 0);
                        DimensionSliceSet deviceSlices = catalog.scanAll(device.getId(), 0);
                        List<Long> chunkIds = catalog.findChunkIds(metrics.getSpace(),
                                Lists.newArrayList(timeSlices, deviceSlices));
                        Assert.assertTrue(chunkIds.size() <= catalog.getAllChunkIds(metrics.getId()).size());
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(catalog.getAllChunkIds(metrics.getId()), catalog.findChunkIds(metrics.getSpace(),
                Lists.newArrayList(catalog.scanAll(time.getId(), 0), catalog.scanAll(device.getId(), 0))));
    }
}
