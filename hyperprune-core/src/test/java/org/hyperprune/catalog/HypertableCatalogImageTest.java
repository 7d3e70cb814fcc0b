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
import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.analysis.StringLiteral;
import org.hyperprune.common.UserException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class HypertableCatalogImageTest {

    @Test
    public void testSaveAndLoad() throws IOException, UserException {
        HypertableCatalog catalog = new HypertableCatalog();
        Hypertable conditions = catalog.createHypertable("conditions", Lists.newArrayList(
                Dimension.createOpen(0, "ts", PrimitiveType.DATETIME, TimeUnit.DAYS.toMicros(1)),
                Dimension.createClosed(0, "location", PrimitiveType.VARCHAR, 4, 16)));
        List<Long> chunkIds = Lists.newArrayList();
        for (int day = 1; day <= 5; day++) {
            for (String location : new String[] {"office", "garage", "attic"}) {
                ImmutableMap<String, LiteralExpr> point = ImmutableMap.of(
                        "ts", new DateLiteral("2021-01-0" + day + " 12:00:00", Type.DATETIME),
                        "location", new StringLiteral(location));
                chunkIds.add(catalog.getOrCreateChunk(conditions.getId(), point).getId());
            }
        }

        StringWriter writer = new StringWriter();
        catalog.saveImage(writer);
        HypertableCatalog loaded = HypertableCatalog.loadImage(new StringReader(writer.toString()));

        Hypertable loadedConditions = loaded.getHypertable("conditions");
        Assert.assertEquals(conditions.getId(), loadedConditions.getId());
        Assert.assertEquals(conditions.getSpace().getDimensions(), loadedConditions.getSpace().getDimensions());
        Assert.assertEquals(catalog.getAllChunkIds(conditions.getId()), loaded.getAllChunkIds(conditions.getId()));

        // the same rows land in the same chunks, so partitioning and the indexes survived
        Dimension location = loadedConditions.getSpace().getDimensionByColumn("location");
        Assert.assertNotNull(location.getPartitioning());
        Assert.assertEquals(16, location.getPartitioning().getNumPartitions());
        int i = 0;
        for (int day = 1; day <= 5; day++) {
            for (String name : new String[] {"office", "garage", "attic"}) {
                ImmutableMap<String, LiteralExpr> point = ImmutableMap.of(
                        "ts", new DateLiteral("2021-01-0" + day + " 18:30:00", Type.DATETIME),
                        "location", new StringLiteral(name));
                Assert.assertEquals(chunkIds.get(i++).longValue(),
                        loaded.getOrCreateChunk(loadedConditions.getId(), point).getId());
            }
        }

        long ts = loadedConditions.getSpace().getDimensionByColumn("ts").getId();
        Assert.assertEquals(catalog.scanAll(ts, 0).getSliceIds(), loaded.scanAll(ts, 0).getSliceIds());
        Assert.assertEquals(catalog.getAllChunkIds(conditions.getId()), loaded.getAllChunkIds(conditions.getId()));

        // ids handed out after loading do not collide with loaded ones
        Hypertable other = loaded.createHypertable("other", Lists.newArrayList(
                Dimension.createOpen(0, "id", PrimitiveType.BIGINT, 10)));
        Assert.assertFalse(chunkIds.contains(other.getId()));
        Assert.assertNotEquals(conditions.getId(), other.getId());
    }

    @Test(expected = IOException.class)
    public void testLoadEmptyImage() throws IOException {
        HypertableCatalog.loadImage(new StringReader(""));
    }
}
