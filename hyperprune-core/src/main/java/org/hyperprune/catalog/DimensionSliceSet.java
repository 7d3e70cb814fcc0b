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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Slices of one dimension, unique by id and ordered by range start.
 */
public class DimensionSliceSet {
    private static final Comparator<DimensionSlice> ORDER =
            Comparator.comparingLong(DimensionSlice::getRangeStart).thenComparingLong(DimensionSlice::getId);

    private final TreeSet<DimensionSlice> slices = new TreeSet<>(ORDER);
    private final Map<Long, DimensionSlice> idToSlice = Maps.newHashMap();

    public DimensionSliceSet() {
    }

    public DimensionSliceSet(Collection<DimensionSlice> slices) {
        addAll(slices);
    }

    public static DimensionSliceSet empty() {
        return new DimensionSliceSet();
    }

    // returns false if a slice with the same id is already present
    public boolean addUnique(DimensionSlice slice) {
        if (idToSlice.containsKey(slice.getId())) {
            return false;
        }
        idToSlice.put(slice.getId(), slice);
        slices.add(slice);
        return true;
    }

    public void addAll(Iterable<DimensionSlice> toAdd) {
        for (DimensionSlice slice : toAdd) {
            addUnique(slice);
        }
    }

    public boolean containsSliceId(long sliceId) {
        return idToSlice.containsKey(sliceId);
    }

    public Set<Long> getSliceIds() {
        return ImmutableSet.copyOf(idToSlice.keySet());
    }

    public List<DimensionSlice> getSlices() {
        return ImmutableList.copyOf(slices);
    }

    public int size() {
        return slices.size();
    }

    public boolean isEmpty() {
        return slices.isEmpty();
    }

    @Override
    public String toString() {
        return slices.toString();
    }
}
