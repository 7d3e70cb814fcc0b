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

import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.catalog.ComparisonStrategy;
import org.hyperprune.catalog.Dimension;
import org.hyperprune.catalog.DimensionSliceSet;
import org.hyperprune.catalog.SliceScanner;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.MetaNotFoundException;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.Set;
import java.util.TreeSet;

/**
 * A set of candidate partitions of a hash dimension. Only equality carries information
 * about the partition a row lives in.
 */
public class ClosedDimensionRestriction extends DimensionRestriction {

    public enum State {
        // no clause seen, every partition is a candidate
        UNSET,
        RESTRICTED,
        // clauses contradict each other, no partition is a candidate
        EMPTY
    }

    private State state = State.UNSET;
    private final TreeSet<Integer> partitions = Sets.newTreeSet();

    ClosedDimensionRestriction(Dimension dimension) {
        super(dimension);
    }

    @Override
    public boolean add(ComparisonStrategy strategy, DimensionValues values) throws AnalysisException {
        if (strategy != ComparisonStrategy.EQUAL) {
            return false;
        }
        Set<Integer> newPartitions = Sets.newTreeSet();
        for (LiteralExpr value : values.getValues()) {
            newPartitions.add(dimension.getPartitioning().apply(value));
        }

        // a row lives in exactly one partition, so it can not equal values of several partitions
        if (newPartitions.size() > 1 && !values.isUseOr()) {
            setEmpty();
            return true;
        }
        switch (state) {
            case UNSET:
                partitions.addAll(newPartitions);
                break;
            case RESTRICTED:
                partitions.retainAll(newPartitions);
                break;
            case EMPTY:
            default:
                return true;
        }
        if (partitions.isEmpty()) {
            setEmpty();
        } else {
            state = State.RESTRICTED;
        }
        return true;
    }

    private void setEmpty() {
        state = State.EMPTY;
        partitions.clear();
    }

    @Override
    public DimensionSliceSet getSlices(SliceScanner scanner) throws MetaNotFoundException {
        switch (state) {
            case RESTRICTED:
                DimensionSliceSet result = new DimensionSliceSet();
                for (int partition : partitions) {
                    result.addAll(scanner.scanRange(dimension.getId(),
                            ComparisonStrategy.LESS_EQUAL, partition,
                            ComparisonStrategy.GREATER_EQUAL, partition, 0).getSlices());
                }
                return result;
            case EMPTY:
                return DimensionSliceSet.empty();
            case UNSET:
            default:
                return scanner.scanAll(dimension.getId(), 0);
        }
    }

    public State getState() {
        return state;
    }

    public Set<Integer> getPartitions() {
        return ImmutableSortedSet.copyOf(partitions);
    }

    @Override
    public String toString() {
        switch (state) {
            case RESTRICTED:
                return dimension.getColumnName() + ": partitions " + partitions;
            case EMPTY:
                return dimension.getColumnName() + ": no partition";
            default:
                return dimension.getColumnName() + ": all partitions";
        }
    }
}
