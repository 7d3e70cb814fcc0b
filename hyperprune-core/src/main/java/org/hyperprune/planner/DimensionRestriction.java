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

import org.hyperprune.catalog.ComparisonStrategy;
import org.hyperprune.catalog.Dimension;
import org.hyperprune.catalog.DimensionSliceSet;
import org.hyperprune.catalog.DimensionType;
import org.hyperprune.catalog.SliceScanner;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.MetaNotFoundException;

import com.google.common.base.Preconditions;

/**
 * Restriction accumulated for one dimension while the clauses of a query are ingested.
 * Clauses are combined with AND, so each added clause can only narrow the restriction.
 */
public abstract class DimensionRestriction {
    protected final Dimension dimension;

    protected DimensionRestriction(Dimension dimension) {
        this.dimension = Preconditions.checkNotNull(dimension);
    }

    public static DimensionRestriction create(Dimension dimension) {
        DimensionType type = dimension.getType();
        if (type == null) {
            throw new IllegalStateException("unknown dimension type: null");
        }
        switch (type) {
            case OPEN:
                return new OpenDimensionRestriction(dimension);
            case CLOSED:
                return new ClosedDimensionRestriction(dimension);
            default:
                throw new IllegalStateException("unknown dimension type: " + type);
        }
    }

    public Dimension getDimension() {
        return dimension;
    }

    /**
     * Narrows the restriction by "column strategy values".
     *
     * @return true if the clause was taken into account
     */
    public abstract boolean add(ComparisonStrategy strategy, DimensionValues values) throws AnalysisException;

    /**
     * Returns the slices of the dimension that may hold rows satisfying the restriction.
     */
    public abstract DimensionSliceSet getSlices(SliceScanner scanner) throws MetaNotFoundException;
}
