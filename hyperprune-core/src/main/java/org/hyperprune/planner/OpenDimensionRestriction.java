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
import org.hyperprune.catalog.TimeValues;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.MetaNotFoundException;

/**
 * A single interval of internal time values. A null strategy means the bound is unset.
 */
public class OpenDimensionRestriction extends DimensionRestriction {
    private ComparisonStrategy lowerStrategy = null;
    private long lowerBound;
    private ComparisonStrategy upperStrategy = null;
    private long upperBound;

    OpenDimensionRestriction(Dimension dimension) {
        super(dimension);
    }

    @Override
    public boolean add(ComparisonStrategy strategy, DimensionValues values) throws AnalysisException {
        // a disjunction of several values is not a single interval
        if (values.isUseOr() && values.size() > 1) {
            return false;
        }
        boolean added = false;
        for (LiteralExpr value : values.getValues()) {
            long internal = TimeValues.toInternal(value, values.getType());
            switch (strategy) {
                case LESS:
                case LESS_EQUAL:
                    if (upperStrategy == null || internal < upperBound) {
                        upperStrategy = strategy;
                        upperBound = internal;
                        added = true;
                    }
                    break;
                case GREATER:
                case GREATER_EQUAL:
                    if (lowerStrategy == null || internal > lowerBound) {
                        lowerStrategy = strategy;
                        lowerBound = internal;
                        added = true;
                    }
                    break;
                case EQUAL:
                    lowerStrategy = ComparisonStrategy.GREATER_EQUAL;
                    lowerBound = internal;
                    upperStrategy = ComparisonStrategy.LESS_EQUAL;
                    upperBound = internal;
                    added = true;
                    break;
                default:
                    break;
            }
        }
        return added;
    }

    @Override
    public DimensionSliceSet getSlices(SliceScanner scanner) throws MetaNotFoundException {
        return scanner.scanRange(dimension.getId(), upperStrategy, upperBound, lowerStrategy, lowerBound, 0);
    }

    public ComparisonStrategy getLowerStrategy() {
        return lowerStrategy;
    }

    public long getLowerBound() {
        return lowerBound;
    }

    public ComparisonStrategy getUpperStrategy() {
        return upperStrategy;
    }

    public long getUpperBound() {
        return upperBound;
    }

    public boolean hasLowerBound() {
        return lowerStrategy != null;
    }

    public boolean hasUpperBound() {
        return upperStrategy != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(dimension.getColumnName()).append(": ");
        sb.append(lowerStrategy == null ? "(-inf" : (lowerStrategy == ComparisonStrategy.GREATER ? "(" : "[")
                + lowerBound);
        sb.append(", ");
        sb.append(upperStrategy == null ? "+inf)" : upperBound
                + (upperStrategy == ComparisonStrategy.LESS ? ")" : "]"));
        return sb.toString();
    }
}
