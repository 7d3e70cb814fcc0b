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

// A clause that restricts one dimension, as recognized by ClauseClassifier.
public class DimensionClause {
    private final Dimension dimension;
    private final ComparisonStrategy strategy;
    private final DimensionValues values;

    public DimensionClause(Dimension dimension, ComparisonStrategy strategy, DimensionValues values) {
        this.dimension = dimension;
        this.strategy = strategy;
        this.values = values;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public ComparisonStrategy getStrategy() {
        return strategy;
    }

    public DimensionValues getValues() {
        return values;
    }

    @Override
    public String toString() {
        return dimension.getColumnName() + " " + strategy + " " + values;
    }
}
