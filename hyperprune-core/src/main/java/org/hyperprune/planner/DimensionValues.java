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
import org.hyperprune.catalog.Type;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Literal values a clause compares a dimension column against.
 * useOr is true when the clause holds if any one value matches (IN, = ANY), false when
 * every value must match (a plain comparison or ALL).
 */
public class DimensionValues {
    private final ImmutableList<LiteralExpr> values;
    private final boolean useOr;
    // type of the values, the element type for arrays
    private final Type type;

    public DimensionValues(List<? extends LiteralExpr> values, boolean useOr, Type type) {
        this.values = ImmutableList.copyOf(values);
        this.useOr = useOr;
        this.type = type;
    }

    public static DimensionValues of(LiteralExpr value) {
        return new DimensionValues(ImmutableList.of(value), false, value.getType());
    }

    public List<LiteralExpr> getValues() {
        return values;
    }

    public boolean isUseOr() {
        return useOr;
    }

    public Type getType() {
        return type;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return (useOr ? "ANY" : "ALL") + values;
    }
}
