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

/**
 * Strategy of a comparison operator within a btree operator family. The numbers are the
 * classic btree strategy numbers.
 */
public enum ComparisonStrategy {
    LESS(1, "<"),
    LESS_EQUAL(2, "<="),
    EQUAL(3, "="),
    GREATER_EQUAL(4, ">="),
    GREATER(5, ">");

    private final int strategyNumber;
    private final String description;

    ComparisonStrategy(int strategyNumber, String description) {
        this.strategyNumber = strategyNumber;
        this.description = description;
    }

    public int getStrategyNumber() {
        return strategyNumber;
    }

    // "<" or "<="
    public boolean isUpperBound() {
        return this == LESS || this == LESS_EQUAL;
    }

    // ">" or ">="
    public boolean isLowerBound() {
        return this == GREATER || this == GREATER_EQUAL;
    }

    @Override
    public String toString() {
        return description;
    }
}
