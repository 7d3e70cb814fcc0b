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

package org.hyperprune.analysis;

import org.hyperprune.catalog.ComparisonStrategy;
import org.hyperprune.catalog.Type;

/**
 * An operator registered in an ordering family, with the strategy it implements and the
 * operand types it was registered for.
 */
public class OperatorFamilyMember {
    private final String family;
    private final ComparisonStrategy strategy;
    private final Type leftType;
    private final Type rightType;

    public OperatorFamilyMember(String family, ComparisonStrategy strategy, Type leftType, Type rightType) {
        this.family = family;
        this.strategy = strategy;
        this.leftType = leftType;
        this.rightType = rightType;
    }

    public String getFamily() {
        return family;
    }

    public ComparisonStrategy getStrategy() {
        return strategy;
    }

    public Type getLeftType() {
        return leftType;
    }

    public Type getRightType() {
        return rightType;
    }

    @Override
    public String toString() {
        return family + "(" + leftType + " " + strategy + " " + rightType + ")";
    }
}
