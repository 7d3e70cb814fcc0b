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
import org.hyperprune.catalog.PrimitiveType;
import org.hyperprune.catalog.Type;

import com.google.common.collect.ImmutableMap;

import java.util.EnumMap;
import java.util.Map;

public class BtreeOperatorFamilies implements OperatorFamilyResolver {
    private static final ImmutableMap<PrimitiveType, String> FAMILIES = ImmutableMap.<PrimitiveType, String>builder()
            .put(PrimitiveType.SMALLINT, "integer_ops")
            .put(PrimitiveType.INT, "integer_ops")
            .put(PrimitiveType.BIGINT, "integer_ops")
            .put(PrimitiveType.DATE, "datetime_ops")
            .put(PrimitiveType.DATETIME, "datetime_ops")
            .put(PrimitiveType.CHAR, "text_ops")
            .put(PrimitiveType.VARCHAR, "text_ops")
            .put(PrimitiveType.BOOLEAN, "bool_ops")
            .build();

    private static final Map<BinaryPredicate.Operator, ComparisonStrategy> STRATEGIES =
            new EnumMap<>(BinaryPredicate.Operator.class);

    static {
        STRATEGIES.put(BinaryPredicate.Operator.LT, ComparisonStrategy.LESS);
        STRATEGIES.put(BinaryPredicate.Operator.LE, ComparisonStrategy.LESS_EQUAL);
        STRATEGIES.put(BinaryPredicate.Operator.EQ, ComparisonStrategy.EQUAL);
        STRATEGIES.put(BinaryPredicate.Operator.EQ_FOR_NULL, ComparisonStrategy.EQUAL);
        STRATEGIES.put(BinaryPredicate.Operator.GE, ComparisonStrategy.GREATER_EQUAL);
        STRATEGIES.put(BinaryPredicate.Operator.GT, ComparisonStrategy.GREATER);
    }

    @Override
    public OperatorFamilyMember lookup(BinaryPredicate.Operator op, Type left, Type right) {
        if (left == null || right == null || !left.isScalarType() || !right.isScalarType()) {
            return null;
        }
        String family = FAMILIES.get(left.getPrimitiveType());
        if (family == null || !family.equals(FAMILIES.get(right.getPrimitiveType()))) {
            return null;
        }
        ComparisonStrategy strategy = STRATEGIES.get(op);
        if (strategy == null) {
            return null;
        }
        return new OperatorFamilyMember(family, strategy, left, right);
    }

    @Override
    public boolean isStrict(BinaryPredicate.Operator op) {
        return op != BinaryPredicate.Operator.EQ_FOR_NULL;
    }
}
