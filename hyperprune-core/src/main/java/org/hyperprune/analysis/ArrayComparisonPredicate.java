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

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * "expr op ANY(array)" or "expr op ALL(array)". The ANY form holds if the comparison holds
 * for at least one element, the ALL form if it holds for every element.
 */
public class ArrayComparisonPredicate extends Predicate {
    private final BinaryPredicate.Operator op;
    // true for ANY, false for ALL
    private final boolean useOr;

    public ArrayComparisonPredicate(BinaryPredicate.Operator op, boolean useOr, Expr compareExpr, Expr arrayExpr) {
        super();
        Preconditions.checkNotNull(compareExpr);
        Preconditions.checkNotNull(arrayExpr);
        this.op = op;
        this.useOr = useOr;
        children.add(compareExpr);
        children.add(arrayExpr);
    }

    public BinaryPredicate.Operator getOp() {
        return op;
    }

    public boolean isUseOr() {
        return useOr;
    }

    @Override
    public String toSql() {
        return "(" + getChild(0).toSql() + " " + op + " " + (useOr ? "ANY" : "ALL")
                + "(" + getChild(1).toSql() + "))";
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        ArrayComparisonPredicate other = (ArrayComparisonPredicate) obj;
        return other.op == op && other.useOr == useOr;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), op, useOr);
    }
}
