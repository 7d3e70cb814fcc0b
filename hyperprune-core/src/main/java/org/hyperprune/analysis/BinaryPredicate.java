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
 * Most predicates with two operands.
 */
public class BinaryPredicate extends Predicate {

    public enum Operator {
        EQ("=", "eq"),
        NE("!=", "ne"),
        LE("<=", "le"),
        GE(">=", "ge"),
        LT("<", "lt"),
        GT(">", "gt"),
        EQ_FOR_NULL("<=>", "eq_for_null");

        private final String description;
        private final String name;

        Operator(String description, String name) {
            this.description = description;
            this.name = name;
        }

        @Override
        public String toString() {
            return description;
        }

        public String getName() {
            return name;
        }

        /**
         * Returns the operator to use when the operands are swapped, i.e. "a op b" is the
         * same as "b op.commutative() a".
         */
        public Operator commutative() {
            switch (this) {
                case EQ:
                case NE:
                case EQ_FOR_NULL:
                    return this;
                case LE:
                    return GE;
                case GE:
                    return LE;
                case LT:
                    return GT;
                case GT:
                    return LT;
                default:
                    return null;
            }
        }
    }

    private final Operator op;

    public BinaryPredicate(Operator op, Expr e1, Expr e2) {
        super();
        this.op = op;
        Preconditions.checkNotNull(e1);
        children.add(e1);
        Preconditions.checkNotNull(e2);
        children.add(e2);
    }

    public Operator getOp() {
        return op;
    }

    @Override
    public String toSql() {
        return "(" + getChild(0).toSql() + " " + op.toString() + " " + getChild(1).toSql() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        return ((BinaryPredicate) obj).op == this.op;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(op);
    }
}
