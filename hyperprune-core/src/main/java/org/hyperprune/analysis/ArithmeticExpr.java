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

import org.hyperprune.catalog.Type;

import com.google.common.base.Preconditions;

import java.util.Objects;

public class ArithmeticExpr extends Expr {

    public enum Operator {
        MULTIPLY("*", "multiply"),
        DIVIDE("/", "divide"),
        MOD("%", "mod"),
        ADD("+", "add"),
        SUBTRACT("-", "subtract");

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
    }

    private final Operator op;

    public ArithmeticExpr(Operator op, Expr e1, Expr e2) {
        super();
        Preconditions.checkNotNull(e1);
        Preconditions.checkNotNull(e2);
        this.op = op;
        children.add(e1);
        children.add(e2);
        if (e1.getType().isIntegerType() && e2.getType().isIntegerType()) {
            this.type = Type.getAssignmentCompatibleIntegerType(e1.getType(), e2.getType());
        }
    }

    public Operator getOp() {
        return op;
    }

    @Override
    public String toSql() {
        return "(" + getChild(0).toSql() + " " + op + " " + getChild(1).toSql() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && ((ArithmeticExpr) obj).op == op;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), op);
    }
}
