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
import org.hyperprune.common.AnalysisException;

import com.google.common.base.Preconditions;

public abstract class LiteralExpr extends Expr implements Comparable<LiteralExpr> {
    protected LiteralExpr() {
    }

    public static LiteralExpr create(String value, Type type) throws AnalysisException {
        Preconditions.checkArgument(!type.isInvalid());
        LiteralExpr literalExpr;
        switch (type.getPrimitiveType()) {
            case NULL_TYPE:
                literalExpr = new NullLiteral();
                break;
            case BOOLEAN:
                literalExpr = new BoolLiteral(value);
                break;
            case SMALLINT:
            case INT:
            case BIGINT:
                literalExpr = new IntLiteral(value, type);
                break;
            case CHAR:
            case VARCHAR:
                literalExpr = new StringLiteral(value);
                literalExpr.setType(type);
                break;
            case DATE:
            case DATETIME:
                literalExpr = new DateLiteral(value, type);
                break;
            default:
                throw new AnalysisException("Type[" + type.toSql() + "] not supported.");
        }
        return literalExpr;
    }

    /*
     * return real value
     */
    public abstract Object getRealValue();

    // Literals of different classes are ordered by class name, which only matters for
    // sorting mixed lists; pruning never compares literals of different families.
    public abstract int compareLiteral(LiteralExpr expr);

    @Override
    public int compareTo(LiteralExpr literalExpr) {
        return compareLiteral(literalExpr);
    }

    // Returns the string representation of the literal's value, without quoting.
    public abstract String getStringValue();

    public long getLongValue() {
        return 0;
    }

    public boolean isNullLiteral() {
        return false;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return compareLiteral((LiteralExpr) obj) == 0 && type.equals(((LiteralExpr) obj).type);
    }

    @Override
    public int hashCode() {
        return getStringValue().hashCode();
    }
}
