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

import org.hyperprune.catalog.ArrayType;
import org.hyperprune.catalog.PrimitiveType;
import org.hyperprune.catalog.Type;
import org.hyperprune.common.AnalysisException;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Objects;

public class CastExpr extends Expr {
    private final Type targetType;

    public CastExpr(Type targetType, Expr e) {
        super();
        Preconditions.checkArgument(targetType != null && !targetType.isInvalid());
        Preconditions.checkNotNull(e);
        this.targetType = targetType;
        this.type = targetType;
        children.add(e);
    }

    public Type getTargetType() {
        return targetType;
    }

    /**
     * A relabel changes the type of a value without changing the value or its ordering:
     * widening an integer, or switching between CHAR and VARCHAR.
     */
    public boolean isRelabel() {
        Type childType = getChild(0).getType();
        if (childType.equals(targetType)) {
            return true;
        }
        if (childType.isIntegerType() && targetType.isIntegerType()) {
            return childType.getPrimitiveType().getSlotSize() <= targetType.getPrimitiveType().getSlotSize();
        }
        return childType.isStringType() && targetType.isStringType();
    }

    /**
     * Converts a literal to the target type. Throws if the value can not be represented.
     */
    public static LiteralExpr castLiteral(LiteralExpr literal, Type targetType) throws AnalysisException {
        if (literal.isNullLiteral()) {
            return NullLiteral.create(targetType);
        }
        if (literal.getType().equals(targetType)) {
            return literal;
        }
        if (targetType.isArrayType()) {
            if (!(literal instanceof ArrayLiteral)) {
                throw new AnalysisException("can not cast " + literal.toSql() + " to " + targetType.toSql());
            }
            Type itemType = ((ArrayType) targetType).getItemType();
            List<LiteralExpr> elements = Lists.newArrayList();
            for (LiteralExpr element : ((ArrayLiteral) literal).getElements()) {
                elements.add(castLiteral(element, itemType));
            }
            return new ArrayLiteral(itemType, elements);
        }
        PrimitiveType target = targetType.getPrimitiveType();
        if (literal instanceof IntLiteral && targetType.isIntegerType()) {
            return new IntLiteral(literal.getLongValue(), targetType);
        }
        if (literal instanceof DateLiteral && targetType.isDateType()) {
            return new DateLiteral(literal.getLongValue(), targetType);
        }
        if (targetType.isStringType()) {
            LiteralExpr result = new StringLiteral(literal.getStringValue());
            result.setType(targetType);
            return result;
        }
        if (literal instanceof StringLiteral || target == PrimitiveType.BOOLEAN) {
            return LiteralExpr.create(literal.getStringValue(), targetType);
        }
        throw new AnalysisException("can not cast " + literal.toSql() + " to " + targetType.toSql());
    }

    @Override
    public String toSql() {
        return "CAST(" + getChild(0).toSql() + " AS " + targetType.toSql() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && ((CastExpr) obj).targetType.equals(targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), targetType);
    }
}
