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
 * Abstract class describing a type of a column, a literal or an expression.
 */
public abstract class Type {
    public static final ScalarType INVALID = new ScalarType(PrimitiveType.INVALID_TYPE);
    public static final ScalarType NULL = new ScalarType(PrimitiveType.NULL_TYPE);
    public static final ScalarType BOOLEAN = new ScalarType(PrimitiveType.BOOLEAN);
    public static final ScalarType SMALLINT = new ScalarType(PrimitiveType.SMALLINT);
    public static final ScalarType INT = new ScalarType(PrimitiveType.INT);
    public static final ScalarType BIGINT = new ScalarType(PrimitiveType.BIGINT);
    public static final ScalarType DOUBLE = new ScalarType(PrimitiveType.DOUBLE);
    public static final ScalarType DATE = new ScalarType(PrimitiveType.DATE);
    public static final ScalarType DATETIME = new ScalarType(PrimitiveType.DATETIME);
    public static final ScalarType CHAR = new ScalarType(PrimitiveType.CHAR);
    public static final ScalarType VARCHAR = new ScalarType(PrimitiveType.VARCHAR);

    public abstract PrimitiveType getPrimitiveType();

    public abstract String toSql();

    public boolean isScalarType() {
        return this instanceof ScalarType;
    }

    public boolean isArrayType() {
        return this instanceof ArrayType;
    }

    public boolean isIntegerType() {
        return getPrimitiveType().isIntegerType();
    }

    public boolean isDateType() {
        return getPrimitiveType().isDateType();
    }

    public boolean isStringType() {
        return getPrimitiveType().isStringType();
    }

    public boolean isNull() {
        return getPrimitiveType().isNull();
    }

    public boolean isInvalid() {
        return getPrimitiveType() == PrimitiveType.INVALID_TYPE;
    }

    public static Type fromPrimitiveType(PrimitiveType type) {
        switch (type) {
            case NULL_TYPE:
                return NULL;
            case BOOLEAN:
                return BOOLEAN;
            case SMALLINT:
                return SMALLINT;
            case INT:
                return INT;
            case BIGINT:
                return BIGINT;
            case DOUBLE:
                return DOUBLE;
            case DATE:
                return DATE;
            case DATETIME:
                return DATETIME;
            case CHAR:
                return CHAR;
            case VARCHAR:
                return VARCHAR;
            default:
                return INVALID;
        }
    }

    /**
     * Returns the wider of two integer types, e.g. INT and BIGINT gives BIGINT.
     */
    public static Type getAssignmentCompatibleIntegerType(Type t1, Type t2) {
        return t1.getPrimitiveType().getSlotSize() >= t2.getPrimitiveType().getSlotSize() ? t1 : t2;
    }

    @Override
    public String toString() {
        return toSql();
    }
}
