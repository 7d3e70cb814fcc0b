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

public class IntLiteral extends LiteralExpr {
    public static final long SMALL_INT_MIN = Short.MIN_VALUE; // -2^15 ~ 2^15 - 1
    public static final long SMALL_INT_MAX = Short.MAX_VALUE;
    public static final long INT_MIN = Integer.MIN_VALUE; // -2^31 ~ 2^31 - 1
    public static final long INT_MAX = Integer.MAX_VALUE;

    private long value;

    public IntLiteral(long value) {
        super();
        this.value = value;
        this.type = (value >= INT_MIN && value <= INT_MAX) ? Type.INT : Type.BIGINT;
    }

    public IntLiteral(long longValue, Type type) throws AnalysisException {
        super();
        checkValueValid(longValue, type);
        this.value = longValue;
        this.type = type;
    }

    public IntLiteral(String value, Type type) throws AnalysisException {
        super();
        long longValue;
        try {
            longValue = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new AnalysisException("Invalid number format: " + value);
        }
        checkValueValid(longValue, type);
        this.value = longValue;
        this.type = type;
    }

    private static void checkValueValid(long longValue, Type type) throws AnalysisException {
        boolean valid;
        switch (type.getPrimitiveType()) {
            case SMALLINT:
                valid = longValue >= SMALL_INT_MIN && longValue <= SMALL_INT_MAX;
                break;
            case INT:
                valid = longValue >= INT_MIN && longValue <= INT_MAX;
                break;
            case BIGINT:
                valid = true;
                break;
            default:
                throw new AnalysisException("Invalid integer type: " + type);
        }
        if (!valid) {
            throw new AnalysisException("Number out of range[" + longValue + "]. type: " + type);
        }
    }

    public long getValue() {
        return value;
    }

    @Override
    public Object getRealValue() {
        return value;
    }

    @Override
    public long getLongValue() {
        return value;
    }

    @Override
    public int compareLiteral(LiteralExpr expr) {
        if (expr instanceof IntLiteral) {
            return Long.compare(value, expr.getLongValue());
        }
        return getClass().getName().compareTo(expr.getClass().getName());
    }

    @Override
    public String getStringValue() {
        return Long.toString(value);
    }

    @Override
    public String toSql() {
        return getStringValue();
    }
}
