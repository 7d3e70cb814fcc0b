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

import org.hyperprune.analysis.DateLiteral;
import org.hyperprune.analysis.IntLiteral;
import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.common.AnalysisException;

/**
 * Conversion of column values to the internal int64 representation of open dimensions.
 * Integers map to themselves, DATE and DATETIME to microseconds since the unix epoch.
 */
public final class TimeValues {

    private TimeValues() {
    }

    public static boolean isTimeType(Type type) {
        return type.isIntegerType() || type.isDateType();
    }

    public static long toInternal(LiteralExpr value, Type type) throws AnalysisException {
        if (value.isNullLiteral()) {
            throw new AnalysisException("can not convert NULL to internal time");
        }
        if (type.isIntegerType() && value instanceof IntLiteral) {
            return ((IntLiteral) value).getValue();
        }
        if (type.isDateType() && value instanceof DateLiteral) {
            return ((DateLiteral) value).getMicrosSinceEpoch();
        }
        throw new AnalysisException("unsupported time type " + type.toSql() + " for value " + value.toSql());
    }
}
