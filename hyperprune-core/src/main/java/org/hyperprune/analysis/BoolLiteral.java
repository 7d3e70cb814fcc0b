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

public class BoolLiteral extends LiteralExpr {
    private final boolean value;

    public BoolLiteral(boolean value) {
        this.value = value;
        this.type = Type.BOOLEAN;
    }

    public BoolLiteral(String value) throws AnalysisException {
        this.type = Type.BOOLEAN;
        if (value.trim().equalsIgnoreCase("true") || value.trim().equals("1")) {
            this.value = true;
        } else if (value.trim().equalsIgnoreCase("false") || value.trim().equals("0")) {
            this.value = false;
        } else {
            throw new AnalysisException("Invalid BOOLEAN literal: " + value);
        }
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public Object getRealValue() {
        return value;
    }

    @Override
    public long getLongValue() {
        return value ? 1 : 0;
    }

    @Override
    public int compareLiteral(LiteralExpr expr) {
        if (expr instanceof BoolLiteral) {
            return Boolean.compare(value, ((BoolLiteral) expr).value);
        }
        return getClass().getName().compareTo(expr.getClass().getName());
    }

    @Override
    public String getStringValue() {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public String toSql() {
        return getStringValue();
    }
}
