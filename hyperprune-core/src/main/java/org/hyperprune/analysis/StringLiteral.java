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

public class StringLiteral extends LiteralExpr {
    private final String value;

    public StringLiteral(String value) {
        super();
        Preconditions.checkNotNull(value);
        this.value = value;
        this.type = Type.VARCHAR;
    }

    public String getValue() {
        return value;
    }

    @Override
    public Object getRealValue() {
        return value;
    }

    @Override
    public int compareLiteral(LiteralExpr expr) {
        if (expr instanceof StringLiteral) {
            return value.compareTo(((StringLiteral) expr).value);
        }
        return getClass().getName().compareTo(expr.getClass().getName());
    }

    @Override
    public String getStringValue() {
        return value;
    }

    @Override
    public String toSql() {
        return "'" + value.replace("'", "''") + "'";
    }
}
