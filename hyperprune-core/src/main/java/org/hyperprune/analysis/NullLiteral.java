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

public class NullLiteral extends LiteralExpr {
    public NullLiteral() {
        type = Type.NULL;
    }

    public static NullLiteral create(Type type) {
        NullLiteral l = new NullLiteral();
        l.type = type;
        return l;
    }

    @Override
    public Object getRealValue() {
        return null;
    }

    @Override
    public boolean isNullLiteral() {
        return true;
    }

    // null sorts before everything
    @Override
    public int compareLiteral(LiteralExpr expr) {
        return expr instanceof NullLiteral ? 0 : -1;
    }

    @Override
    public String getStringValue() {
        return "NULL";
    }

    @Override
    public String toSql() {
        return getStringValue();
    }
}
