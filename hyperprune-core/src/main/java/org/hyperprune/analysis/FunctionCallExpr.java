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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Objects;

public class FunctionCallExpr extends Expr {
    private final String fnName;

    public FunctionCallExpr(String fnName, List<Expr> args) {
        super();
        Preconditions.checkNotNull(fnName);
        this.fnName = fnName.toLowerCase();
        children.addAll(args);
        BuiltinFunctions.Function fn = BuiltinFunctions.INSTANCE.getFunction(this.fnName);
        if (fn != null) {
            this.type = fn.getReturnType();
        }
    }

    public String getFnName() {
        return fnName;
    }

    // Unknown functions are treated as volatile.
    public Volatility getVolatility() {
        BuiltinFunctions.Function fn = BuiltinFunctions.INSTANCE.getFunction(fnName);
        return fn == null ? Volatility.VOLATILE : fn.getVolatility();
    }

    @Override
    public String toSql() {
        List<String> args = Lists.newArrayList();
        for (Expr child : children) {
            args.add(child.toSql());
        }
        return fnName + "(" + Joiner.on(", ").join(args) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && ((FunctionCallExpr) obj).fnName.equals(fnName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), fnName);
    }
}
