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

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the expr node hierarchy.
 */
public abstract class Expr {
    protected Type type = Type.INVALID;

    protected final ArrayList<Expr> children = Lists.newArrayList();

    protected Expr() {
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public Expr getChild(int i) {
        return children.get(i);
    }

    public List<Expr> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public boolean isLiteral() {
        return this instanceof LiteralExpr;
    }

    /**
     * Returns true if this expr or any of its children calls a function which may return
     * different results for the same arguments, within one query (STABLE) or within one
     * scan (VOLATILE).
     */
    public boolean containsMutableFunctions() {
        if (this instanceof FunctionCallExpr
                && ((FunctionCallExpr) this).getVolatility() != Volatility.IMMUTABLE) {
            return true;
        }
        for (Expr child : children) {
            if (child.containsMutableFunctions()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if no column reference appears in this expr tree.
     */
    public boolean isConstant() {
        if (this instanceof SlotRef) {
            return false;
        }
        for (Expr child : children) {
            if (!child.isConstant()) {
                return false;
            }
        }
        return true;
    }

    public abstract String toSql();

    protected String childrenToSql() {
        List<String> childSqls = Lists.newArrayList();
        for (Expr child : children) {
            childSqls.add(child.toSql());
        }
        return Joiner.on(", ").join(childSqls);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        Expr expr = (Expr) obj;
        return children.equals(expr.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), children);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
