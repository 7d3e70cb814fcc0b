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

import com.google.common.base.Preconditions;

import java.util.List;

/**
 * Class representing a [NOT] IN predicate. It determines if a specified value
 * (first child) matches any value in a list of values (remaining children).
 */
public class InPredicate extends Predicate {
    private final boolean isNotIn;

    // First child is the comparison expr for which we
    // should check membership in the inList (the remaining children).
    public InPredicate(Expr compareExpr, List<Expr> inList, boolean isNotIn) {
        super();
        Preconditions.checkNotNull(compareExpr);
        Preconditions.checkArgument(!inList.isEmpty(), "IN list can not be empty");
        children.add(compareExpr);
        children.addAll(inList);
        this.isNotIn = isNotIn;
    }

    public List<Expr> getListChildren() {
        return children.subList(1, children.size());
    }

    public int getInElementNum() {
        // the first child is compare expr
        return getChildCount() - 1;
    }

    public boolean isNotIn() {
        return isNotIn;
    }

    public boolean isLiteralChildren() {
        for (int i = 1; i < children.size(); ++i) {
            if (!(children.get(i) instanceof LiteralExpr)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toSql() {
        StringBuilder strBuilder = new StringBuilder();
        String notStr = isNotIn ? "NOT " : "";
        strBuilder.append("(").append(getChild(0).toSql()).append(" ").append(notStr).append("IN (");
        for (int i = 1; i < children.size(); ++i) {
            strBuilder.append(getChild(i).toSql());
            strBuilder.append((i + 1 != children.size()) ? ", " : "");
        }
        strBuilder.append("))");
        return strBuilder.toString();
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && ((InPredicate) obj).isNotIn == isNotIn;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Boolean.hashCode(isNotIn);
    }
}
