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
import org.hyperprune.catalog.Type;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * A constant array. Elements are literals of the item type or NULL.
 */
public class ArrayLiteral extends LiteralExpr {

    public ArrayLiteral(Type itemType, List<? extends LiteralExpr> elements) {
        super();
        Preconditions.checkNotNull(itemType);
        this.type = new ArrayType(itemType);
        children.addAll(elements);
    }

    public ArrayType getArrayType() {
        return (ArrayType) type;
    }

    public List<LiteralExpr> getElements() {
        List<LiteralExpr> elements = Lists.newArrayListWithCapacity(children.size());
        for (Expr child : children) {
            elements.add((LiteralExpr) child);
        }
        return elements;
    }

    @Override
    public Object getRealValue() {
        List<Object> values = Lists.newArrayList();
        for (Expr child : children) {
            values.add(((LiteralExpr) child).getRealValue());
        }
        return values;
    }

    @Override
    public int compareLiteral(LiteralExpr expr) {
        if (!(expr instanceof ArrayLiteral)) {
            return getClass().getName().compareTo(expr.getClass().getName());
        }
        int n = Math.min(children.size(), expr.getChildCount());
        for (int i = 0; i < n; i++) {
            int ret = ((LiteralExpr) getChild(i)).compareLiteral((LiteralExpr) expr.getChild(i));
            if (ret != 0) {
                return ret;
            }
        }
        return Integer.compare(children.size(), expr.getChildCount());
    }

    @Override
    public String getStringValue() {
        List<String> list = Lists.newArrayListWithCapacity(children.size());
        for (Expr child : children) {
            list.add(((LiteralExpr) child).getStringValue());
        }
        return "[" + String.join(", ", list) + "]";
    }

    @Override
    public String toSql() {
        return "ARRAY[" + childrenToSql() + "]";
    }
}
