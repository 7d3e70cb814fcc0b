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

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * Array constructor whose elements are arbitrary expressions, e.g. ARRAY[1 + 1, abs(-3)].
 * Folds to an {@link ArrayLiteral} once every element is a literal.
 */
public class ArrayExpr extends Expr {
    public ArrayExpr(Type itemType, List<Expr> elements) {
        super();
        this.type = new ArrayType(itemType);
        children.addAll(elements);
    }

    public Type getItemType() {
        return ((ArrayType) type).getItemType();
    }

    @Override
    public String toSql() {
        List<String> items = Lists.newArrayList();
        for (Expr child : children) {
            items.add(child.toSql());
        }
        return "ARRAY[" + Joiner.on(", ").join(items) + "]";
    }
}
