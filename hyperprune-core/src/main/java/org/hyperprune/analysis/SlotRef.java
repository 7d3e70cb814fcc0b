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

/**
 * Reference to a column of the hypertable being scanned.
 */
public class SlotRef extends Expr {
    private final String col;

    public SlotRef(String col, Type type) {
        super();
        Preconditions.checkNotNull(col);
        this.col = col;
        this.type = type;
    }

    public String getColumnName() {
        return col;
    }

    public boolean refersTo(String columnName) {
        return col.equalsIgnoreCase(columnName);
    }

    @Override
    public String toSql() {
        return "`" + col + "`";
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof SlotRef)) {
            return false;
        }
        return col.equalsIgnoreCase(((SlotRef) obj).col);
    }

    @Override
    public int hashCode() {
        return col.toLowerCase().hashCode();
    }
}
