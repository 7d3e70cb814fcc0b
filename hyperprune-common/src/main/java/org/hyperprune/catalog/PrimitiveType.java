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

import com.google.common.collect.ImmutableSet;

public enum PrimitiveType {
    INVALID_TYPE("INVALID_TYPE", -1),
    // NULL_TYPE - used only in NullLiteral to make NULLs compatible with all other types.
    NULL_TYPE("NULL_TYPE", 1),
    BOOLEAN("BOOLEAN", 1),
    SMALLINT("SMALLINT", 2),
    INT("INT", 4),
    BIGINT("BIGINT", 8),
    DOUBLE("DOUBLE", 8),
    DATE("DATE", 16),
    DATETIME("DATETIME", 16),
    // Fixed length char array.
    CHAR("CHAR", 16),
    VARCHAR("VARCHAR", 16),
    ARRAY("ARRAY", 32);

    private static final ImmutableSet<PrimitiveType> INTEGER_TYPES =
            ImmutableSet.of(SMALLINT, INT, BIGINT);
    private static final ImmutableSet<PrimitiveType> DATE_TYPES =
            ImmutableSet.of(DATE, DATETIME);
    private static final ImmutableSet<PrimitiveType> STRING_TYPES =
            ImmutableSet.of(CHAR, VARCHAR);

    private final String description;
    private final int slotSize;

    PrimitiveType(String description, int slotSize) {
        this.description = description;
        this.slotSize = slotSize;
    }

    public int getSlotSize() {
        return slotSize;
    }

    public boolean isIntegerType() {
        return INTEGER_TYPES.contains(this);
    }

    public boolean isDateType() {
        return DATE_TYPES.contains(this);
    }

    public boolean isStringType() {
        return STRING_TYPES.contains(this);
    }

    public boolean isNull() {
        return this == NULL_TYPE;
    }

    @Override
    public String toString() {
        return description;
    }
}
