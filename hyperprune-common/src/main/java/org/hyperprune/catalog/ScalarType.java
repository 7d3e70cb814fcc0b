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

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Describes a scalar type.
 */
public class ScalarType extends Type {
    private final PrimitiveType type;

    ScalarType(PrimitiveType type) {
        Preconditions.checkArgument(type != PrimitiveType.ARRAY, "array is not a scalar type");
        this.type = type;
    }

    public static ScalarType createType(PrimitiveType type) {
        Type t = Type.fromPrimitiveType(type);
        Preconditions.checkArgument(t instanceof ScalarType, "not a scalar type: %s", type);
        return (ScalarType) t;
    }

    @Override
    public PrimitiveType getPrimitiveType() {
        return type;
    }

    @Override
    public String toSql() {
        return type.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScalarType)) {
            return false;
        }
        return type == ((ScalarType) o).type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type);
    }
}
