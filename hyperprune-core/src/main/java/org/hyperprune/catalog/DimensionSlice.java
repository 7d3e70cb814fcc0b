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
import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * A dimension's contribution to the identity of a chunk: the half-open range
 * [rangeStart, rangeEnd) of internal values (open dimension) or partition numbers
 * (closed dimension). A slice ending at {@link #MAX_VALUE} is unbounded above and
 * also holds MAX_VALUE itself.
 */
public class DimensionSlice {
    public static final long MIN_VALUE = Long.MIN_VALUE;
    public static final long MAX_VALUE = Long.MAX_VALUE;

    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "dimensionId")
    private long dimensionId;
    @SerializedName(value = "rangeStart")
    private long rangeStart;
    @SerializedName(value = "rangeEnd")
    private long rangeEnd;

    private DimensionSlice() {
        // for persist
    }

    public DimensionSlice(long id, long dimensionId, long rangeStart, long rangeEnd) {
        Preconditions.checkArgument(rangeStart < rangeEnd || rangeEnd == MAX_VALUE,
                "empty slice [%s, %s)", rangeStart, rangeEnd);
        this.id = id;
        this.dimensionId = dimensionId;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    public long getId() {
        return id;
    }

    public long getDimensionId() {
        return dimensionId;
    }

    public long getRangeStart() {
        return rangeStart;
    }

    public long getRangeEnd() {
        return rangeEnd;
    }

    public boolean isUnboundedAbove() {
        return rangeEnd == MAX_VALUE;
    }

    public boolean contains(long value) {
        return value >= rangeStart && (value < rangeEnd || isUnboundedAbove());
    }

    // overlap with the closed interval [lower, upper]
    public boolean overlaps(long lower, long upper) {
        return rangeStart <= upper && (rangeEnd > lower || isUnboundedAbove());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DimensionSlice)) {
            return false;
        }
        DimensionSlice that = (DimensionSlice) o;
        return id == that.id && dimensionId == that.dimensionId
                && rangeStart == that.rangeStart && rangeEnd == that.rangeEnd;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, dimensionId, rangeStart, rangeEnd);
    }

    @Override
    public String toString() {
        return "[" + rangeStart + ", " + rangeEnd + (isUnboundedAbove() ? "]#" : ")#") + id;
    }
}
