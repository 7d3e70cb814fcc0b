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

import org.hyperprune.common.Config;
import org.hyperprune.persist.gson.GsonPostProcessable;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * One partitioning axis of a hypertable. An open dimension slices its column's value range
 * into intervals of {@code intervalLength}; a closed dimension hashes the column's values
 * into {@code numPartitions} partitions which are grouped into {@code numSlices} slices.
 */
public class Dimension implements GsonPostProcessable {
    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "hypertableId")
    private long hypertableId;
    @SerializedName(value = "columnName")
    private String columnName;
    @SerializedName(value = "columnType")
    private PrimitiveType columnType;
    @SerializedName(value = "type")
    private DimensionType type;
    // open dimension only
    @SerializedName(value = "intervalLength")
    private long intervalLength;
    // closed dimension only
    @SerializedName(value = "numSlices")
    private int numSlices;
    @SerializedName(value = "numPartitions")
    private int numPartitions;

    private transient PartitioningFunction partitioning;

    private Dimension() {
        // for persist
    }

    private Dimension(long id, String columnName, PrimitiveType columnType, DimensionType type) {
        Preconditions.checkNotNull(columnName);
        Preconditions.checkNotNull(columnType);
        this.id = id;
        this.columnName = columnName;
        this.columnType = columnType;
        this.type = type;
    }

    public static Dimension createOpen(long id, String columnName, PrimitiveType columnType, long intervalLength) {
        Preconditions.checkArgument(TimeValues.isTimeType(Type.fromPrimitiveType(columnType)),
                "open dimension column %s must be an integer or date type, got %s", columnName, columnType);
        Preconditions.checkArgument(intervalLength > 0, "interval length must be positive: %s", intervalLength);
        Dimension dimension = new Dimension(id, columnName, columnType, DimensionType.OPEN);
        dimension.intervalLength = intervalLength;
        return dimension;
    }

    public static Dimension createClosed(long id, String columnName, PrimitiveType columnType,
                                         int numSlices, int numPartitions) {
        return createClosed(id, columnName, columnType, numSlices, new HashPartitioningFunction(numPartitions));
    }

    public static Dimension createClosed(long id, String columnName, PrimitiveType columnType,
                                         int numSlices, PartitioningFunction partitioning) {
        Preconditions.checkNotNull(partitioning);
        Preconditions.checkArgument(numSlices > 0 && numSlices <= partitioning.getNumPartitions(),
                "number of slices must be in [1, %s]: %s", partitioning.getNumPartitions(), numSlices);
        Dimension dimension = new Dimension(id, columnName, columnType, DimensionType.CLOSED);
        dimension.numSlices = numSlices;
        dimension.numPartitions = partitioning.getNumPartitions();
        dimension.partitioning = partitioning;
        return dimension;
    }

    public long getId() {
        return id;
    }

    public long getHypertableId() {
        return hypertableId;
    }

    // assigned when the dimension is registered in a catalog
    void setIds(long id, long hypertableId) {
        this.id = id;
        this.hypertableId = hypertableId;
    }

    public String getColumnName() {
        return columnName;
    }

    public Type getColumnType() {
        return Type.fromPrimitiveType(columnType);
    }

    public DimensionType getType() {
        return type;
    }

    public boolean isOpen() {
        return type == DimensionType.OPEN;
    }

    public long getIntervalLength() {
        return intervalLength;
    }

    public int getNumSlices() {
        return numSlices;
    }

    public int getNumPartitions() {
        return numPartitions;
    }

    public PartitioningFunction getPartitioning() {
        return partitioning;
    }

    /**
     * Returns [start, end) of the open-dimension slice holding the given internal value.
     * The first and last slices are clamped to the value range, the last one ending at
     * {@link DimensionSlice#MAX_VALUE} which it also holds.
     */
    public long[] calculateOpenSliceRange(long value) {
        Preconditions.checkState(type == DimensionType.OPEN);
        long index = Math.floorDiv(value, intervalLength);
        long start = LongMath.saturatedMultiply(index, intervalLength);
        long end = LongMath.saturatedMultiply(LongMath.saturatedAdd(index, 1), intervalLength);
        return new long[] {start, end};
    }

    /**
     * Returns [start, end) of the closed-dimension slice holding the given partition number.
     * The last slice absorbs the remainder of the partition space.
     */
    public long[] calculateClosedSliceRange(int partition) {
        Preconditions.checkState(type == DimensionType.CLOSED);
        Preconditions.checkArgument(partition >= 0 && partition < numPartitions,
                "partition %s out of range [0, %s)", partition, numPartitions);
        long interval = numPartitions / numSlices;
        long index = Math.min(partition / interval, numSlices - 1);
        long start = index * interval;
        long end = index == numSlices - 1 ? numPartitions : start + interval;
        return new long[] {start, end};
    }

    @Override
    public void gsonPostProcess() {
        if (type == DimensionType.CLOSED && partitioning == null) {
            int partitions = numPartitions > 0 ? numPartitions : Config.default_closed_dimension_partitions;
            numPartitions = partitions;
            partitioning = new HashPartitioningFunction(partitions);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dimension)) {
            return false;
        }
        Dimension other = (Dimension) o;
        return id == other.id && hypertableId == other.hypertableId
                && columnName.equalsIgnoreCase(other.columnName) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, hypertableId, columnName.toLowerCase(), type);
    }

    @Override
    public String toString() {
        return "Dimension{id=" + id + ", column=" + columnName + ", type=" + type
                + (type == DimensionType.OPEN ? ", interval=" + intervalLength
                : ", slices=" + numSlices + ", partitioning=" + partitioning) + "}";
    }
}
