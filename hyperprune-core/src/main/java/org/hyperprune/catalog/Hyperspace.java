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
import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * The ordered dimensions of one hypertable. The order is the canonical order in which
 * per-dimension restrictions and candidate slices are kept.
 */
public class Hyperspace {
    @SerializedName(value = "hypertableId")
    private long hypertableId;
    @SerializedName(value = "dimensions")
    private List<Dimension> dimensions;

    private Hyperspace() {
        // for persist
    }

    public Hyperspace(long hypertableId, List<Dimension> dimensions) {
        Preconditions.checkArgument(!dimensions.isEmpty(), "a hypertable needs at least one dimension");
        this.hypertableId = hypertableId;
        this.dimensions = ImmutableList.copyOf(dimensions);
    }

    public long getHypertableId() {
        return hypertableId;
    }

    public int getNumDimensions() {
        return dimensions.size();
    }

    public Dimension getDimension(int index) {
        return dimensions.get(index);
    }

    public List<Dimension> getDimensions() {
        return ImmutableList.copyOf(dimensions);
    }

    // null if the column is not a partitioning column
    public Dimension getDimensionByColumn(String columnName) {
        for (Dimension dimension : dimensions) {
            if (dimension.getColumnName().equalsIgnoreCase(columnName)) {
                return dimension;
            }
        }
        return null;
    }

    public Dimension getDimensionById(long dimensionId) {
        for (Dimension dimension : dimensions) {
            if (dimension.getId() == dimensionId) {
                return dimension;
            }
        }
        return null;
    }
}
