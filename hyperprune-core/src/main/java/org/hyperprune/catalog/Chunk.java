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

import com.google.common.collect.ImmutableMap;
import com.google.gson.annotations.SerializedName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A physical partition of a hypertable, identified by exactly one slice per dimension.
 */
public class Chunk {
    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "hypertableId")
    private long hypertableId;
    @SerializedName(value = "name")
    private String name;
    // dimension id -> slice id
    @SerializedName(value = "constraints")
    private Map<Long, Long> dimensionToSlice;

    private Chunk() {
        // for persist
    }

    public Chunk(long id, long hypertableId, String name, Map<Long, Long> dimensionToSlice) {
        this.id = id;
        this.hypertableId = hypertableId;
        this.name = name;
        this.dimensionToSlice = new LinkedHashMap<>(dimensionToSlice);
    }

    public long getId() {
        return id;
    }

    public long getHypertableId() {
        return hypertableId;
    }

    public String getName() {
        return name;
    }

    // -1 if the chunk has no slice in the dimension
    public long getSliceId(long dimensionId) {
        Long sliceId = dimensionToSlice.get(dimensionId);
        return sliceId == null ? -1 : sliceId;
    }

    public Map<Long, Long> getDimensionToSlice() {
        return ImmutableMap.copyOf(dimensionToSlice);
    }

    @Override
    public String toString() {
        return name + dimensionToSlice;
    }
}
