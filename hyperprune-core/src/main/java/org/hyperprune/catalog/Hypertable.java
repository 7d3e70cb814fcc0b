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

import com.google.gson.annotations.SerializedName;

/**
 * A logical table partitioned into chunks across one or more dimensions.
 */
public class Hypertable {
    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "name")
    private String name;
    @SerializedName(value = "space")
    private Hyperspace space;

    private Hypertable() {
        // for persist
    }

    public Hypertable(long id, String name, Hyperspace space) {
        this.id = id;
        this.name = name;
        this.space = space;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Hyperspace getSpace() {
        return space;
    }

    @Override
    public String toString() {
        return name + "(" + id + ")";
    }
}
