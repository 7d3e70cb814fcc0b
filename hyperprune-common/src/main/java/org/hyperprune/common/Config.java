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

package org.hyperprune.common;

public class Config extends ConfigBase {

    /**
     * Master switch of chunk exclusion. When disabled the planner scans every chunk
     * of a hypertable regardless of its filter.
     */
    @ConfField(mutable = true)
    public static boolean enable_chunk_exclusion = true;

    /**
     * If set to true, an error raised while computing the candidate chunks (for example by
     * a partitioning function or a slice lookup) is logged and the query falls back to
     * scanning all chunks. Otherwise the error aborts the planning of the query.
     */
    @ConfField(mutable = true)
    public static boolean chunk_exclusion_fallback_to_full_scan = false;

    /**
     * Membership clauses (IN lists, ANY/ALL arrays) with more non-null elements than this
     * are not used for exclusion.
     */
    @ConfField(mutable = true, description = "max elements of an IN list or array used for exclusion")
    public static int chunk_exclusion_max_array_elements = 10000;

    /**
     * Modulus of the default hash partitioning function, used by closed dimensions which
     * do not declare their own number of partitions.
     */
    @ConfField
    public static int default_closed_dimension_partitions = Integer.MAX_VALUE;
}
