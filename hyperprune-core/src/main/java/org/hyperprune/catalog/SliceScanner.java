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

import org.hyperprune.common.MetaNotFoundException;

/**
 * Lookup of the persisted slices of a dimension.
 */
public interface SliceScanner {
    /**
     * Returns the slices [start, end) of the dimension holding at least one value v with
     * "v upperStrategy upperBound" and "v lowerStrategy lowerBound". A null strategy leaves
     * that side unbounded and its bound is ignored. A limit of 0 means no limit.
     */
    DimensionSliceSet scanRange(long dimensionId,
                                ComparisonStrategy upperStrategy, long upperBound,
                                ComparisonStrategy lowerStrategy, long lowerBound,
                                int limit) throws MetaNotFoundException;

    DimensionSliceSet scanAll(long dimensionId, int limit) throws MetaNotFoundException;
}
