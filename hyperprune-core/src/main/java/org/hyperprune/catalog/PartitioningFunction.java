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

import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.common.AnalysisException;

/**
 * Maps a value of a closed dimension's column to its partition number in
 * [0, getNumPartitions()). Implementations must be pure and deterministic.
 */
public interface PartitioningFunction {
    int apply(LiteralExpr value) throws AnalysisException;

    int getNumPartitions();
}
