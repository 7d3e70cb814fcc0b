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

import org.hyperprune.analysis.BoolLiteral;
import org.hyperprune.analysis.DateLiteral;
import org.hyperprune.analysis.IntLiteral;
import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.analysis.StringLiteral;
import org.hyperprune.common.AnalysisException;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Default partitioning of closed dimensions: murmur3 of the value, masked to a positive
 * int and taken modulo the number of partitions. Integers are hashed as 8 byte longs so
 * that SMALLINT, INT and BIGINT values which are equal land in the same partition.
 */
public class HashPartitioningFunction implements PartitioningFunction {
    private static final HashFunction HASH = Hashing.murmur3_32_fixed();

    private final int numPartitions;

    public HashPartitioningFunction(int numPartitions) {
        Preconditions.checkArgument(numPartitions > 0, "number of partitions must be positive: %s", numPartitions);
        this.numPartitions = numPartitions;
    }

    @Override
    public int apply(LiteralExpr value) throws AnalysisException {
        return (hash(value) & 0x7fffffff) % numPartitions;
    }

    @Override
    public int getNumPartitions() {
        return numPartitions;
    }

    private static int hash(LiteralExpr value) throws AnalysisException {
        Hasher hasher = HASH.newHasher();
        if (value instanceof IntLiteral) {
            hasher.putLong(((IntLiteral) value).getValue());
        } else if (value instanceof DateLiteral) {
            hasher.putLong(((DateLiteral) value).getMicrosSinceEpoch());
        } else if (value instanceof StringLiteral) {
            hasher.putString(((StringLiteral) value).getValue(), StandardCharsets.UTF_8);
        } else if (value instanceof BoolLiteral) {
            hasher.putBoolean(((BoolLiteral) value).getValue());
        } else {
            throw new AnalysisException("can not compute partition of value " + value.toSql());
        }
        return hasher.hash().asInt();
    }

    @Override
    public String toString() {
        return "murmur3 % " + numPartitions;
    }
}
