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

package org.hyperprune.analysis;

import org.hyperprune.catalog.Type;

public interface OperatorFamilyResolver {
    /**
     * Returns the ordering family member for "left op right", or null if the operator is not
     * a member of an ordering family for these types.
     */
    OperatorFamilyMember lookup(BinaryPredicate.Operator op, Type left, Type right);

    // A strict operator returns NULL for NULL input and never NULL otherwise.
    boolean isStrict(BinaryPredicate.Operator op);
}
