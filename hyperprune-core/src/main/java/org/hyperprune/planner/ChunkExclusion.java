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

package org.hyperprune.planner;

import org.hyperprune.analysis.BtreeOperatorFamilies;
import org.hyperprune.analysis.Expr;
import org.hyperprune.analysis.ExprConstantFolder;
import org.hyperprune.analysis.PredicateUtils;
import org.hyperprune.catalog.ChunkLocator;
import org.hyperprune.catalog.Hypertable;
import org.hyperprune.catalog.HypertableCatalog;
import org.hyperprune.catalog.SliceScanner;
import org.hyperprune.common.Config;
import org.hyperprune.common.UserException;

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Entry point for the query planner: the chunks of a hypertable that may hold rows
 * matching the conjuncts of a query's filter.
 */
public class ChunkExclusion {
    private static final Logger LOG = LogManager.getLogger(ChunkExclusion.class);

    private final ClauseClassifier classifier;
    private final SliceScanner scanner;
    private final ChunkLocator locator;

    public ChunkExclusion(HypertableCatalog catalog) {
        this(new ClauseClassifier(new ExprConstantFolder(), new BtreeOperatorFamilies()), catalog, catalog);
    }

    public ChunkExclusion(ClauseClassifier classifier, SliceScanner scanner, ChunkLocator locator) {
        this.classifier = Preconditions.checkNotNull(classifier);
        this.scanner = Preconditions.checkNotNull(scanner);
        this.locator = Preconditions.checkNotNull(locator);
    }

    public List<Long> getChunkIds(Hypertable hypertable, List<? extends Expr> conjuncts) throws UserException {
        if (!Config.enable_chunk_exclusion) {
            return locator.getAllChunkIds(hypertable.getId());
        }
        try {
            HypertableRestrictInfo restrictInfo = HypertableRestrictInfo.create(hypertable.getSpace(), classifier);
            restrictInfo.addRestrictions(PredicateUtils.splitConjuncts(conjuncts));
            if (!restrictInfo.hasRestrictions()) {
                LOG.debug("no dimension of {} is restricted, scan all chunks", hypertable);
                return locator.getAllChunkIds(hypertable.getId());
            }
            List<Long> chunkIds = restrictInfo.getChunkIds(scanner, locator);
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} selects chunks {} of {}", restrictInfo, chunkIds, hypertable);
            }
            return chunkIds;
        } catch (UserException e) {
            if (!Config.chunk_exclusion_fallback_to_full_scan) {
                throw e;
            }
            LOG.warn("chunk exclusion failed for {}, scan all chunks", hypertable, e);
            return locator.getAllChunkIds(hypertable.getId());
        }
    }
}
