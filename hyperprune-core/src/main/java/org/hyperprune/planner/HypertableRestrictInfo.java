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

import org.hyperprune.analysis.Expr;
import org.hyperprune.catalog.ChunkLocator;
import org.hyperprune.catalog.Dimension;
import org.hyperprune.catalog.DimensionSliceSet;
import org.hyperprune.catalog.Hyperspace;
import org.hyperprune.catalog.SliceScanner;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.MetaNotFoundException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.List;

/*
 * Restrictions of all dimensions of a hypertable, built once per query:
 *   create -> addRestrictions -> hasRestrictions -> getChunkIds
 * The restriction of dimension i is at index i, in the order of the hyperspace.
 */
public class HypertableRestrictInfo {
    private static final Logger LOG = LogManager.getLogger(HypertableRestrictInfo.class);

    private final Hyperspace space;
    private final ClauseClassifier classifier;
    private final List<DimensionRestriction> restrictions;
    // number of clauses that restricted some dimension
    private int numBaseRestrictions = 0;

    private HypertableRestrictInfo(Hyperspace space, ClauseClassifier classifier,
                                   List<DimensionRestriction> restrictions) {
        this.space = space;
        this.classifier = classifier;
        this.restrictions = restrictions;
    }

    public static HypertableRestrictInfo create(Hyperspace space, ClauseClassifier classifier) {
        Preconditions.checkNotNull(space);
        Preconditions.checkNotNull(classifier);
        List<DimensionRestriction> restrictions = Lists.newArrayListWithCapacity(space.getNumDimensions());
        for (Dimension dimension : space.getDimensions()) {
            restrictions.add(DimensionRestriction.create(dimension));
        }
        return new HypertableRestrictInfo(space, classifier, ImmutableList.copyOf(restrictions));
    }

    public void addRestrictions(List<? extends Expr> clauses) throws AnalysisException {
        for (Expr clause : clauses) {
            addRestriction(clause);
        }
    }

    /**
     * Feeds one clause to the restriction of the dimension it constrains.
     *
     * @return true if the clause restricted a dimension
     */
    public boolean addRestriction(Expr clause) throws AnalysisException {
        DimensionClause dimensionClause = classifier.classify(clause, space);
        if (dimensionClause == null) {
            return false;
        }
        DimensionRestriction restriction = getRestriction(dimensionClause.getDimension().getColumnName());
        if (restriction == null) {
            return false;
        }
        boolean added = restriction.add(dimensionClause.getStrategy(), dimensionClause.getValues());
        if (added) {
            numBaseRestrictions++;
        }
        return added;
    }

    public boolean hasRestrictions() {
        return numBaseRestrictions > 0;
    }

    public int getNumBaseRestrictions() {
        return numBaseRestrictions;
    }

    public DimensionRestriction getRestriction(String columnName) {
        for (DimensionRestriction restriction : restrictions) {
            if (restriction.getDimension().getColumnName().equalsIgnoreCase(columnName)) {
                return restriction;
            }
        }
        return null;
    }

    public List<DimensionRestriction> getRestrictions() {
        return restrictions;
    }

    /**
     * Returns the candidate slices of every dimension, or an empty list when some dimension
     * has no candidate. Dimensions after the first empty one are not scanned.
     */
    public List<DimensionSliceSet> getSliceSets(SliceScanner scanner) throws MetaNotFoundException {
        List<DimensionSliceSet> sliceSets = Lists.newArrayListWithCapacity(restrictions.size());
        for (DimensionRestriction restriction : restrictions) {
            DimensionSliceSet slices = restriction.getSlices(scanner);
            if (LOG.isDebugEnabled()) {
                LOG.debug("restriction {} matches slices {}", restriction, slices);
            }
            // no chunk can match if one dimension has no candidate slice
            if (slices.isEmpty()) {
                return Collections.emptyList();
            }
            sliceSets.add(slices);
        }
        Preconditions.checkState(sliceSets.size() == space.getNumDimensions());
        return sliceSets;
    }

    public List<Long> getChunkIds(SliceScanner scanner, ChunkLocator locator) throws MetaNotFoundException {
        List<DimensionSliceSet> sliceSets = getSliceSets(scanner);
        if (sliceSets.isEmpty()) {
            return Collections.emptyList();
        }
        return locator.findChunkIds(space, sliceSets);
    }

    @Override
    public String toString() {
        return "HypertableRestrictInfo{restrictions=" + restrictions
                + ", numBaseRestrictions=" + numBaseRestrictions + "}";
    }
}
