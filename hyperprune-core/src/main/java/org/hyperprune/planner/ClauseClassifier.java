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

import org.hyperprune.analysis.ArrayComparisonPredicate;
import org.hyperprune.analysis.ArrayLiteral;
import org.hyperprune.analysis.BinaryPredicate;
import org.hyperprune.analysis.CastExpr;
import org.hyperprune.analysis.ConstantFolder;
import org.hyperprune.analysis.Expr;
import org.hyperprune.analysis.InPredicate;
import org.hyperprune.analysis.LiteralExpr;
import org.hyperprune.analysis.OperatorFamilyMember;
import org.hyperprune.analysis.OperatorFamilyResolver;
import org.hyperprune.analysis.SlotRef;
import org.hyperprune.catalog.ArrayType;
import org.hyperprune.catalog.Dimension;
import org.hyperprune.catalog.Hyperspace;
import org.hyperprune.catalog.Type;
import org.hyperprune.common.AnalysisException;
import org.hyperprune.common.Config;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Decides whether a single predicate clause restricts a dimension of a hypertable.
 *
 * <p>Recognized shapes are "col op expr" / "expr op col" for a comparison operator of the
 * column's ordering family, and "col op ANY|ALL(array)" including [NOT] IN lists. Everything
 * else is skipped, which only widens the candidate chunk set.
 */
public class ClauseClassifier {
    private static final Logger LOG = LogManager.getLogger(ClauseClassifier.class);

    private final ConstantFolder folder;
    private final OperatorFamilyResolver families;

    public ClauseClassifier(ConstantFolder folder, OperatorFamilyResolver families) {
        this.folder = Preconditions.checkNotNull(folder);
        this.families = Preconditions.checkNotNull(families);
    }

    /**
     * Returns the dimension restriction described by the clause, or null if the clause
     * does not restrict any dimension of the space.
     */
    public DimensionClause classify(Expr clause, Hyperspace space) throws AnalysisException {
        if (clause.containsMutableFunctions()) {
            LOG.debug("skip clause {}: contains mutable functions", clause.toSql());
            return null;
        }
        DimensionClause result;
        if (clause instanceof BinaryPredicate) {
            BinaryPredicate predicate = (BinaryPredicate) clause;
            result = classifyComparison(predicate.getOp(), predicate.getChildren(), space, clause);
        } else if (clause instanceof ArrayComparisonPredicate) {
            ArrayComparisonPredicate predicate = (ArrayComparisonPredicate) clause;
            result = classifyArrayComparison(predicate.getOp(), predicate.isUseOr(),
                    predicate.getChildren(), space, clause);
        } else if (clause instanceof InPredicate) {
            result = classifyInList((InPredicate) clause, space);
        } else {
            LOG.debug("skip clause {}: unsupported shape", clause.toSql());
            result = null;
        }
        if (result != null && LOG.isDebugEnabled()) {
            LOG.debug("clause {} restricts dimension: {}", clause.toSql(), result);
        }
        return result;
    }

    private DimensionClause classifyComparison(BinaryPredicate.Operator op, List<Expr> args,
                                               Hyperspace space, Expr clause) throws AnalysisException {
        if (args.size() != 2) {
            return null;
        }
        Expr left = stripRelabel(args.get(0));
        Expr right = stripRelabel(args.get(1));
        SlotRef slot;
        Expr other;
        if (left instanceof SlotRef) {
            slot = (SlotRef) left;
            other = right;
        } else if (right instanceof SlotRef) {
            slot = (SlotRef) right;
            other = left;
            op = op.commutative();
        } else {
            return null;
        }
        Dimension dimension = space.getDimensionByColumn(slot.getColumnName());
        if (dimension == null) {
            return null;
        }
        Expr folded = folder.fold(other);
        if (!(folded instanceof LiteralExpr) || op == null || !families.isStrict(op)) {
            LOG.debug("skip clause {}: value is not a constant or operator is not strict", clause.toSql());
            return null;
        }
        LiteralExpr value = (LiteralExpr) folded;
        if (value.isNullLiteral() || value instanceof ArrayLiteral) {
            return null;
        }
        OperatorFamilyMember member = families.lookup(op, dimension.getColumnType(), value.getType());
        if (member == null) {
            LOG.debug("skip clause {}: {} is not an ordering operator for {} and {}",
                    clause.toSql(), op, dimension.getColumnType(), value.getType());
            return null;
        }
        return new DimensionClause(dimension, member.getStrategy(), DimensionValues.of(value));
    }

    private DimensionClause classifyArrayComparison(BinaryPredicate.Operator op, boolean useOr, List<Expr> args,
                                                    Hyperspace space, Expr clause) throws AnalysisException {
        if (args.size() != 2) {
            return null;
        }
        // the column has to be the scalar operand
        Expr left = stripRelabel(args.get(0));
        if (!(left instanceof SlotRef)) {
            return null;
        }
        Dimension dimension = space.getDimensionByColumn(((SlotRef) left).getColumnName());
        if (dimension == null) {
            return null;
        }
        Expr folded = folder.fold(args.get(1));
        if (!(folded instanceof ArrayLiteral) || !families.isStrict(op)) {
            LOG.debug("skip clause {}: array is not a constant or operator is not strict", clause.toSql());
            return null;
        }
        ArrayLiteral array = (ArrayLiteral) folded;
        return toDimensionClause(dimension, op, useOr, array.getElements(),
                ((ArrayType) array.getType()).getItemType(), clause);
    }

    // "col IN (...)" is "col = ANY(...)", "col NOT IN (...)" is "col != ALL(...)"
    private DimensionClause classifyInList(InPredicate predicate, Hyperspace space) throws AnalysisException {
        BinaryPredicate.Operator op = predicate.isNotIn() ? BinaryPredicate.Operator.NE : BinaryPredicate.Operator.EQ;
        Expr left = stripRelabel(predicate.getChild(0));
        if (!(left instanceof SlotRef)) {
            return null;
        }
        Dimension dimension = space.getDimensionByColumn(((SlotRef) left).getColumnName());
        if (dimension == null) {
            return null;
        }
        List<LiteralExpr> elements = Lists.newArrayList();
        Type itemType = null;
        for (Expr child : predicate.getListChildren()) {
            Expr folded = folder.fold(child);
            if (!(folded instanceof LiteralExpr) || folded instanceof ArrayLiteral) {
                LOG.debug("skip clause {}: IN list element {} is not a constant", predicate.toSql(), child.toSql());
                return null;
            }
            LiteralExpr element = (LiteralExpr) folded;
            if (!element.isNullLiteral()) {
                if (itemType == null) {
                    itemType = element.getType();
                } else if (families.lookup(BinaryPredicate.Operator.EQ, itemType, element.getType()) == null) {
                    LOG.debug("skip clause {}: IN list mixes {} and {}", predicate.toSql(),
                            itemType, element.getType());
                    return null;
                }
            }
            elements.add(element);
        }
        return toDimensionClause(dimension, op, !predicate.isNotIn(), elements,
                itemType == null ? dimension.getColumnType() : itemType, predicate);
    }

    private DimensionClause toDimensionClause(Dimension dimension, BinaryPredicate.Operator op, boolean useOr,
                                              List<LiteralExpr> elements, Type itemType, Expr clause) {
        // ALL over an empty array is true for every row
        if (!useOr && elements.isEmpty()) {
            LOG.debug("skip clause {}: ALL over an empty array", clause.toSql());
            return null;
        }
        OperatorFamilyMember member = families.lookup(op, dimension.getColumnType(), itemType);
        if (member == null) {
            LOG.debug("skip clause {}: {} is not an ordering operator for {} and {}",
                    clause.toSql(), op, dimension.getColumnType(), itemType);
            return null;
        }
        List<LiteralExpr> values = Lists.newArrayList();
        for (LiteralExpr element : elements) {
            if (!element.isNullLiteral()) {
                values.add(element);
            }
        }
        if (values.size() > Config.chunk_exclusion_max_array_elements) {
            LOG.debug("skip clause {}: {} array elements exceed the limit {}", clause.toSql(),
                    values.size(), Config.chunk_exclusion_max_array_elements);
            return null;
        }
        return new DimensionClause(dimension, member.getStrategy(), new DimensionValues(values, useOr, itemType));
    }

    // Looks through casts that keep the value and its ordering unchanged.
    private static Expr stripRelabel(Expr expr) {
        while (expr instanceof CastExpr && ((CastExpr) expr).isRelabel()) {
            expr = expr.getChild(0);
        }
        return expr;
    }
}
