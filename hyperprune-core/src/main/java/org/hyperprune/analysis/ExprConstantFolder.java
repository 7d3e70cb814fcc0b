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

import org.hyperprune.common.AnalysisException;

import com.google.common.collect.Lists;
import com.google.common.math.LongMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Folds literal casts, integer arithmetic, immutable builtin calls and array constructors
 * bottom-up. Column references and mutable calls are never folded, so the result of
 * folding an expression that depends on a row or on the current time is not a literal.
 */
public class ExprConstantFolder implements ConstantFolder {
    private static final Logger LOG = LogManager.getLogger(ExprConstantFolder.class);

    @Override
    public Expr fold(Expr expr) {
        if (expr instanceof LiteralExpr || expr instanceof SlotRef) {
            return expr;
        }
        List<Expr> children = Lists.newArrayList();
        boolean allLiteral = true;
        for (Expr child : expr.getChildren()) {
            Expr folded = fold(child);
            children.add(folded);
            allLiteral &= folded instanceof LiteralExpr;
        }
        if (!allLiteral) {
            return expr;
        }
        try {
            if (expr instanceof CastExpr) {
                return CastExpr.castLiteral((LiteralExpr) children.get(0), expr.getType());
            } else if (expr instanceof ArithmeticExpr) {
                return evalArithmetic((ArithmeticExpr) expr, (LiteralExpr) children.get(0),
                        (LiteralExpr) children.get(1));
            } else if (expr instanceof FunctionCallExpr) {
                return evalFunction((FunctionCallExpr) expr, children);
            } else if (expr instanceof ArrayExpr) {
                List<LiteralExpr> elements = Lists.newArrayList();
                for (Expr child : children) {
                    elements.add(CastExpr.castLiteral((LiteralExpr) child, ((ArrayExpr) expr).getItemType()));
                }
                return new ArrayLiteral(((ArrayExpr) expr).getItemType(), elements);
            }
        } catch (AnalysisException | ArithmeticException e) {
            LOG.debug("failed to fold {}", expr.toSql(), e);
        }
        return expr;
    }

    private static Expr evalArithmetic(ArithmeticExpr expr, LiteralExpr left, LiteralExpr right)
            throws AnalysisException {
        if (left.isNullLiteral() || right.isNullLiteral()) {
            return NullLiteral.create(expr.getType());
        }
        if (!(left instanceof IntLiteral) || !(right instanceof IntLiteral)) {
            return expr;
        }
        long l = left.getLongValue();
        long r = right.getLongValue();
        long result;
        switch (expr.getOp()) {
            case ADD:
                result = LongMath.checkedAdd(l, r);
                break;
            case SUBTRACT:
                result = LongMath.checkedSubtract(l, r);
                break;
            case MULTIPLY:
                result = LongMath.checkedMultiply(l, r);
                break;
            case DIVIDE:
                if (r == 0 || (l == Long.MIN_VALUE && r == -1)) {
                    return expr;
                }
                result = l / r;
                break;
            case MOD:
                if (r == 0) {
                    return expr;
                }
                result = l % r;
                break;
            default:
                return expr;
        }
        // throws when the result does not fit the result type
        return new IntLiteral(result, expr.getType());
    }

    private static Expr evalFunction(FunctionCallExpr expr, List<Expr> args) throws AnalysisException {
        if (expr.getVolatility() != Volatility.IMMUTABLE) {
            return expr;
        }
        BuiltinFunctions.Function fn = BuiltinFunctions.INSTANCE.getFunction(expr.getFnName());
        List<LiteralExpr> literals = Lists.newArrayList();
        for (Expr arg : args) {
            if (((LiteralExpr) arg).isNullLiteral()) {
                return NullLiteral.create(fn.getReturnType());
            }
            literals.add((LiteralExpr) arg);
        }
        return fn.evaluate(literals);
    }
}
