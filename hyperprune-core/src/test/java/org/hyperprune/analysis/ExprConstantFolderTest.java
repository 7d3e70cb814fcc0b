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
import org.hyperprune.common.AnalysisException;

import com.google.common.collect.Lists;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;

public class ExprConstantFolderTest {
    private final ExprConstantFolder folder = new ExprConstantFolder();

    @Test
    public void testIntegerArithmetic() throws AnalysisException {
        Expr sum = new ArithmeticExpr(ArithmeticExpr.Operator.ADD, new IntLiteral(1), new IntLiteral(2));
        Assert.assertEquals(new IntLiteral(3), folder.fold(sum));

        Expr nested = new ArithmeticExpr(ArithmeticExpr.Operator.MULTIPLY, sum,
                new ArithmeticExpr(ArithmeticExpr.Operator.SUBTRACT, new IntLiteral(10), new IntLiteral(4)));
        Assert.assertEquals(new IntLiteral(18), folder.fold(nested));

        Expr mod = new ArithmeticExpr(ArithmeticExpr.Operator.MOD, new IntLiteral(-7), new IntLiteral(3));
        Assert.assertEquals(new IntLiteral(-1), folder.fold(mod));
    }

    @Test
    public void testUnfoldableArithmetic() throws AnalysisException {
        Expr divideByZero = new ArithmeticExpr(ArithmeticExpr.Operator.DIVIDE, new IntLiteral(1), new IntLiteral(0));
        Assert.assertSame(divideByZero, folder.fold(divideByZero));

        Expr overflow = new ArithmeticExpr(ArithmeticExpr.Operator.ADD,
                new IntLiteral(Long.MAX_VALUE, Type.BIGINT), new IntLiteral(1, Type.BIGINT));
        Assert.assertSame(overflow, folder.fold(overflow));

        // INT + INT does not fit into INT
        Expr intOverflow = new ArithmeticExpr(ArithmeticExpr.Operator.ADD,
                new IntLiteral(Integer.MAX_VALUE), new IntLiteral(1));
        Assert.assertSame(intOverflow, folder.fold(intOverflow));

        Expr withColumn = new ArithmeticExpr(ArithmeticExpr.Operator.ADD,
                new SlotRef("time", Type.BIGINT), new IntLiteral(1));
        Assert.assertSame(withColumn, folder.fold(withColumn));
    }

    @Test
    public void testCast() throws AnalysisException {
        Expr cast = new CastExpr(Type.DATE, new StringLiteral("2021-03-04"));
        Assert.assertEquals(new DateLiteral("2021-03-04", Type.DATE), folder.fold(cast));

        Expr badCast = new CastExpr(Type.INT, new StringLiteral("abc"));
        Assert.assertSame(badCast, folder.fold(badCast));
    }

    @Test
    public void testFunctions() throws AnalysisException {
        Expr daysAdd = new FunctionCallExpr("days_add", Lists.newArrayList(
                new DateLiteral("2021-12-31 12:00:00", Type.DATETIME), new IntLiteral(1)));
        Assert.assertEquals(new DateLiteral("2022-01-01 12:00:00", Type.DATETIME), folder.fold(daysAdd));

        Expr lower = new FunctionCallExpr("LOWER", Lists.newArrayList(new StringLiteral("Dev-1")));
        Assert.assertEquals(new StringLiteral("dev-1"), folder.fold(lower));

        Expr abs = new FunctionCallExpr("abs", Lists.newArrayList(new NullLiteral()));
        Assert.assertTrue(((LiteralExpr) folder.fold(abs)).isNullLiteral());

        // stable and volatile functions are never evaluated
        Expr now = new FunctionCallExpr("now", Collections.emptyList());
        Assert.assertSame(now, folder.fold(now));
        Expr random = new FunctionCallExpr("random", Collections.emptyList());
        Assert.assertSame(random, folder.fold(random));
        Expr unknown = new FunctionCallExpr("my_udf", Lists.newArrayList(new IntLiteral(1)));
        Assert.assertSame(unknown, folder.fold(unknown));
    }

    @Test
    public void testArray() throws AnalysisException {
        Expr array = new ArrayExpr(Type.BIGINT, Lists.newArrayList(
                new ArithmeticExpr(ArithmeticExpr.Operator.ADD, new IntLiteral(1), new IntLiteral(1)),
                new NullLiteral(),
                new IntLiteral(5)));
        Expr folded = folder.fold(array);
        Assert.assertTrue(folded instanceof ArrayLiteral);
        ArrayLiteral literal = (ArrayLiteral) folded;
        Assert.assertEquals(3, literal.getElements().size());
        Assert.assertEquals(2, literal.getElements().get(0).getLongValue());
        Assert.assertTrue(literal.getElements().get(1).isNullLiteral());

        Expr withColumn = new ArrayExpr(Type.BIGINT, Lists.newArrayList(
                new IntLiteral(1), new SlotRef("time", Type.BIGINT)));
        Assert.assertSame(withColumn, folder.fold(withColumn));
    }

    @Test
    public void testMutableFunctions() {
        Expr clause = new BinaryPredicate(BinaryPredicate.Operator.GT, new SlotRef("time", Type.DATETIME),
                new FunctionCallExpr("days_add", Lists.newArrayList(
                        new FunctionCallExpr("now", Collections.emptyList()), new IntLiteral(-1))));
        Assert.assertTrue(clause.containsMutableFunctions());
        Assert.assertFalse(clause.isConstant());
        Assert.assertFalse(new FunctionCallExpr("upper", Lists.newArrayList(new StringLiteral("a")))
                .containsMutableFunctions());
    }
}
