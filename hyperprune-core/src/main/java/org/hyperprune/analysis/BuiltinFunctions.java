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

import com.google.common.collect.ImmutableMap;
import com.google.common.math.LongMath;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Registry of the scalar functions the planner knows about, with their volatility and,
 * for the ones that may be folded, an evaluator over literal arguments.
 */
public enum BuiltinFunctions {
    INSTANCE;

    private static final long MICROS_PER_DAY = 86_400_000_000L;
    private static final long MICROS_PER_SECOND = 1_000_000L;

    public interface Evaluator {
        LiteralExpr evaluate(List<LiteralExpr> args) throws AnalysisException;
    }

    public static class Function {
        private final String name;
        private final Type returnType;
        private final Volatility volatility;
        private final int numArgs;
        private final Evaluator evaluator;

        public Function(String name, Type returnType, Volatility volatility, int numArgs, Evaluator evaluator) {
            this.name = name;
            this.returnType = returnType;
            this.volatility = volatility;
            this.numArgs = numArgs;
            this.evaluator = evaluator;
        }

        public String getName() {
            return name;
        }

        public Type getReturnType() {
            return returnType;
        }

        public Volatility getVolatility() {
            return volatility;
        }

        // -1 for variadic
        public int getNumArgs() {
            return numArgs;
        }

        public LiteralExpr evaluate(List<LiteralExpr> args) throws AnalysisException {
            if (numArgs >= 0 && args.size() != numArgs) {
                throw new AnalysisException(name + " expects " + numArgs + " arguments, got " + args.size());
            }
            return evaluator.evaluate(args);
        }
    }

    private final ImmutableMap<String, Function> functions;

    BuiltinFunctions() {
        ImmutableMap.Builder<String, Function> builder = ImmutableMap.builder();
        register(builder, new Function("now", Type.DATETIME, Volatility.STABLE, 0,
                args -> new DateLiteral(currentMicros(), Type.DATETIME)));
        register(builder, new Function("current_date", Type.DATE, Volatility.STABLE, 0,
                args -> new DateLiteral(currentMicros(), Type.DATE)));
        register(builder, new Function("random", Type.BIGINT, Volatility.VOLATILE, 0,
                args -> new IntLiteral(ThreadLocalRandom.current().nextLong(), Type.BIGINT)));
        register(builder, new Function("abs", Type.BIGINT, Volatility.IMMUTABLE, 1,
                args -> {
                    long value = intArg(args, 0);
                    if (value == Long.MIN_VALUE) {
                        throw new AnalysisException("bigint out of range: abs(" + value + ")");
                    }
                    return new IntLiteral(Math.abs(value), Type.BIGINT);
                }));
        register(builder, new Function("lower", Type.VARCHAR, Volatility.IMMUTABLE, 1,
                args -> new StringLiteral(stringArg(args, 0).toLowerCase())));
        register(builder, new Function("upper", Type.VARCHAR, Volatility.IMMUTABLE, 1,
                args -> new StringLiteral(stringArg(args, 0).toUpperCase())));
        register(builder, new Function("concat", Type.VARCHAR, Volatility.IMMUTABLE, -1,
                args -> {
                    StringBuilder sb = new StringBuilder();
                    for (int i = 0; i < args.size(); i++) {
                        sb.append(stringArg(args, i));
                    }
                    return new StringLiteral(sb.toString());
                }));
        register(builder, new Function("days_add", Type.DATETIME, Volatility.IMMUTABLE, 2,
                args -> addMicros(dateArg(args, 0), intArg(args, 1), MICROS_PER_DAY)));
        register(builder, new Function("seconds_add", Type.DATETIME, Volatility.IMMUTABLE, 2,
                args -> addMicros(dateArg(args, 0), intArg(args, 1), MICROS_PER_SECOND)));
        register(builder, new Function("date", Type.DATE, Volatility.IMMUTABLE, 1,
                args -> {
                    LiteralExpr arg = args.get(0);
                    if (arg instanceof DateLiteral) {
                        return new DateLiteral(arg.getLongValue(), Type.DATE);
                    }
                    return new DateLiteral(stringArg(args, 0), Type.DATE);
                }));
        functions = builder.build();
    }

    private static void register(ImmutableMap.Builder<String, Function> builder, Function fn) {
        builder.put(fn.getName(), fn);
    }

    public Function getFunction(String name) {
        return functions.get(name.toLowerCase());
    }

    private static long currentMicros() {
        Instant now = Instant.now();
        return TimeUnit.SECONDS.toMicros(now.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(now.getNano());
    }

    private static long intArg(List<LiteralExpr> args, int i) throws AnalysisException {
        LiteralExpr arg = args.get(i);
        if (!(arg instanceof IntLiteral)) {
            throw new AnalysisException("argument " + i + " is not an integer: " + arg.toSql());
        }
        return arg.getLongValue();
    }

    private static String stringArg(List<LiteralExpr> args, int i) throws AnalysisException {
        LiteralExpr arg = args.get(i);
        if (!(arg instanceof StringLiteral)) {
            throw new AnalysisException("argument " + i + " is not a string: " + arg.toSql());
        }
        return arg.getStringValue();
    }

    private static DateLiteral dateArg(List<LiteralExpr> args, int i) throws AnalysisException {
        LiteralExpr arg = args.get(i);
        if (arg instanceof DateLiteral) {
            return (DateLiteral) arg;
        }
        if (arg instanceof StringLiteral) {
            return new DateLiteral(arg.getStringValue(), Type.DATETIME);
        }
        throw new AnalysisException("argument " + i + " is not a date: " + arg.toSql());
    }

    private static DateLiteral addMicros(DateLiteral date, long amount, long unit) throws AnalysisException {
        long result;
        try {
            result = LongMath.checkedAdd(date.getMicrosSinceEpoch(), LongMath.checkedMultiply(amount, unit));
        } catch (ArithmeticException e) {
            throw new AnalysisException("datetime out of range", e);
        }
        LocalDate day = LocalDate.ofEpochDay(Math.floorDiv(result, MICROS_PER_DAY));
        if (day.getYear() < 0 || day.getYear() > 9999) {
            throw new AnalysisException("datetime out of range: " + day);
        }
        return new DateLiteral(result, Type.DATETIME);
    }
}
