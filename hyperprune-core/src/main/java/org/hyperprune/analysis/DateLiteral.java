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

import com.google.common.base.Preconditions;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.concurrent.TimeUnit;

/**
 * DATE and DATETIME literal. The value is kept as microseconds since 1970-01-01 00:00:00 UTC.
 */
public class DateLiteral extends LiteralExpr {
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATETIME_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.MICRO_OF_SECOND, 0, 6, true)
            .optionalEnd()
            .toFormatter();

    private final long micros;

    public DateLiteral(String s, Type type) throws AnalysisException {
        super();
        Preconditions.checkArgument(type.isDateType(), "not a date type: %s", type);
        this.type = type;
        this.micros = parse(s.trim(), type);
    }

    public DateLiteral(long micros, Type type) {
        super();
        Preconditions.checkArgument(type.isDateType(), "not a date type: %s", type);
        this.type = type;
        if (type.equals(Type.DATE)) {
            long microsPerDay = TimeUnit.DAYS.toMicros(1);
            this.micros = Math.floorDiv(micros, microsPerDay) * microsPerDay;
        } else {
            this.micros = micros;
        }
    }

    private static long parse(String s, Type type) throws AnalysisException {
        try {
            LocalDateTime dateTime;
            if (s.length() <= 10) {
                dateTime = LocalDate.parse(s, DATE_FORMATTER).atStartOfDay();
            } else if (type.equals(Type.DATE)) {
                dateTime = LocalDateTime.parse(s, DATETIME_FORMATTER).toLocalDate().atStartOfDay();
            } else {
                dateTime = LocalDateTime.parse(s, DATETIME_FORMATTER);
            }
            long seconds = dateTime.toEpochSecond(ZoneOffset.UTC);
            return Math.addExact(TimeUnit.SECONDS.toMicros(seconds), dateTime.getNano() / 1000L);
        } catch (DateTimeParseException | ArithmeticException e) {
            throw new AnalysisException("date literal [" + s + "] is invalid", e);
        }
    }

    public long getMicrosSinceEpoch() {
        return micros;
    }

    @Override
    public Object getRealValue() {
        return micros;
    }

    @Override
    public long getLongValue() {
        return micros;
    }

    @Override
    public int compareLiteral(LiteralExpr expr) {
        if (expr instanceof DateLiteral) {
            return Long.compare(micros, ((DateLiteral) expr).micros);
        }
        return getClass().getName().compareTo(expr.getClass().getName());
    }

    @Override
    public String getStringValue() {
        long seconds = Math.floorDiv(micros, 1000_000L);
        int nanos = (int) Math.floorMod(micros, 1000_000L) * 1000;
        LocalDateTime dateTime = LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC);
        if (type.equals(Type.DATE)) {
            return dateTime.format(DATE_FORMATTER);
        }
        return dateTime.format(DATETIME_FORMATTER);
    }

    @Override
    public String toSql() {
        return "'" + getStringValue() + "'";
    }
}
