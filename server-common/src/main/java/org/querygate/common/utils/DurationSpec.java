/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.querygate.common.utils;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;

import static java.util.concurrent.TimeUnit.DAYS;
import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A non-negative duration read from {@code querygate.yaml}. Values are written as a quantity followed by a
 * unit symbol, for example {@code 5m} for the role cache expiry or {@code 24h} for the query cache TTL.
 * Subclasses fix the finest unit they accept.
 */
public abstract class DurationSpec implements Comparable<DurationSpec>
{
    private static final Pattern UNITS_PATTERN = Pattern.compile("^(\\d+)(d|h|s|ms|m)$");

    private final long quantity;
    private final TimeUnit unit;

    /**
     * Parses {@code value} into a duration.
     *
     * @param value the value to parse, e.g. {@code 30s}
     * @throws IllegalArgumentException when the value does not match the accepted format, uses a unit finer than
     *                                  {@link #minimumUnit()}, or overflows
     */
    protected DurationSpec(String value) throws IllegalArgumentException
    {
        Matcher matcher = UNITS_PATTERN.matcher(value == null ? "" : value.trim());
        if (!matcher.find())
        {
            throw iae(value);
        }
        this.quantity = Long.parseLong(matcher.group(1));
        this.unit = fromSymbol(matcher.group(2));

        validateMinUnit(value, unit, minimumUnit());
        validateQuantity(value, quantity, unit, minimumUnit());
    }

    protected DurationSpec(long quantity, TimeUnit unit) throws IllegalArgumentException
    {
        this.quantity = quantity;
        this.unit = unit;

        validateMinUnit(this, unit, minimumUnit());
        validateQuantity(this, quantity, unit, minimumUnit());
    }

    /**
     * @return the finest unit this type accepts
     */
    public abstract TimeUnit minimumUnit();

    public long quantity()
    {
        return quantity;
    }

    public TimeUnit unit()
    {
        return unit;
    }

    /**
     * Converts this duration to {@code targetUnit}, saturating on overflow as {@link TimeUnit#convert} does.
     *
     * @param targetUnit the unit to convert to
     * @return the converted quantity
     */
    public long to(TimeUnit targetUnit)
    {
        return targetUnit.convert(quantity, unit);
    }

    public long toSeconds()
    {
        return to(SECONDS);
    }

    public long toMillis()
    {
        return to(MILLISECONDS);
    }

    /**
     * @return this value as a {@link Duration}, for use with {@code java.time} based APIs
     */
    public Duration toDuration()
    {
        return Duration.ofMillis(toMillis());
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(toMillis());
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
        {
            return true;
        }

        if (!(obj instanceof DurationSpec))
        {
            return false;
        }

        DurationSpec that = (DurationSpec) obj;
        if (unit == that.unit)
        {
            return quantity == that.quantity;
        }

        // both directions must agree, otherwise an overflow in one of the conversions could report equality
        return unit.convert(that.quantity, that.unit) == quantity
               && that.unit.convert(quantity, unit) == that.quantity;
    }

    @Override
    public String toString()
    {
        return quantity + symbol(unit);
    }

    @Override
    public int compareTo(@NotNull DurationSpec that)
    {
        TimeUnit finer = unit.compareTo(that.unit) < 0 ? unit : that.unit;
        return Long.compare(to(finer), that.to(finer));
    }

    private void validateMinUnit(Object value, TimeUnit unit, TimeUnit minUnit)
    {
        if (unit.compareTo(minUnit) < 0)
        {
            throw iae(value);
        }
    }

    private void validateQuantity(Object value, long quantity, TimeUnit sourceUnit, TimeUnit minUnit)
    {
        if (quantity < 0)
        {
            throw iae(value);
        }

        if (minUnit.convert(quantity, sourceUnit) == Long.MAX_VALUE)
        {
            throw new IllegalArgumentException(String.format("Invalid duration: %s. It shouldn't be more than %d in %s",
                                                             value, Long.MAX_VALUE - 1, minUnit.name().toLowerCase()));
        }
    }

    private IllegalArgumentException iae(Object value)
    {
        return new IllegalArgumentException(String.format("Invalid duration %s. Positive numbers with units %s are allowed",
                                                          value, acceptedUnits(minimumUnit())));
    }

    /**
     * @param unit the time unit
     * @return the configuration symbol for {@code unit}
     * @throws IllegalArgumentException when the unit has no symbol
     */
    public static String symbol(TimeUnit unit)
    {
        switch (unit)
        {
            case DAYS:
                return "d";
            case HOURS:
                return "h";
            case MINUTES:
                return "m";
            case SECONDS:
                return "s";
            case MILLISECONDS:
                return "ms";
        }
        throw new IllegalArgumentException("Unsupported unit " + unit);
    }

    /**
     * @param symbol a unit symbol as written in configuration
     * @return the matching time unit
     * @throws IllegalArgumentException when the symbol is unknown
     */
    public static TimeUnit fromSymbol(String symbol)
    {
        switch (symbol.toLowerCase())
        {
            case "d":
                return DAYS;
            case "h":
                return HOURS;
            case "m":
                return MINUTES;
            case "s":
                return SECONDS;
            case "ms":
                return MILLISECONDS;
            default:
                throw new IllegalArgumentException(String.format("Unsupported time unit: %s. Supported units are: %s",
                                                                 symbol, acceptedUnits(MILLISECONDS)));
        }
    }

    static String acceptedUnits(TimeUnit minimumUnit)
    {
        TimeUnit[] units = { MILLISECONDS, SECONDS, MINUTES, HOURS, DAYS };
        return Arrays.stream(units)
                     .filter(u -> u.compareTo(minimumUnit) >= 0)
                     .map(u -> symbol(u) + "(" + u.name().toLowerCase() + ")")
                     .collect(Collectors.joining(", ", "[", "]"));
    }
}
