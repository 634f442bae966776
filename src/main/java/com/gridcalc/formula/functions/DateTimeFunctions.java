package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalQuery;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Date and time built-ins over Lotus serial numbers: day 1 is 1900-01-01 and
 * serial 60 is the nonexistent 1900-02-29, so every later date is one higher
 * than its plain day count. The fractional part is the time of day.
 */
final class DateTimeFunctions {

    private static final LocalDate EPOCH = LocalDate.of(1899, 12, 31);
    private static final int FAKE_LEAP_DAY = 60;
    private static final double SECONDS_PER_DAY = 86400;

    private static final List<DateTimeFormatter> DATE_FORMATS = Arrays.asList(
            formatter("uuuu-M-d"),
            formatter("M/d/uuuu"),
            formatter("M/d/uu"),
            formatter("d-MMM-uuuu"),
            formatter("d-MMM-uu"),
            formatter("MMMM d, uuuu"),
            formatter("d.M.uuuu"));

    private static final List<DateTimeFormatter> TIME_FORMATS = Arrays.asList(
            formatter("H:mm:ss"),
            formatter("H:mm"),
            formatter("h:mm:ss a"),
            formatter("h:mm a"));

    private DateTimeFunctions() {
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    static void register(FunctionRegistry registry) {
        registry.register("DATE", DateTimeFunctions::date);
        registry.register("DATEVALUE", DateTimeFunctions::dateValue);
        registry.register("DAY", (args, ctx) -> Value.number(dateArg(args).getDayOfMonth()));
        registry.register("MONTH", (args, ctx) -> Value.number(dateArg(args).getMonthValue()));
        registry.register("YEAR", (args, ctx) -> Value.number(dateArg(args).getYear()));
        registry.register("WEEKDAY", DateTimeFunctions::weekday);
        registry.register("TODAY", (args, ctx) -> {
            Args.require(args, 0, 0);
            return Value.number(toSerial(LocalDate.now(ctx.getClock())));
        });
        registry.register("NOW", (args, ctx) -> {
            Args.require(args, 0, 0);
            LocalDateTime now = LocalDateTime.now(ctx.getClock());
            return Value.number(toSerial(now.toLocalDate()) + timeFraction(now.toLocalTime()));
        });
        registry.register("TIME", DateTimeFunctions::time);
        registry.register("TIMEVALUE", DateTimeFunctions::timeValue);
        registry.register("HOUR", (args, ctx) -> Value.number(secondOfDay(args) / 3600));
        registry.register("MINUTE", (args, ctx) -> Value.number(secondOfDay(args) % 3600 / 60));
        registry.register("SECOND", (args, ctx) -> Value.number(secondOfDay(args) % 60));
        registry.register("DAYS", (args, ctx) -> {
            Args.require(args, 2, 2);
            return Value.number(Math.floor(Args.number(args, 0)) - Math.floor(Args.number(args, 1)));
        });
        registry.register("EDATE", (args, ctx) -> monthOffset(args, false));
        registry.register("EOMONTH", (args, ctx) -> monthOffset(args, true));
    }

    /**
     * Lotus serial number of {@code date}.
     */
    static long toSerial(LocalDate date) {
        long days = ChronoUnit.DAYS.between(EPOCH, date);
        return days >= FAKE_LEAP_DAY ? days + 1 : days;
    }

    /**
     * Calendar date of the integer part of {@code serial}; serial 60 reads as 1900-02-28.
     */
    static LocalDate fromSerial(double serial) {
        long days = (long) Math.floor(serial);
        if (days < 0) {
            throw new FormulaException(ErrorKind.NUM, "Negative date serial");
        }
        if (days >= FAKE_LEAP_DAY) {
            days--;
        }
        return EPOCH.plusDays(days);
    }

    static double timeFraction(LocalTime time) {
        return time.toSecondOfDay() / SECONDS_PER_DAY;
    }

    /**
     * Parses {@code text} with the first format that consumes all of it, or returns null.
     */
    private static <T> T parseFirst(String text, List<DateTimeFormatter> formats, TemporalQuery<T> query) {
        for (DateTimeFormatter format : formats) {
            ParsePosition position = new ParsePosition(0);
            if (format.parseUnresolved(text, position) != null
                    && position.getErrorIndex() < 0 && position.getIndex() == text.length()) {
                try {
                    return format.parse(text, query);
                } catch (DateTimeParseException e) {
                    throw new FormulaException(ErrorKind.VALUE, "Invalid date or time: " + text);
                }
            }
        }
        return null;
    }

    private static LocalDate dateArg(List<Value> args) {
        Args.require(args, 1, 1);
        return fromSerial(Args.number(args, 0));
    }

    private static Value date(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        int year = Args.integer(args, 0);
        int month = Args.integer(args, 1);
        int day = Args.integer(args, 2);
        if (year < 100) {
            year += year >= 30 ? 1900 : 2000;
        }
        try {
            // Months outside 1..12 roll into neighbouring years
            LocalDate first = LocalDate.of(year, 1, 1).plusMonths(month - 1L);
            return Value.number(toSerial(LocalDate.of(first.getYear(), first.getMonth(), day)));
        } catch (DateTimeException e) {
            throw new FormulaException(ErrorKind.NUM, "Invalid date");
        }
    }

    private static Value dateValue(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        String text = Args.text(args, 0).trim();
        LocalDate date = parseFirst(text, DATE_FORMATS, LocalDate::from);
        if (date == null) {
            throw new FormulaException(ErrorKind.VALUE, "Unrecognized date: " + text);
        }
        return Value.number(toSerial(date));
    }

    /**
     * WEEKDAY(serial, type): 1 = Sunday..Saturday as 1..7, 2 = Monday..Sunday as 1..7,
     * 3 = Monday..Sunday as 0..6.
     */
    private static Value weekday(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        int isoDay = fromSerial(Args.number(args, 0)).getDayOfWeek().getValue();
        int type = Args.integer(args, 1, 1);
        switch (type) {
            case 1:
                return Value.number(isoDay % 7 + 1);
            case 2:
                return Value.number(isoDay);
            case 3:
                return Value.number(isoDay - 1);
            default:
                throw new FormulaException(ErrorKind.NUM, "Unknown WEEKDAY type " + type);
        }
    }

    private static Value time(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        long seconds = (long) Args.number(args, 0) * 3600L
                + (long) Args.number(args, 1) * 60L
                + (long) Args.number(args, 2);
        if (seconds < 0) {
            throw new FormulaException(ErrorKind.NUM, "Negative time");
        }
        return Value.number((seconds % 86400) / SECONDS_PER_DAY);
    }

    private static Value timeValue(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        String text = Args.text(args, 0).trim();
        LocalTime time = parseFirst(text, TIME_FORMATS, LocalTime::from);
        if (time == null) {
            throw new FormulaException(ErrorKind.VALUE, "Unrecognized time: " + text);
        }
        return Value.number(timeFraction(time));
    }

    private static long secondOfDay(List<Value> args) {
        Args.require(args, 1, 1);
        double serial = Args.number(args, 0);
        double fraction = serial - Math.floor(serial);
        return Math.round(fraction * SECONDS_PER_DAY) % 86400;
    }

    private static Value monthOffset(List<Value> args, boolean endOfMonth) {
        Args.require(args, 2, 2);
        LocalDate shifted = fromSerial(Args.number(args, 0)).plusMonths(Args.integer(args, 1));
        if (endOfMonth) {
            shifted = shifted.withDayOfMonth(shifted.lengthOfMonth());
        }
        return Value.number(toSerial(shifted));
    }
}
