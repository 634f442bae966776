package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;

/**
 * Text built-ins. Character positions are 1-based.
 */
final class StringFunctions {

    private StringFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("LEFT", StringFunctions::left);
        registry.register("RIGHT", StringFunctions::right);
        registry.register("MID", StringFunctions::mid);
        registry.register("LEN", StringFunctions::length);
        registry.register("LENGTH", StringFunctions::length);
        registry.register("FIND", (args, ctx) -> find(args, true));
        registry.register("SEARCH", (args, ctx) -> find(args, false));
        registry.register("REPLACE", StringFunctions::replace);
        registry.register("SUBSTITUTE", StringFunctions::substitute);
        registry.register("UPPER", (args, ctx) -> Value.text(oneText(args).toUpperCase(Locale.ROOT)));
        registry.register("LOWER", (args, ctx) -> Value.text(oneText(args).toLowerCase(Locale.ROOT)));
        registry.register("PROPER", (args, ctx) -> Value.text(proper(oneText(args))));
        registry.register("TRIM", (args, ctx) -> Value.text(oneText(args).trim().replaceAll(" +", " ")));
        registry.register("CLEAN", (args, ctx) -> Value.text(oneText(args).replaceAll("\\p{Cntrl}", "")));
        registry.register("VALUE", StringFunctions::value);
        registry.register("STRING", StringFunctions::string);
        registry.register("TEXT", StringFunctions::text);
        registry.register("CHAR", StringFunctions::charFunction);
        registry.register("CODE", StringFunctions::code);
        registry.register("S", (args, ctx) -> textOnly(args));
        registry.register("T", (args, ctx) -> textOnly(args));
        registry.register("REPEAT", StringFunctions::repeat);
        registry.register("REPT", StringFunctions::repeat);
        registry.register("EXACT", StringFunctions::exact);
        registry.register("CONCATENATE", StringFunctions::concatenate);
        registry.register("CONCAT", StringFunctions::concatenate);
        registry.register("FIXED", StringFunctions::fixed);
        registry.register("DOLLAR", StringFunctions::dollar);
    }

    private static String oneText(List<Value> args) {
        Args.require(args, 1, 1);
        return Args.text(args, 0);
    }

    private static int count(List<Value> args, int index, int defaultValue) {
        int n = Args.integer(args, index, defaultValue);
        if (n < 0) {
            throw new FormulaException(ErrorKind.VALUE, "Negative count");
        }
        return n;
    }

    private static Value left(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        String text = Args.text(args, 0);
        return Value.text(text.substring(0, Math.min(count(args, 1, 1), text.length())));
    }

    private static Value right(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        String text = Args.text(args, 0);
        int n = Math.min(count(args, 1, 1), text.length());
        return Value.text(text.substring(text.length() - n));
    }

    private static Value mid(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 3);
        String text = Args.text(args, 0);
        int start = Args.integer(args, 1);
        int n = count(args, 2, 0);
        if (start < 1) {
            throw new FormulaException(ErrorKind.VALUE, "Start position must be at least 1");
        }
        if (start > text.length()) {
            return Value.EMPTY;
        }
        int from = start - 1;
        return Value.text(text.substring(from, Math.min(text.length(), from + n)));
    }

    private static Value length(List<Value> args, FunctionContext ctx) {
        return Value.number(oneText(args).length());
    }

    private static Value find(List<Value> args, boolean caseSensitive) {
        Args.require(args, 2, 3);
        String needle = Args.text(args, 0);
        String haystack = Args.text(args, 1);
        int start = Args.integer(args, 2, 1);
        if (start < 1 || start > haystack.length() + 1) {
            throw new FormulaException(ErrorKind.VALUE, "Start position out of range");
        }
        int index;
        if (caseSensitive) {
            index = haystack.indexOf(needle, start - 1);
        } else {
            index = haystack.toLowerCase(Locale.ROOT).indexOf(needle.toLowerCase(Locale.ROOT), start - 1);
        }
        if (index < 0) {
            throw new FormulaException(ErrorKind.VALUE, "Text not found");
        }
        return Value.number(index + 1);
    }

    private static Value replace(List<Value> args, FunctionContext ctx) {
        Args.require(args, 4, 4);
        String text = Args.text(args, 0);
        int start = Args.integer(args, 1);
        int n = count(args, 2, 0);
        String replacement = Args.text(args, 3);
        if (start < 1) {
            throw new FormulaException(ErrorKind.VALUE, "Start position must be at least 1");
        }
        int from = Math.min(start - 1, text.length());
        int to = Math.min(from + n, text.length());
        return Value.text(text.substring(0, from) + replacement + text.substring(to));
    }

    private static Value substitute(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, 4);
        String text = Args.text(args, 0);
        String oldText = Args.text(args, 1);
        String newText = Args.text(args, 2);
        if (oldText.isEmpty()) {
            return Value.text(text);
        }
        if (!Args.present(args, 3)) {
            return Value.text(text.replace(oldText, newText));
        }
        int instance = Args.integer(args, 3);
        if (instance < 1) {
            throw new FormulaException(ErrorKind.VALUE, "Instance must be at least 1");
        }
        int index = -1;
        for (int i = 0; i < instance; i++) {
            index = text.indexOf(oldText, index + 1);
            if (index < 0) {
                return Value.text(text);
            }
        }
        return Value.text(text.substring(0, index) + newText + text.substring(index + oldText.length()));
    }

    private static String proper(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }

    private static Value value(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        Value arg = Args.scalar(args.get(0));
        if (arg.isNumber()) {
            return arg;
        }
        String text = arg.toText().trim();
        if (text.isEmpty()) {
            return Value.ZERO;
        }
        Double parsed = Value.parseNumber(text);
        if (parsed == null) {
            throw new FormulaException(ErrorKind.VALUE, "Not a number: " + text);
        }
        return Value.number(parsed);
    }

    // STRING(x, decimals)
    private static Value string(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        double x = Args.number(args, 0);
        int decimals = Args.integer(args, 1, 0);
        return Value.text(decimalFormat(decimals, false).format(MathFunctions.round(x, Math.max(decimals, 0))));
    }

    /**
     * TEXT(x, format) for the common numeric patterns: "0", "0.00", "#,##0.00",
     * optional percent suffix. Other patterns are handed to {@link DecimalFormat}.
     */
    private static Value text(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        double x = Args.number(args, 0);
        String pattern = Args.text(args, 1);
        try {
            return Value.text(new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT)).format(x));
        } catch (IllegalArgumentException e) {
            throw new FormulaException(ErrorKind.VALUE, "Bad format: " + pattern);
        }
    }

    private static DecimalFormat decimalFormat(int decimals, boolean grouping) {
        StringBuilder pattern = new StringBuilder(grouping ? "#,##0" : "0");
        if (decimals > 0) {
            pattern.append('.');
            for (int i = 0; i < decimals; i++) {
                pattern.append('0');
            }
        }
        return new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.ROOT));
    }

    private static Value charFunction(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        int code = Args.integer(args, 0);
        if (code < 1 || code > 255) {
            throw new FormulaException(ErrorKind.VALUE, "Character code out of range");
        }
        return Value.text(String.valueOf((char) code));
    }

    private static Value code(List<Value> args, FunctionContext ctx) {
        String text = oneText(args);
        if (text.isEmpty()) {
            throw new FormulaException(ErrorKind.VALUE, "Empty text");
        }
        return Value.number(text.charAt(0));
    }

    private static Value textOnly(List<Value> args) {
        Args.require(args, 1, 1);
        Value arg = Args.scalar(args.get(0));
        return arg.isText() ? arg : Value.EMPTY;
    }

    private static Value repeat(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        String text = Args.text(args, 0);
        int n = count(args, 1, 0);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < n; i++) {
            out.append(text);
        }
        return Value.text(out.toString());
    }

    private static Value exact(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        return Value.bool(Args.text(args, 0).equals(Args.text(args, 1)));
    }

    private static Value concatenate(List<Value> args, FunctionContext ctx) {
        StringBuilder out = new StringBuilder();
        for (Value v : Args.flatten(args)) {
            out.append(v.toText());
        }
        return Value.text(out.toString());
    }

    private static Value fixed(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 3);
        double x = Args.number(args, 0);
        int decimals = Args.integer(args, 1, 2);
        boolean noCommas = Args.bool(args, 2, false);
        return Value.text(decimalFormat(decimals, !noCommas).format(MathFunctions.round(x, decimals)));
    }

    private static Value dollar(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        double x = Args.number(args, 0);
        int decimals = Args.integer(args, 1, 2);
        String formatted = decimalFormat(decimals, true).format(Math.abs(MathFunctions.round(x, decimals)));
        return Value.text(x < 0 ? "($" + formatted + ")" : "$" + formatted);
    }
}
