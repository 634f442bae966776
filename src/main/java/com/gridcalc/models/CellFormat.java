package com.gridcalc.models;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Renders a value under a Lotus format code: G general, Fn fixed, Sn scientific,
 * Cn currency, ,n thousands separators, Pn percent, H hidden. n is 0 to 15 and
 * defaults to 2. Unknown codes render as general.
 */
public final class CellFormat {

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ROOT);

    private CellFormat() {
    }

    public static String format(Value value, String code) {
        String normalized = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        if ("H".equals(normalized)) {
            return "";
        }
        if (normalized.isEmpty() || Cell.GENERAL_FORMAT.equals(normalized) || !value.isNumber()) {
            return value.asDisplayText();
        }
        double number = value.getNumber();
        int decimals = decimals(normalized);
        switch (normalized.charAt(0)) {
            case 'F':
                return pattern("0", decimals).format(number);
            case 'S':
                return pattern("0", decimals, "E00").format(number);
            case 'C':
                String currency = "$" + pattern("#,##0", decimals).format(Math.abs(number));
                return number < 0 ? "(" + currency + ")" : currency;
            case ',':
                return pattern("#,##0", decimals).format(number);
            case 'P':
                return pattern("0", decimals).format(number * 100) + "%";
            default:
                return value.asDisplayText();
        }
    }

    private static int decimals(String code) {
        if (code.length() < 2) {
            return 2;
        }
        try {
            return Math.max(0, Math.min(15, Integer.parseInt(code.substring(1))));
        } catch (NumberFormatException e) {
            return 2;
        }
    }

    private static DecimalFormat pattern(String integerPart, int decimals) {
        return pattern(integerPart, decimals, "");
    }

    private static DecimalFormat pattern(String integerPart, int decimals, String suffix) {
        StringBuilder sb = new StringBuilder(integerPart);
        if (decimals > 0) {
            sb.append('.');
            for (int i = 0; i < decimals; i++) {
                sb.append('0');
            }
        }
        DecimalFormat format = new DecimalFormat(sb.append(suffix).toString(), SYMBOLS);
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format;
    }
}
