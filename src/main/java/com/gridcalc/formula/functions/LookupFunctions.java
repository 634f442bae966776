package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;
import com.gridcalc.references.CellReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Table lookups, positional access into ranges, and reference helpers.
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("VLOOKUP", (args, ctx) -> tableLookup(args, true));
        registry.register("HLOOKUP", (args, ctx) -> tableLookup(args, false));
        registry.register("LOOKUP", LookupFunctions::lookup);
        registry.register("MATCH", LookupFunctions::match);
        registry.register("INDEX", LookupFunctions::index);
        registry.register("INDIRECT", LookupFunctions::indirect);
        registry.register("ROW", (args, ctx) -> {
            Args.require(args, 0, 0);
            return Value.number(currentCell(ctx).getRow() + 1);
        });
        registry.register("COLUMN", (args, ctx) -> {
            Args.require(args, 0, 0);
            return Value.number(currentCell(ctx).getCol() + 1);
        });
        registry.register("ADDRESS", LookupFunctions::address);
        registry.register("ROWS", (args, ctx) -> {
            Args.require(args, 1, 1);
            return Value.number(Args.table(args.get(0)).size());
        });
        registry.register("COLS", LookupFunctions::columns);
        registry.register("COLUMNS", LookupFunctions::columns);
    }

    /**
     * Ordering used by the lookups: numbers against numbers, text against text case-insensitively.
     * Returns null when the two values cannot be compared.
     */
    static Integer compareForLookup(Value key, Value candidate) {
        if (candidate.isEmpty() || candidate.isError()) {
            return null;
        }
        if ((key.isNumber() || key.isBoolean()) && (candidate.isNumber() || candidate.isBoolean())) {
            return Double.compare(candidate.toNumber(), key.toNumber());
        }
        if (key.isText() && candidate.isText()) {
            return candidate.getText().toUpperCase(Locale.ROOT).compareTo(key.getText().toUpperCase(Locale.ROOT));
        }
        return null;
    }

    /**
     * Index of the matching element in {@code line}: the first exact match, or for an
     * approximate lookup the last element not greater than the key in a sorted line.
     * Returns -1 when nothing matches.
     */
    private static int find(Value key, List<Value> line, boolean approximate) {
        int found = -1;
        for (int i = 0; i < line.size(); i++) {
            Integer cmp = compareForLookup(key, line.get(i));
            if (cmp == null) {
                continue;
            }
            if (!approximate) {
                if (cmp == 0) {
                    return i;
                }
            } else if (cmp <= 0) {
                found = i;
            } else {
                break;
            }
        }
        return found;
    }

    private static Value tableLookup(List<Value> args, boolean vertical) {
        Args.require(args, 3, 4);
        Value key = Args.scalar(args.get(0));
        List<List<Value>> table = Args.table(args.get(1));
        int offset = Args.integer(args, 2) - 1;
        boolean approximate = Args.bool(args, 3, true);
        if (table.isEmpty() || table.get(0).isEmpty()) {
            throw new FormulaException(ErrorKind.NA, "Empty table");
        }
        int width = vertical ? table.get(0).size() : table.size();
        if (offset < 0 || offset >= width) {
            throw new FormulaException(ErrorKind.REF, "Index outside the table");
        }
        List<Value> keys = vertical ? column(table, 0) : table.get(0);
        int hit = find(key, keys, approximate);
        if (hit < 0) {
            throw new FormulaException(ErrorKind.NA, "No match for " + key);
        }
        return vertical ? table.get(hit).get(offset) : table.get(offset).get(hit);
    }

    private static List<Value> column(List<List<Value>> table, int index) {
        List<Value> result = new ArrayList<>(table.size());
        for (List<Value> row : table) {
            result.add(index < row.size() ? row.get(index) : Value.EMPTY);
        }
        return result;
    }

    private static Value lookup(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 3);
        Value key = Args.scalar(args.get(0));
        List<Value> keys = Args.flatten(args.subList(1, 2));
        List<Value> results = args.size() > 2 ? Args.flatten(args.subList(2, 3)) : keys;
        int hit = find(key, keys, true);
        if (hit < 0 || hit >= results.size()) {
            throw new FormulaException(ErrorKind.NA, "No match for " + key);
        }
        return results.get(hit);
    }

    /**
     * MATCH(key, range, type): type 1 = largest value &lt;= key, 0 = exact,
     * -1 = smallest value &gt;= key in a descending list. Result is 1-based.
     */
    private static Value match(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 3);
        Value key = Args.scalar(args.get(0));
        List<Value> values = Args.flatten(args.subList(1, 2));
        int type = Args.integer(args, 2, 1);
        int hit;
        if (type == 0) {
            hit = find(key, values, false);
        } else if (type > 0) {
            hit = find(key, values, true);
        } else {
            hit = -1;
            for (int i = 0; i < values.size(); i++) {
                Integer cmp = compareForLookup(key, values.get(i));
                if (cmp == null) {
                    continue;
                }
                if (cmp >= 0) {
                    hit = i;
                } else {
                    break;
                }
            }
        }
        if (hit < 0) {
            throw new FormulaException(ErrorKind.NA, "No match for " + key);
        }
        return Value.number(hit + 1);
    }

    private static Value index(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 3);
        List<List<Value>> table = Args.table(args.get(0));
        int row = Args.integer(args, 1);
        int col = Args.integer(args, 2, 1);
        // A single row indexed by one number reads across
        if (args.size() == 2 && table.size() == 1) {
            col = row;
            row = 1;
        }
        if (row < 1 || row > table.size() || col < 1 || col > table.get(row - 1).size()) {
            throw new FormulaException(ErrorKind.REF, "Index outside the range");
        }
        return table.get(row - 1).get(col - 1);
    }

    private static Value indirect(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        String ref = Args.text(args, 0).trim();
        if (!CellReference.looksLikeReference(ref)) {
            throw new FormulaException(ErrorKind.REF, "Not a cell reference: " + ref);
        }
        return ctx.getSpreadsheet().getValueByRef(ref, ctx.getEvaluationContext());
    }

    private static CellReference currentCell(FunctionContext ctx) {
        CellReference cell = ctx.getEvaluationContext() == null ? null : ctx.getEvaluationContext().getCurrentCell();
        if (cell == null) {
            throw new FormulaException(ErrorKind.REF, "No current cell");
        }
        return cell;
    }

    /**
     * ADDRESS(row, col, absType): 1 = $A$1, 2 = A$1, 3 = $A1, 4 = A1.
     */
    private static Value address(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 3);
        int row = Args.integer(args, 0);
        int col = Args.integer(args, 1);
        int absType = Args.integer(args, 2, 1);
        if (row < 1 || col < 1 || absType < 1 || absType > 4) {
            throw new FormulaException(ErrorKind.VALUE, "Invalid ADDRESS arguments");
        }
        boolean colAbsolute = absType == 1 || absType == 3;
        boolean rowAbsolute = absType == 1 || absType == 2;
        return Value.text(new CellReference(row - 1, col - 1, colAbsolute, rowAbsolute).toString());
    }

    private static Value columns(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        List<List<Value>> table = Args.table(args.get(0));
        return Value.number(table.isEmpty() ? 0 : table.get(0).size());
    }
}
