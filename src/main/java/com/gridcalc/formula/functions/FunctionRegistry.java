package com.gridcalc.formula.functions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Name -> function table used by the evaluator. Lookups are case-insensitive.
 * A new registry comes loaded with every built-in category; callers may
 * {@link #register} more.
 */
public class FunctionRegistry {

    private final Map<String, FunctionDefinition> functions = new TreeMap<>();

    public FunctionRegistry() {
        MathFunctions.register(this);
        StatisticalFunctions.register(this);
        StringFunctions.register(this);
        LogicalFunctions.register(this);
        LookupFunctions.register(this);
        DateTimeFunctions.register(this);
        FinancialFunctions.register(this);
        InfoFunctions.register(this);
        DatabaseFunctions.register(this);
    }

    /**
     * Registers a function that never sees error arguments.
     */
    public void register(String name, FormulaFunction function) {
        put(name, function, false);
    }

    /**
     * Registers a function that receives error arguments as values (ISERR, IFERROR, IF...).
     */
    public void registerErrorAware(String name, FormulaFunction function) {
        put(name, function, true);
    }

    private void put(String name, FormulaFunction function, boolean acceptsErrors) {
        String key = name.toUpperCase(Locale.ROOT);
        functions.put(key, new FunctionDefinition(key, function, acceptsErrors));
    }

    /**
     * Returns the function registered under {@code name}, or null.
     */
    public FunctionDefinition get(String name) {
        return name == null ? null : functions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean exists(String name) {
        return get(name) != null;
    }

    public List<String> listAll() {
        return new ArrayList<>(functions.keySet());
    }

    public int size() {
        return functions.size();
    }
}
