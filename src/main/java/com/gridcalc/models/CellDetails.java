package com.gridcalc.models;

import java.util.List;

/**
 * Everything known about one cell, as returned by the cell endpoint.
 */
public class CellDetails {
    private final String ref;
    private final String rawValue;
    private final String formula;   // null unless the cell holds a formula
    private final ValueType type;
    private final String value;
    private final String displayValue;
    private final String formatCode;
    private final List<String> dependencies;
    private final List<String> dependents;

    public CellDetails(String ref, String rawValue, String formula, Value value, String displayValue,
                       String formatCode, List<String> dependencies, List<String> dependents) {
        this.ref = ref;
        this.rawValue = rawValue;
        this.formula = formula;
        this.type = value.getType();
        this.value = value.asDisplayText();
        this.displayValue = displayValue;
        this.formatCode = formatCode;
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    public String getRef() {
        return ref;
    }
    public String getRawValue() {
        return rawValue;
    }
    public String getFormula() {
        return formula;
    }
    public ValueType getType() {
        return type;
    }
    public String getValue() {
        return value;
    }
    public String getDisplayValue() {
        return displayValue;
    }
    public String getFormatCode() {
        return formatCode;
    }
    public List<String> getDependencies() {
        return dependencies;
    }
    public List<String> getDependents() {
        return dependents;
    }
}
