package com.gridcalc.config;

import com.gridcalc.models.Sheet;
import com.gridcalc.recalc.RecalcMode;
import com.gridcalc.recalc.RecalcOrder;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings every new sheet starts from, bound from the "gridcalc" prefix.
 */
@ConfigurationProperties(prefix = "gridcalc")
public class EngineProperties {

    private int maxRows = Sheet.DEFAULT_MAX_ROWS;
    private int maxCols = Sheet.DEFAULT_MAX_COLS;
    // Formula nesting and computing-chain bound; deeper evaluations give #REF!
    private int maxEvaluationDepth = Sheet.DEFAULT_MAX_DEPTH;
    private RecalcMode defaultRecalcMode = RecalcMode.AUTOMATIC;
    private RecalcOrder defaultRecalcOrder = RecalcOrder.NATURAL;

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxCols() {
        return maxCols;
    }

    public void setMaxCols(int maxCols) {
        this.maxCols = maxCols;
    }

    public int getMaxEvaluationDepth() {
        return maxEvaluationDepth;
    }

    public void setMaxEvaluationDepth(int maxEvaluationDepth) {
        this.maxEvaluationDepth = maxEvaluationDepth;
    }

    public RecalcMode getDefaultRecalcMode() {
        return defaultRecalcMode;
    }

    public void setDefaultRecalcMode(RecalcMode defaultRecalcMode) {
        this.defaultRecalcMode = defaultRecalcMode;
    }

    public RecalcOrder getDefaultRecalcOrder() {
        return defaultRecalcOrder;
    }

    public void setDefaultRecalcOrder(RecalcOrder defaultRecalcOrder) {
        this.defaultRecalcOrder = defaultRecalcOrder;
    }
}
