package com.gridcalc.recalc;

/**
 * Outcome of one recalculation pass.
 */
public class RecalcStats {
    private int cellsEvaluated;
    private int circularRefsFound;
    private int errorsFound;
    private double elapsedMs;

    public int getCellsEvaluated() {
        return cellsEvaluated;
    }
    public int getCircularRefsFound() {
        return circularRefsFound;
    }
    public int getErrorsFound() {
        return errorsFound;
    }
    public double getElapsedMs() {
        return elapsedMs;
    }

    void countEvaluated() {
        cellsEvaluated++;
    }
    void countCircular() {
        circularRefsFound++;
    }
    void countError() {
        errorsFound++;
    }
    void setElapsedMs(double elapsedMs) {
        this.elapsedMs = elapsedMs;
    }

    @Override
    public String toString() {
        return "RecalcStats{cellsEvaluated=" + cellsEvaluated
                + ", circularRefsFound=" + circularRefsFound
                + ", errorsFound=" + errorsFound
                + ", elapsedMs=" + elapsedMs + "}";
    }
}
