package com.gridcalc.exceptions;

/**
 * No sheet is registered under the requested id.
 */
public class SheetNotFoundException extends RuntimeException {

    private final long sheetId;

    public SheetNotFoundException(long sheetId) {
        super("Sheet not found: " + sheetId);
        this.sheetId = sheetId;
    }

    public long getSheetId() {
        return sheetId;
    }
}
