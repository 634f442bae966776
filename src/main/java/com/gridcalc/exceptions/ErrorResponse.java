package com.gridcalc.exceptions;

/**
 * Body of every failed request, for example:
 * {
 *   "status": 400,
 *   "code": "INVALID_REFERENCE",
 *   "message": "Invalid cell reference: A0",
 *   "path": "/sheet/1/cell/A0"
 * }
 */
public class ErrorResponse {
    private final int status;
    private final String code;
    private final String message;
    private final String path;

    public ErrorResponse(int status, String code, String message, String path) {
        this.status = status;
        this.code = code;
        this.message = message;
        this.path = path;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }
}
