package dev.univer.points.exception;

/**
 * Failure talking to the spreadsheet. Callers decide whether it costs a row or the whole pass.
 */
public class SpreadsheetException extends RuntimeException {
    public SpreadsheetException(String message) {
        super(message);
    }

    public SpreadsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
