package net.littleredcomputer.hilbert;

import java.io.IOException;

/**
 * Thrown when a report cannot be written. Distinguishes output failures from failures of the
 * search itself.
 */
public class ReportException extends RuntimeException {
    public ReportException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
