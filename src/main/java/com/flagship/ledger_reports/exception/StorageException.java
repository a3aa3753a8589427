package com.flagship.ledger_reports.exception;

import java.util.Map;

/**
 * The storage collaborator failed or timed out. Never retried here.
 */
public class StorageException extends ReportException {

    public StorageException(String message, Map<String, String> context, Throwable cause) {
        super(ErrorKind.STORAGE, message, context, cause);
    }
}
