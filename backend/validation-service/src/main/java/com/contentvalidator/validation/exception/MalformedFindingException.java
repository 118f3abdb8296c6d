package com.contentvalidator.validation.exception;

/**
 * A raw finding could not be turned into an issue.
 * Recoverable: the caller drops the finding and continues.
 */
public class MalformedFindingException extends ValidationServiceException {

    public MalformedFindingException(String message) {
        super("MALFORMED_FINDING", message);
    }
}
