package com.jasmin.rateguard.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The rule source or counter store could not be reached.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
