package com.example.paging.paginator;

/**
 * Base class for failures raised by the paginator itself, as opposed to failures of
 * the page source. These are configuration problems and are never retried.
 */
public class PaginationException extends RuntimeException {

    public PaginationException(String message) {
        super(message);
    }
}
