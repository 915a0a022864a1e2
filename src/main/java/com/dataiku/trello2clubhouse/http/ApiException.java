package com.dataiku.trello2clubhouse.http;

import java.io.IOException;

/**
 * Non successful HTTP answer from one of the remote services.
 */
public class ApiException extends IOException {

    private final int status;

    public ApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
