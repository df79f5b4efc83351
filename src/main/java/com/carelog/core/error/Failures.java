package com.carelog.core.error;

import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import io.r2dbc.spi.R2dbcNonTransientException;
import io.r2dbc.spi.R2dbcTransientException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies arbitrary throwables into retryable vs. final, by type.
 */
public final class Failures {

    private Failures() {
    }

    public static boolean isRetryable(Throwable err) {
        Throwable t = err;
        int depth = 0;
        while (t != null && depth++ < 8) {
            if (t instanceof CareLogException ce) {
                return ce.retryable();
            }
            if (t instanceof TransientDataAccessException
                    || t instanceof R2dbcTransientException
                    || t instanceof TimeoutException
                    || t instanceof WebClientRequestException
                    || t instanceof IOException) {
                return true;
            }
            if (t instanceof WebClientResponseException wre) {
                int status = wre.getStatusCode().value();
                return status == 429 || status >= 500;
            }
            if (t instanceof NonTransientDataAccessException || t instanceof R2dbcNonTransientException) {
                return false;
            }
            t = t.getCause();
        }
        return false;
    }
}
