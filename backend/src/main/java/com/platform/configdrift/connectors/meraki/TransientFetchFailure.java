package com.platform.configdrift.connectors.meraki;

import com.platform.configdrift.error.ErrorCode;
import com.platform.configdrift.error.FetchFailureException;

import java.util.function.Predicate;

/**
 * Matches dashboard failures worth retrying and counting against the circuit breaker:
 * timeouts, connection errors, rate limiting and 5xx responses.
 */
public class TransientFetchFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof FetchFailureException
            && ((FetchFailureException) throwable).getErrorCode() == ErrorCode.DASHBOARD_UNAVAILABLE;
    }
}
