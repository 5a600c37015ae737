package com.searchcache.search.parallel;

import java.util.List;

/**
 * Per-task result of a parallel search. Failed and timed-out tasks carry an empty result list; the
 * status and error say why.
 */
public record TaskOutcome<T>(List<T> results, Status status, Throwable error) {

    public enum Status {
        SUCCESS,
        FAILED,
        TIMED_OUT
    }

    public static <T> TaskOutcome<T> success(List<T> results) {
        return new TaskOutcome<>(results == null ? List.of() : results, Status.SUCCESS, null);
    }

    public static <T> TaskOutcome<T> failed(Throwable error) {
        return new TaskOutcome<>(List.of(), Status.FAILED, error);
    }

    public static <T> TaskOutcome<T> timedOut() {
        return new TaskOutcome<>(List.of(), Status.TIMED_OUT, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
