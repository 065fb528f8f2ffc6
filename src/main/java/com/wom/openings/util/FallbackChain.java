package com.wom.openings.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Tries an ordered list of candidates with the same action and returns the first result that does not throw.
 * Every failure is kept; when all candidates fail the aggregate carries them as suppressed exceptions
 * and the last one as its cause.
 */
@Slf4j
public final class FallbackChain {

    @FunctionalInterface
    public interface Attempt<C, R> {
        R apply(C candidate) throws Exception;
    }

    public static final class ExhaustedException extends Exception {
        private final transient List<Exception> failures;

        ExhaustedException(String what, List<Exception> failures) {
            super(what + ": all " + failures.size() + " candidates failed"
                    + (failures.isEmpty() ? "" : ". Last error: " + failures.get(failures.size() - 1).getMessage()),
                    failures.isEmpty() ? null : failures.get(failures.size() - 1));
            this.failures = List.copyOf(failures);
            failures.forEach(this::addSuppressed);
        }

        public List<Exception> failures() {
            return failures;
        }
    }

    private FallbackChain() {}

    public static <C, R> R firstSuccess(String what, List<C> candidates, Attempt<C, R> attempt)
            throws ExhaustedException {
        List<Exception> failures = new ArrayList<>();
        for (C candidate : candidates) {
            try {
                return attempt.apply(candidate);
            } catch (Exception e) {
                log.warn("[Openings] {} candidate={} failed: {}", what, candidate, e.getMessage());
                failures.add(e);
            }
        }
        throw new ExhaustedException(what, failures);
    }
}
