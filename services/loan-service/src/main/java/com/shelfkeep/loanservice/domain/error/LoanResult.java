package com.shelfkeep.loanservice.domain.error;

import java.util.function.Function;

/**
 * Outcome of a loan operation: either a value or a {@link LoanError}, never both.
 *
 * @param value the successful result (null on failure)
 * @param error the failure (null on success)
 * @param <T> result type
 */
public record LoanResult<T>(T value, LoanError error) {

    public LoanResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value and error must be set");
        }
    }

    public static <T> LoanResult<T> ok(T value) {
        return new LoanResult<>(value, null);
    }

    public static <T> LoanResult<T> fail(LoanError error) {
        return new LoanResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public <U> LoanResult<U> map(Function<? super T, ? extends U> mapper) {
        return isOk() ? ok(mapper.apply(value)) : fail(error);
    }

    /** Returns the value, or throws the exception built from the error. */
    public <X extends RuntimeException> T orElseThrow(Function<LoanError, X> exception) {
        if (!isOk()) {
            throw exception.apply(error);
        }
        return value;
    }
}
