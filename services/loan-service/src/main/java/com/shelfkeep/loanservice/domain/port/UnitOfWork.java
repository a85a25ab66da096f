package com.shelfkeep.loanservice.domain.port;

import com.shelfkeep.loanservice.domain.error.LoanResult;
import java.util.function.Supplier;

/**
 * Runs store reads and writes as one atomic unit.
 *
 * <p>A failed {@link LoanResult} discards every write the work made. The work may be invoked more
 * than once when the store reports a transient write conflict, so it must re-read everything it
 * checks.
 */
public interface UnitOfWork {

    <T> LoanResult<T> execute(String operation, Supplier<LoanResult<T>> work);
}
