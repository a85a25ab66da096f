package com.shelfkeep.loanservice.infrastructure.persistence;

import com.shelfkeep.loanservice.config.LoanPolicyProperties;
import com.shelfkeep.loanservice.domain.error.ErrorCode;
import com.shelfkeep.loanservice.domain.error.LoanError;
import com.shelfkeep.loanservice.domain.error.LoanResult;
import com.shelfkeep.loanservice.domain.port.UnitOfWork;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link UnitOfWork} backed by one read-committed JDBC transaction per attempt.
 *
 * <p>A failed result marks the transaction rollback-only. A {@link TransientDataAccessException}
 * (lock timeout, deadlock, serialization failure) rolls back and re-runs the whole work, checks
 * included, up to {@code shelfkeep.loans.write-retry-attempts} times.
 */
@Component
public class TransactionalUnitOfWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(TransactionalUnitOfWork.class);

    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public TransactionalUnitOfWork(
            PlatformTransactionManager transactionManager, LoanPolicyProperties policy) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setName("shelfkeep-loan-unit-of-work");
        this.maxAttempts = policy.writeRetryAttempts();
    }

    @Override
    public <T> LoanResult<T> execute(String operation, Supplier<LoanResult<T>> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(
                        status -> {
                            LoanResult<T> result = work.get();
                            if (!result.isOk()) {
                                status.setRollbackOnly();
                            }
                            return result;
                        });
            } catch (TransientDataAccessException e) {
                if (attempt >= maxAttempts) {
                    log.error(
                            "{} gave up after {} attempts on write conflicts", operation, attempt, e);
                    return LoanResult.fail(
                            LoanError.of(
                                    ErrorCode.STORE_CONTENTION,
                                    operation,
                                    operation
                                            + " failed after "
                                            + attempt
                                            + " attempts: "
                                            + e.getMessage()));
                }
                log.warn(
                        "{} hit a write conflict (attempt {}/{}), retrying: {}",
                        operation,
                        attempt,
                        maxAttempts,
                        e.getMessage());
            }
        }
    }
}
