package dk.cloudcreate.eventsourcing.common.transaction;

/**
 * A transactional boundary shared by all storage operations that run while it is active
 */
public interface UnitOfWork {
    /**
     * Begin the underlying transaction
     */
    void start();

    /**
     * Commit the underlying transaction, or roll it back if the {@link UnitOfWork} has been
     * {@link #markAsRollbackOnly(Exception) marked as rollback only}
     */
    void commit();

    /**
     * Roll back the underlying transaction
     *
     * @param cause the reason for the rollback (may be null)
     */
    void rollback(Exception cause);

    default void rollback() {
        rollback(getCauseOfRollback());
    }

    UnitOfWorkStatus status();

    /**
     * The cause supplied to {@link #rollback(Exception)} or {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    void markAsRollbackOnly(Exception cause);

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }
}
