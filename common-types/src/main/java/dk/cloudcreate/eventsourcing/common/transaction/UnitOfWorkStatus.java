package dk.cloudcreate.eventsourcing.common.transaction;

/**
 * Lifecycle states of a {@link UnitOfWork}
 */
public enum UnitOfWorkStatus {
    /**
     * Created but the underlying transaction hasn't begun yet
     */
    Ready(false),
    /**
     * The underlying transaction has begun
     */
    Started(false),
    Committed(true),
    RolledBack(true),
    /**
     * The {@link UnitOfWork} will be rolled back instead of committed when it completes
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }
}
