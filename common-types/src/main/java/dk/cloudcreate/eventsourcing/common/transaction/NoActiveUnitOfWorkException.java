package dk.cloudcreate.eventsourcing.common.transaction;

/**
 * Thrown by {@link UnitOfWorkFactory#getRequiredUnitOfWork()} when the calling thread has no active {@link UnitOfWork}
 */
public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork is bound to the current thread");
    }
}
