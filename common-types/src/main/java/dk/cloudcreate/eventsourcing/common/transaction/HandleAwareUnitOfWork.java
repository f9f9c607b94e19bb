package dk.cloudcreate.eventsourcing.common.transaction;

import org.jdbi.v3.core.Handle;

/**
 * {@link UnitOfWork} that exposes the Jdbi {@link Handle} its transaction is bound to
 */
public interface HandleAwareUnitOfWork extends UnitOfWork {
    /**
     * @return the Jdbi handle of the active transaction
     * @throws UnitOfWorkException if the {@link UnitOfWork} hasn't been started or has completed
     */
    Handle handle();
}
