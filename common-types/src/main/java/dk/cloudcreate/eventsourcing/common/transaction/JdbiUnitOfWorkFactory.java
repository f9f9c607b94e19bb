package dk.cloudcreate.eventsourcing.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link HandleAwareUnitOfWorkFactory} that manages the Jdbi {@link Handle} and its transaction itself.<br>
 * The active {@link HandleAwareUnitOfWork} is bound to the thread that created it and is released when it
 * is committed or rolled back.
 */
public class JdbiUnitOfWorkFactory implements HandleAwareUnitOfWorkFactory<HandleAwareUnitOfWork> {
    private static final Logger log = LoggerFactory.getLogger(JdbiUnitOfWorkFactory.class);

    private final Jdbi                          jdbi;
    private final ThreadLocal<JdbiUnitOfWork> activeUnitOfWork = new ThreadLocal<>();

    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public HandleAwareUnitOfWork getRequiredUnitOfWork() {
        var unitOfWork = activeUnitOfWork.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public HandleAwareUnitOfWork getOrCreateNewUnitOfWork() {
        var unitOfWork = activeUnitOfWork.get();
        if (unitOfWork == null) {
            unitOfWork = new JdbiUnitOfWork();
            unitOfWork.start();
            activeUnitOfWork.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<HandleAwareUnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable(activeUnitOfWork.get());
    }

    private void unitOfWorkCompleted(JdbiUnitOfWork unitOfWork) {
        if (activeUnitOfWork.get() == unitOfWork) {
            activeUnitOfWork.remove();
        }
    }

    private class JdbiUnitOfWork implements HandleAwareUnitOfWork {
        private UnitOfWorkStatus status = UnitOfWorkStatus.Ready;
        private Handle           handle;
        private Exception        causeOfRollback;

        @Override
        public void start() {
            if (status != UnitOfWorkStatus.Ready) {
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork with status {}", status));
            }
            handle = jdbi.open();
            handle.begin();
            status = UnitOfWorkStatus.Started;
            log.trace("Started UnitOfWork");
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                var cause = causeOfRollback;
                rollback(cause);
                throw new UnitOfWorkException("The UnitOfWork was marked as rollback only and has been rolled back", cause);
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
            try {
                handle.commit();
            } catch (RuntimeException e) {
                causeOfRollback = e;
                status = UnitOfWorkStatus.RolledBack;
                log.debug("Failed to commit UnitOfWork", e);
                releaseAfterFailedCommit(e);
                throw new UnitOfWorkException("Failed to commit the UnitOfWork", e);
            }
            status = UnitOfWorkStatus.Committed;
            log.trace("Committed UnitOfWork");
            close();
        }

        /**
         * Failures while rolling back and closing are attached to the commit failure so it stays the reported cause
         */
        private void releaseAfterFailedCommit(RuntimeException commitFailure) {
            try {
                handle.rollback();
            } catch (RuntimeException e) {
                commitFailure.addSuppressed(e);
            }
            try {
                handle.close();
            } catch (RuntimeException e) {
                commitFailure.addSuppressed(e);
            } finally {
                unitOfWorkCompleted(this);
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status.isCompleted || status == UnitOfWorkStatus.Ready) {
                log.trace("Ignoring rollback of UnitOfWork with status {}", status);
                return;
            }
            causeOfRollback = cause;
            try {
                handle.rollback();
                status = UnitOfWorkStatus.RolledBack;
                log.debug("Rolled back UnitOfWork", cause);
            } finally {
                close();
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status.isCompleted) {
                throw new UnitOfWorkException(msg("Cannot mark a UnitOfWork with status {} as rollback only", status));
            }
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
            causeOfRollback = cause;
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted) {
                throw new UnitOfWorkException(msg("The UnitOfWork has no active handle (status {})", status));
            }
            return handle;
        }

        private void close() {
            try {
                handle.close();
            } finally {
                unitOfWorkCompleted(this);
            }
        }
    }
}
