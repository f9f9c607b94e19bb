package dk.cloudcreate.eventsourcing.common.transaction;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates and tracks the {@link UnitOfWork} bound to the calling thread.<br>
 * {@link #usingUnitOfWork(CheckedConsumer)} and {@link #withUnitOfWork(CheckedFunction)} join an already
 * active {@link UnitOfWork} instead of creating a new one. A joined {@link UnitOfWork} is never committed or rolled back by the
 * joining call; a failure only marks it as rollback only so the outermost call decides the outcome.
 *
 * @param <UOW> the {@link UnitOfWork} sub-type handed out
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the calling thread has no active {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * @return the active {@link UnitOfWork} or a new, started, {@link UnitOfWork}
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var ownsUnitOfWork     = existingUnitOfWork.isEmpty();
        var unitOfWork         = existingUnitOfWork.orElseGet(this::getOrCreateNewUnitOfWork);
        if (!ownsUnitOfWork) {
            unitOfWorkLog.trace("Joining the UnitOfWork already active on this thread");
        }
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (ownsUnitOfWork) {
                unitOfWorkLog.trace("Committing the UnitOfWork");
                unitOfWork.commit();
            }
            return result;
        } catch (Exception e) {
            if (ownsUnitOfWork) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork due to {}", e.getClass().getSimpleName());
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.debug("Marking the joined UnitOfWork as rollback only due to {}", e.getClass().getSimpleName());
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }
}
