package dk.cloudcreate.eventsourcing.common.transaction;

/**
 * {@link UnitOfWorkFactory} that creates and tracks {@link HandleAwareUnitOfWork}'s
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
}
