package dk.cloudcreate.eventsourcing.aggregates.snapshot;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.aggregates.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A {@link Memento} of an aggregate at a given version
 *
 * @param <ID> the aggregate id type
 */
public final class SnapShot<ID extends AggregateId> {
    private final ID               aggregateId;
    private final AggregateVersion version;
    private final Memento          memento;

    public SnapShot(ID aggregateId, AggregateVersion version, Memento memento) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.version = requireNonNull(version, "No version provided");
        this.memento = requireNonNull(memento, "No memento provided");
    }

    /**
     * Capture the current state of the aggregate
     *
     * @param aggregate an aggregate that implements {@link Originator}
     * @throws AggregateException if the aggregate doesn't implement {@link Originator}
     */
    public static <ID extends AggregateId> SnapShot<ID> of(Aggregate<ID, ?> aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        if (!(aggregate instanceof Originator)) {
            throw new AggregateException(msg("Aggregate '{}' doesn't implement {}",
                                             aggregate.getClass().getName(),
                                             Originator.class.getSimpleName()));
        }
        requireNonNull(aggregate.aggregateId(), msg("Cannot snapshot aggregate '{}' as it doesn't have an aggregateId", aggregate.getClass().getName()));
        var memento = ((Originator<?>) aggregate).createMemento();
        return new SnapShot<>(aggregate.aggregateId(), aggregate.version(), memento);
    }

    public ID aggregateId() {
        return aggregateId;
    }

    public AggregateVersion version() {
        return version;
    }

    public Memento memento() {
        return memento;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SnapShot<?> snapShot = (SnapShot<?>) o;
        return aggregateId.equals(snapShot.aggregateId) && version.equals(snapShot.version) && memento.equals(snapShot.memento);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version, memento);
    }

    @Override
    public String toString() {
        return "SnapShot{" +
                "aggregateId=" + aggregateId +
                ", version=" + version +
                ", memento=" + memento.getClass().getSimpleName() +
                '}';
    }
}
