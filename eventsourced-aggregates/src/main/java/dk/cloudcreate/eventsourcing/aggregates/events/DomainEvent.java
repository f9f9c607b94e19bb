package dk.cloudcreate.eventsourcing.aggregates.events;

import dk.cloudcreate.eventsourcing.aggregates.types.*;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A fact raised by an aggregate. Domain events are persisted and published immediately when the aggregate
 * is appended to the event store.<br>
 * Example:
 * <pre>{@code
 * public class OrderPlaced extends DomainEvent<OrderId> {
 *     private String sku;
 *     private int    quantity;
 *
 *     OrderPlaced() {
 *     }
 *
 *     public OrderPlaced(OrderId orderId, AggregateVersion version, String sku, int quantity) {
 *         super(orderId, version);
 *         this.sku = sku;
 *         this.quantity = quantity;
 *     }
 * }
 * }</pre>
 *
 * @param <ID> the type of aggregate id the event relates to
 */
public abstract class DomainEvent<ID extends AggregateId> extends Event<ID> {
    private AggregateVersion version;

    protected DomainEvent() {
    }

    protected DomainEvent(ID aggregateId, AggregateVersion version) {
        super(aggregateId);
        this.version = requireNonNull(version, "No version provided");
    }

    protected DomainEvent(ID aggregateId, AggregateVersion version, EventId eventId, OffsetDateTime occurredOn) {
        super(aggregateId, eventId, occurredOn);
        this.version = requireNonNull(version, "No version provided");
    }

    /**
     * @return the version the aggregate has after applying this event
     */
    public AggregateVersion version() {
        return version;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId() +
                ", version=" + version +
                ", eventId=" + eventId() +
                '}';
    }
}
