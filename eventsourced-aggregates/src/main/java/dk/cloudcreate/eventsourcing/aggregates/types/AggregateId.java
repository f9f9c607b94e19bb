package dk.cloudcreate.eventsourcing.aggregates.types;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Identifies exactly one aggregate instance and thereby one event stream.<br>
 * Concrete aggregate id types extend this class, e.g.:
 * <pre>{@code
 * public class OrderId extends AggregateId {
 *     @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
 *     public OrderId(UUID value) {
 *         super(value);
 *     }
 *
 *     public static OrderId random() {
 *         return new OrderId(UUID.randomUUID());
 *     }
 * }
 * }</pre>
 * Two aggregate ids are equal when they are of the same concrete type and wrap the same {@link UUID}
 */
public abstract class AggregateId implements Comparable<AggregateId> {
    /**
     * The zero UUID, which is the value of an empty aggregate id
     */
    public static final UUID EMPTY_VALUE = new UUID(0L, 0L);

    private final UUID value;

    protected AggregateId(UUID value) {
        this.value = requireNonNull(value, "No aggregate id value provided");
    }

    @JsonValue
    public UUID value() {
        return value;
    }

    /**
     * @return true if the wrapped value is the zero UUID
     */
    public boolean isEmpty() {
        return EMPTY_VALUE.equals(value);
    }

    @Override
    public int compareTo(AggregateId o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((AggregateId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
