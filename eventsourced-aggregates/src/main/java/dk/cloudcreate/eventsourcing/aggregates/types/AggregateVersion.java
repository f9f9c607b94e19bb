package dk.cloudcreate.eventsourcing.aggregates.types;

import dk.cloudcreate.essentials.types.LongType;

/**
 * The revision of an aggregate. Every applied event increases the version by exactly one, so the
 * version of an aggregate is the version of the last event it has applied.<br>
 * The first event of an aggregate has version 0.
 */
public class AggregateVersion extends LongType<AggregateVersion> {
    /**
     * Version of an aggregate that hasn't applied any events
     */
    public static final AggregateVersion NO_EVENTS_APPLIED = AggregateVersion.of(-1);
    public static final AggregateVersion FIRST_VERSION     = AggregateVersion.of(0);

    public AggregateVersion(Long value) {
        super(value);
    }

    public static AggregateVersion of(long value) {
        return new AggregateVersion(value);
    }

    public AggregateVersion next() {
        return plus(1);
    }

    public AggregateVersion plus(long delta) {
        return new AggregateVersion(longValue() + delta);
    }

    public AggregateVersion minus(long delta) {
        return new AggregateVersion(longValue() - delta);
    }

    public boolean isGreaterThan(AggregateVersion other) {
        return longValue() > other.longValue();
    }

    public boolean isLessThan(AggregateVersion other) {
        return longValue() < other.longValue();
    }

    /**
     * @return true if this version signals that no events have been applied
     */
    public boolean isNoEventsApplied() {
        return longValue() == NO_EVENTS_APPLIED.longValue();
    }
}
