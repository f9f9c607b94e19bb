package dk.cloudcreate.eventsourcing.eventstore.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import dk.cloudcreate.essentials.types.LongRange;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.function.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Filter for {@link EventStoreEntity} queries. Every criterion is optional and all criteria that are present must match.<br>
 * Exact criteria (aggregate id, aggregate type, flags, time and version ranges) can be translated into a storage query, whereas
 * the name patterns and the payload predicate are evaluated against the loaded entities
 * (see {@link #requiresInMemoryFiltering()}).<br>
 * Example:
 * <pre>{@code
 * var criteria = EventStoreEntityCriteria.builder()
 *                                        .aggregateId(orderId.toString())
 *                                        .eventTypeNamePattern("Order.*")
 *                                        .eventDataPredicate(json -> json.path("quantity").asInt() > 10)
 *                                        .count(5)
 *                                        .build();
 * }</pre>
 */
public final class EventStoreEntityCriteria {
    private static final EventStoreEntityCriteria ALL = builder().build();

    private final String              aggregateId;
    private final String              aggregateType;
    private final Pattern             aggregateTypeNamePattern;
    private final Pattern             eventTypeNamePattern;
    private final Boolean             active;
    private final Boolean             deleted;
    private final OffsetDateTime      startCreatedOn;
    private final OffsetDateTime      endCreatedOn;
    private final OffsetDateTime      startUpdatedOn;
    private final OffsetDateTime      endUpdatedOn;
    private final LongRange           versionRange;
    private final Predicate<JsonNode> eventDataPredicate;
    private final Integer             count;
    private final boolean             newestFirst;

    private EventStoreEntityCriteria(Builder builder) {
        this.aggregateId = builder.aggregateId;
        this.aggregateType = builder.aggregateType;
        this.aggregateTypeNamePattern = builder.aggregateTypeNamePattern;
        this.eventTypeNamePattern = builder.eventTypeNamePattern;
        this.active = builder.active;
        this.deleted = builder.deleted;
        this.startCreatedOn = builder.startCreatedOn;
        this.endCreatedOn = builder.endCreatedOn;
        this.startUpdatedOn = builder.startUpdatedOn;
        this.endUpdatedOn = builder.endUpdatedOn;
        this.versionRange = builder.versionRange;
        this.eventDataPredicate = builder.eventDataPredicate;
        this.count = builder.count;
        this.newestFirst = builder.newestFirst;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return criteria that match every entity
     */
    public static EventStoreEntityCriteria all() {
        return ALL;
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.aggregateId = aggregateId;
        builder.aggregateType = aggregateType;
        builder.aggregateTypeNamePattern = aggregateTypeNamePattern;
        builder.eventTypeNamePattern = eventTypeNamePattern;
        builder.active = active;
        builder.deleted = deleted;
        builder.startCreatedOn = startCreatedOn;
        builder.endCreatedOn = endCreatedOn;
        builder.startUpdatedOn = startUpdatedOn;
        builder.endUpdatedOn = endUpdatedOn;
        builder.versionRange = versionRange;
        builder.eventDataPredicate = eventDataPredicate;
        builder.count = count;
        builder.newestFirst = newestFirst;
        return builder;
    }

    public Optional<String> aggregateId() {
        return Optional.ofNullable(aggregateId);
    }

    public Optional<String> aggregateType() {
        return Optional.ofNullable(aggregateType);
    }

    public Optional<Pattern> aggregateTypeNamePattern() {
        return Optional.ofNullable(aggregateTypeNamePattern);
    }

    public Optional<Pattern> eventTypeNamePattern() {
        return Optional.ofNullable(eventTypeNamePattern);
    }

    public Optional<Boolean> active() {
        return Optional.ofNullable(active);
    }

    public Optional<Boolean> deleted() {
        return Optional.ofNullable(deleted);
    }

    public Optional<OffsetDateTime> startCreatedOn() {
        return Optional.ofNullable(startCreatedOn);
    }

    public Optional<OffsetDateTime> endCreatedOn() {
        return Optional.ofNullable(endCreatedOn);
    }

    public Optional<OffsetDateTime> startUpdatedOn() {
        return Optional.ofNullable(startUpdatedOn);
    }

    public Optional<OffsetDateTime> endUpdatedOn() {
        return Optional.ofNullable(endUpdatedOn);
    }

    /**
     * Only applies to {@link VersionedEntity}'s
     */
    public Optional<LongRange> versionRange() {
        return Optional.ofNullable(versionRange);
    }

    public Optional<Predicate<JsonNode>> eventDataPredicate() {
        return Optional.ofNullable(eventDataPredicate);
    }

    /**
     * @return the maximum number of entities to return
     */
    public Optional<Integer> count() {
        return Optional.ofNullable(count);
    }

    /**
     * @return true if the entities should be returned in descending version/insertion order
     */
    public boolean isNewestFirst() {
        return newestFirst;
    }

    /**
     * @return true if some of the criteria can only be evaluated against loaded entities
     */
    public boolean requiresInMemoryFiltering() {
        return aggregateTypeNamePattern != null || eventTypeNamePattern != null || eventDataPredicate != null;
    }

    /**
     * Evaluate every criterion except {@link #count()} against the entity
     *
     * @param entity     the entity
     * @param jsonReader parses {@link EventStoreEntity#eventData()}, only called when an {@link #eventDataPredicate()} is present
     * @return true if the entity matches
     */
    public boolean matches(EventStoreEntity entity, Function<String, JsonNode> jsonReader) {
        requireNonNull(entity, "No entity provided");
        if (aggregateId != null && !aggregateId.equals(entity.aggregateId())) return false;
        if (aggregateType != null && !aggregateType.equals(entity.aggregateTypeName())) return false;
        if (active != null && active != entity.isActive()) return false;
        if (deleted != null && deleted != entity.isDeleted()) return false;
        if (!isWithin(entity.createdOn(), startCreatedOn, endCreatedOn)) return false;
        if (startUpdatedOn != null || endUpdatedOn != null) {
            if (entity.updatedOn().isEmpty() || !isWithin(entity.updatedOn().get(), startUpdatedOn, endUpdatedOn)) return false;
        }
        if (versionRange != null && entity instanceof VersionedEntity) {
            var version = ((VersionedEntity) entity).version();
            if (version < versionRange.fromInclusive) return false;
            if (versionRange.isClosedRange() && version > versionRange.toInclusive) return false;
        }
        return matchesInMemoryCriteria(entity, jsonReader);
    }

    /**
     * Evaluate the name patterns and the payload predicate against the entity
     */
    public boolean matchesInMemoryCriteria(EventStoreEntity entity, Function<String, JsonNode> jsonReader) {
        if (aggregateTypeNamePattern != null && !aggregateTypeNamePattern.matcher(entity.aggregateTypeName()).matches()) return false;
        if (eventTypeNamePattern != null && !eventTypeNamePattern.matcher(entity.eventTypeName()).matches()) return false;
        if (eventDataPredicate != null) {
            requireNonNull(jsonReader, "No jsonReader provided");
            return eventDataPredicate.test(jsonReader.apply(entity.eventData()));
        }
        return true;
    }

    private static boolean isWithin(OffsetDateTime timestamp, OffsetDateTime startInclusive, OffsetDateTime endInclusive) {
        if (startInclusive != null && timestamp.isBefore(startInclusive)) return false;
        return endInclusive == null || !timestamp.isAfter(endInclusive);
    }

    @Override
    public String toString() {
        return "EventStoreEntityCriteria{" +
                "aggregateId=" + aggregateId +
                ", aggregateType=" + aggregateType +
                ", aggregateTypeNamePattern=" + aggregateTypeNamePattern +
                ", eventTypeNamePattern=" + eventTypeNamePattern +
                ", active=" + active +
                ", deleted=" + deleted +
                ", versionRange=" + versionRange +
                ", hasEventDataPredicate=" + (eventDataPredicate != null) +
                ", count=" + count +
                ", newestFirst=" + newestFirst +
                '}';
    }

    public static final class Builder {
        private String              aggregateId;
        private String              aggregateType;
        private Pattern             aggregateTypeNamePattern;
        private Pattern             eventTypeNamePattern;
        private Boolean             active;
        private Boolean             deleted;
        private OffsetDateTime      startCreatedOn;
        private OffsetDateTime      endCreatedOn;
        private OffsetDateTime      startUpdatedOn;
        private OffsetDateTime      endUpdatedOn;
        private LongRange           versionRange;
        private Predicate<JsonNode> eventDataPredicate;
        private Integer             count;
        private boolean             newestFirst;

        private Builder() {
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /**
         * @param regex regular expression the whole aggregate type name must match
         */
        public Builder aggregateTypeNamePattern(String regex) {
            this.aggregateTypeNamePattern = regex != null ? Pattern.compile(regex) : null;
            return this;
        }

        /**
         * @param regex regular expression the whole (simple) event type name must match
         */
        public Builder eventTypeNamePattern(String regex) {
            this.eventTypeNamePattern = regex != null ? Pattern.compile(regex) : null;
            return this;
        }

        public Builder active(Boolean active) {
            this.active = active;
            return this;
        }

        public Builder deleted(Boolean deleted) {
            this.deleted = deleted;
            return this;
        }

        public Builder createdOn(OffsetDateTime startInclusive, OffsetDateTime endInclusive) {
            this.startCreatedOn = startInclusive;
            this.endCreatedOn = endInclusive;
            return this;
        }

        public Builder updatedOn(OffsetDateTime startInclusive, OffsetDateTime endInclusive) {
            this.startUpdatedOn = startInclusive;
            this.endUpdatedOn = endInclusive;
            return this;
        }

        public Builder versionRange(LongRange versionRange) {
            this.versionRange = versionRange;
            return this;
        }

        public Builder eventDataPredicate(Predicate<JsonNode> eventDataPredicate) {
            this.eventDataPredicate = eventDataPredicate;
            return this;
        }

        public Builder count(Integer count) {
            if (count != null) {
                requireTrue(count >= 1, "count must be 1 or larger");
            }
            this.count = count;
            return this;
        }

        public Builder newestFirst(boolean newestFirst) {
            this.newestFirst = newestFirst;
            return this;
        }

        public EventStoreEntityCriteria build() {
            return new EventStoreEntityCriteria(this);
        }
    }
}
