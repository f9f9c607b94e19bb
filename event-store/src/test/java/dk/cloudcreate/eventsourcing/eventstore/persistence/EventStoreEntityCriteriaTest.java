package dk.cloudcreate.eventsourcing.eventstore.persistence;

import com.fasterxml.jackson.databind.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.junit.jupiter.api.*;

import java.time.*;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventStoreEntityCriteria")
class EventStoreEntityCriteriaTest {
    private static final ObjectMapper   objectMapper = new ObjectMapper();
    private static final OffsetDateTime createdOn    = OffsetDateTime.of(2023, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void all_matches_every_entity_without_in_memory_filtering() {
        var criteria = EventStoreEntityCriteria.all();

        assertThat(criteria.matches(event(1, "OrderPlaced", "{}"), this::readTree)).isTrue();
        assertThat(criteria.requiresInMemoryFiltering()).isFalse();
        assertThat(criteria.count()).isEmpty();
        assertThat(criteria.isNewestFirst()).isFalse();
    }

    @Test
    void exact_criteria() {
        var entity = event(2, "OrderPlaced", "{}");

        assertThat(EventStoreEntityCriteria.builder().aggregateId("order-1").build().matches(entity, this::readTree)).isTrue();
        assertThat(EventStoreEntityCriteria.builder().aggregateId("order-2").build().matches(entity, this::readTree)).isFalse();
        assertThat(EventStoreEntityCriteria.builder().aggregateType("Orders").build().matches(entity, this::readTree)).isTrue();
        assertThat(EventStoreEntityCriteria.builder().active(false).build().matches(entity, this::readTree)).isFalse();
        assertThat(EventStoreEntityCriteria.builder().deleted(false).build().matches(entity, this::readTree)).isTrue();
        assertThat(EventStoreEntityCriteria.builder().versionRange(LongRange.between(0, 2)).build().matches(entity, this::readTree)).isTrue();
        assertThat(EventStoreEntityCriteria.builder().versionRange(LongRange.from(3)).build().matches(entity, this::readTree)).isFalse();
    }

    @Test
    void patterns_must_match_the_entire_name() {
        var entity = event(0, "OrderPlaced", "{}");

        var prefix = EventStoreEntityCriteria.builder().eventTypeNamePattern("Order").build();
        var full   = EventStoreEntityCriteria.builder().eventTypeNamePattern("Order.*").build();

        assertThat(prefix.matches(entity, this::readTree)).isFalse();
        assertThat(full.matches(entity, this::readTree)).isTrue();
        assertThat(full.requiresInMemoryFiltering()).isTrue();
        assertThat(EventStoreEntityCriteria.builder().aggregateTypeNamePattern("Ord.rs").build().matches(entity, this::readTree)).isTrue();
    }

    @Test
    void the_event_data_predicate_receives_the_parsed_payload() {
        var entity = event(0, "OrderPlaced", "{\"sku\":\"sku-1\",\"quantity\":3}");

        var matching    = EventStoreEntityCriteria.builder().eventDataPredicate(json -> json.get("quantity").asInt() > 2).build();
        var nonMatching = EventStoreEntityCriteria.builder().eventDataPredicate(json -> "sku-2".equals(json.get("sku").asText())).build();

        assertThat(matching.matches(entity, this::readTree)).isTrue();
        assertThat(nonMatching.matches(entity, this::readTree)).isFalse();
        assertThat(matching.requiresInMemoryFiltering()).isTrue();
    }

    @Test
    void an_updated_on_range_excludes_entities_that_were_never_updated() {
        var entity = event(0, "OrderPlaced", "{}");

        var criteria = EventStoreEntityCriteria.builder().updatedOn(createdOn.minusDays(1), null).build();

        assertThat(criteria.matches(entity, this::readTree)).isFalse();
    }

    @Test
    void created_on_range_is_inclusive() {
        var entity = event(0, "OrderPlaced", "{}");

        assertThat(EventStoreEntityCriteria.builder().createdOn(createdOn, createdOn).build().matches(entity, this::readTree)).isTrue();
        assertThat(EventStoreEntityCriteria.builder().createdOn(createdOn.plusNanos(1000), null).build().matches(entity, this::readTree)).isFalse();
    }

    @Test
    void count_must_be_positive() {
        assertThatThrownBy(() -> EventStoreEntityCriteria.builder().count(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void to_builder_keeps_all_criteria() {
        var criteria = EventStoreEntityCriteria.builder()
                                               .aggregateId("order-1")
                                               .eventTypeNamePattern("Order.*")
                                               .count(5)
                                               .newestFirst(true)
                                               .build();

        var copy = criteria.toBuilder().aggregateType("Orders").build();

        assertThat(copy.aggregateId()).contains("order-1");
        assertThat(copy.aggregateType()).contains("Orders");
        assertThat(copy.eventTypeNamePattern()).isPresent();
        assertThat(copy.count()).contains(5);
        assertThat(copy.isNewestFirst()).isTrue();
        assertThat(criteria.aggregateType()).isEmpty();
    }

    private DomainEventEntity event(long version, String eventTypeName, String eventData) {
        return new DomainEventEntity(EventStoreEntity.newEntityId(),
                                     "event-" + version,
                                     "order-1",
                                     "Orders",
                                     version,
                                     "dk.cloudcreate.eventsourcing.orders." + eventTypeName,
                                     eventTypeName,
                                     eventData,
                                     createdOn,
                                     null,
                                     true,
                                     false);
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
