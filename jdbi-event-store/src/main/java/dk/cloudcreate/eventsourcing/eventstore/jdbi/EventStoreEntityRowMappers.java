package dk.cloudcreate.eventsourcing.eventstore.jdbi;

import dk.cloudcreate.eventsourcing.eventstore.persistence.*;
import org.jdbi.v3.core.mapper.RowMapper;

import java.time.OffsetDateTime;

/**
 * {@link RowMapper}'s for the entities stored by the {@link JdbiEventStoreEntityPersistence}
 */
final class EventStoreEntityRowMappers {
    static final RowMapper<DomainEventEntity> DOMAIN_EVENT = (rs, ctx) -> new DomainEventEntity(rs.getString("entity_id"),
                                                                                                rs.getString("event_id"),
                                                                                                rs.getString("aggregate_id"),
                                                                                                rs.getString("aggregate_type_name"),
                                                                                                rs.getLong("aggregate_version"),
                                                                                                rs.getString("event_type_full_name"),
                                                                                                rs.getString("event_type_name"),
                                                                                                rs.getString("event_data"),
                                                                                                rs.getObject("created_on", OffsetDateTime.class),
                                                                                                rs.getObject("updated_on", OffsetDateTime.class),
                                                                                                rs.getBoolean("is_active"),
                                                                                                rs.getBoolean("is_deleted"));

    static final RowMapper<NotificationEntity> NOTIFICATION = (rs, ctx) -> new NotificationEntity(rs.getString("entity_id"),
                                                                                                  rs.getString("event_id"),
                                                                                                  rs.getString("aggregate_id"),
                                                                                                  rs.getString("aggregate_type_name"),
                                                                                                  rs.getString("event_type_full_name"),
                                                                                                  rs.getString("event_type_name"),
                                                                                                  rs.getString("event_data"),
                                                                                                  rs.getObject("created_on", OffsetDateTime.class),
                                                                                                  rs.getObject("updated_on", OffsetDateTime.class),
                                                                                                  rs.getBoolean("is_active"),
                                                                                                  rs.getBoolean("is_deleted"));

    static final RowMapper<SnapShotEntity> SNAPSHOT = (rs, ctx) -> new SnapShotEntity(rs.getString("entity_id"),
                                                                                      rs.getString("aggregate_id"),
                                                                                      rs.getString("aggregate_type_name"),
                                                                                      rs.getLong("aggregate_version"),
                                                                                      rs.getString("event_type_full_name"),
                                                                                      rs.getString("event_type_name"),
                                                                                      rs.getString("event_data"),
                                                                                      rs.getObject("created_on", OffsetDateTime.class),
                                                                                      rs.getObject("updated_on", OffsetDateTime.class),
                                                                                      rs.getBoolean("is_active"),
                                                                                      rs.getBoolean("is_deleted"));

    private EventStoreEntityRowMappers() {
    }
}
