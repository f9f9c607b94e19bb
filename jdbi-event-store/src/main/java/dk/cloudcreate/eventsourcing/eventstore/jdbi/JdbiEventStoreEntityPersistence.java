package dk.cloudcreate.eventsourcing.eventstore.jdbi;

import dk.cloudcreate.essentials.shared.Exceptions;
import dk.cloudcreate.eventsourcing.common.transaction.*;
import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;
import dk.cloudcreate.eventsourcing.eventstore.persistence.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JSONSerializer;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.slf4j.*;

import java.sql.SQLException;
import java.util.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * {@link EventStoreEntityPersistence} that stores {@link DomainEventEntity}, {@link NotificationEntity} and {@link SnapShotEntity}
 * rows in three tables (see {@link EventStoreTableNames}) using Jdbi. The SQL is compatible with PostgreSQL and H2.<br>
 * <br>
 * Every operation joins the {@link UnitOfWork} active on the calling thread or runs in its own {@link UnitOfWork}.<br>
 * The rows keep their insertion order in the <code>global_order</code> identity column. A unique constraint on
 * aggregate type, aggregate id and version makes a concurrent append of the same domain event version fail with
 * an {@link OptimisticAppendToEventStoreException}.<br>
 * Exact criteria are evaluated by the database, name patterns and payload predicates are evaluated on the loaded rows.
 */
public class JdbiEventStoreEntityPersistence implements EventStoreEntityPersistence {
    private static final Logger log                             = LoggerFactory.getLogger(JdbiEventStoreEntityPersistence.class);
    private static final String UNIQUE_VIOLATION_SQL_STATE      = "23505";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final JSONSerializer                                                jsonSerializer;
    private final EventStoreTableNames                                          tableNames;

    /**
     * Create the persistence using {@link EventStoreTableNames#defaultTableNames()}
     */
    public JdbiEventStoreEntityPersistence(JdbiUnitOfWorkFactory unitOfWorkFactory, JSONSerializer jsonSerializer) {
        this(requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided").getJdbi(),
             unitOfWorkFactory,
             jsonSerializer,
             EventStoreTableNames.defaultTableNames());
    }

    /**
     * Create the persistence and the tables it uses (if they don't already exist)
     *
     * @param jdbi              the jdbi instance, the {@link EventStoreSqlLogger} is registered on it
     * @param unitOfWorkFactory the unit of work factory that provides the {@link Handle}
     * @param jsonSerializer    used to parse the payloads when a query has an event data predicate
     * @param tableNames        the table names
     */
    public JdbiEventStoreEntityPersistence(Jdbi jdbi,
                                           HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                                           JSONSerializer jsonSerializer,
                                           EventStoreTableNames tableNames) {
        requireNonNull(jdbi, "No jdbi instance provided");
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.tableNames = requireNonNull(tableNames, "No tableNames provided");
        jdbi.setSqlLogger(new EventStoreSqlLogger());
        initializeStorage();
    }

    public EventStoreTableNames tableNames() {
        return tableNames;
    }

    private void initializeStorage() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            createTable(handle, tableNames.domainEventsTableName, true, true);
            createTable(handle, tableNames.notificationsTableName, true, false);
            createTable(handle, tableNames.snapShotsTableName, false, true);
        });
    }

    private void createTable(Handle handle, String tableName, boolean hasEventId, boolean hasVersion) {
        log.info("Initializing event store table '{}'", tableName);
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "    global_order BIGINT GENERATED BY DEFAULT AS IDENTITY,\n" +
                                    "    entity_id VARCHAR(64) NOT NULL PRIMARY KEY,\n" +
                                    "{:eventIdColumn}" +
                                    "    aggregate_id VARCHAR(255) NOT NULL,\n" +
                                    "    aggregate_type_name VARCHAR(255) NOT NULL,\n" +
                                    "{:versionColumn}" +
                                    "    event_type_full_name VARCHAR(1024) NOT NULL,\n" +
                                    "    event_type_name VARCHAR(255) NOT NULL,\n" +
                                    "    event_data TEXT NOT NULL,\n" +
                                    "    created_on TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "    updated_on TIMESTAMP WITH TIME ZONE,\n" +
                                    "    is_active BOOLEAN NOT NULL,\n" +
                                    "    is_deleted BOOLEAN NOT NULL{:uniqueVersion}\n" +
                                    ")",
                            arg("tableName", tableName),
                            arg("eventIdColumn", hasEventId ? "    event_id VARCHAR(255) NOT NULL,\n" : ""),
                            arg("versionColumn", hasVersion ? "    aggregate_version BIGINT NOT NULL,\n" : ""),
                            arg("uniqueVersion", hasEventId && hasVersion ?
                                                 bind(",\n    CONSTRAINT {:tableName}_version_key UNIQUE (aggregate_type_name, aggregate_id, aggregate_version)",
                                                      arg("tableName", tableName)) :
                                                 "")));
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:tableName}_aggregate_idx ON {:tableName} (aggregate_type_name, aggregate_id)",
                            arg("tableName", tableName)));
    }

    /**
     * Drop and recreate the tables. All stored entities are lost.
     */
    public void resetStorage() {
        log.info("Resetting event store tables {}", tableNames.all());
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> tableNames.all()
                                                                  .forEach(tableName -> unitOfWork.handle().execute("DROP TABLE IF EXISTS " + tableName)));
        initializeStorage();
    }

    @Override
    public <ENTITY extends EventStoreEntity> void insert(ENTITY entity) {
        requireNonNull(entity, "No entity provided");
        var tableName = tableNameFor(entity.getClass());
        try {
            unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
                var update = unitOfWork.handle()
                                       .createUpdate(insertSql(entity, tableName))
                                       .bind("entityId", entity.entityId())
                                       .bind("aggregateId", entity.aggregateId())
                                       .bind("aggregateTypeName", entity.aggregateTypeName())
                                       .bind("eventTypeFullName", entity.eventTypeFullName())
                                       .bind("eventTypeName", entity.eventTypeName())
                                       .bind("eventData", entity.eventData())
                                       .bind("createdOn", entity.createdOn())
                                       .bind("active", entity.isActive())
                                       .bind("deleted", entity.isDeleted());
                if (entity instanceof DomainEventEntity) {
                    update.bind("eventId", ((DomainEventEntity) entity).eventId());
                } else if (entity instanceof NotificationEntity) {
                    update.bind("eventId", ((NotificationEntity) entity).eventId());
                }
                if (entity instanceof VersionedEntity) {
                    update.bind("version", ((VersionedEntity) entity).version());
                }
                update.execute();
            });
            log.trace("[{}] Inserted {} with id '{}' into '{}'", entity.aggregateTypeName(), entity.getClass().getSimpleName(), entity.entityId(), tableName);
        } catch (RuntimeException e) {
            var cause = Exceptions.getRootCause(e);
            if (entity instanceof DomainEventEntity && isUniqueViolation(cause)) {
                throw new OptimisticAppendToEventStoreException(msg("[{}] Optimistic Concurrency Exception Failed to Append event with version {} related to aggregate with id '{}'. Details: {}",
                                                                    entity.aggregateTypeName(),
                                                                    ((DomainEventEntity) entity).version(),
                                                                    entity.aggregateId(),
                                                                    cause.getMessage()), e);
            }
            throw new AppendToEventStoreException(msg("[{}] Failed to Append {} related to aggregate with id '{}'",
                                                      entity.aggregateTypeName(),
                                                      entity.getClass().getSimpleName(),
                                                      entity.aggregateId()), e);
        }
    }

    private static boolean isUniqueViolation(Throwable cause) {
        return cause instanceof SQLException && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) cause).getSQLState());
    }

    private static String insertSql(EventStoreEntity entity, String tableName) {
        var hasEventId = entity instanceof DomainEventEntity || entity instanceof NotificationEntity;
        var hasVersion = entity instanceof VersionedEntity;
        return bind("INSERT INTO {:tableName} (entity_id, {:eventIdColumn}aggregate_id, aggregate_type_name, {:versionColumn}event_type_full_name, event_type_name, event_data, created_on, is_active, is_deleted)\n" +
                            "VALUES (:entityId, {:eventIdValue}:aggregateId, :aggregateTypeName, {:versionValue}:eventTypeFullName, :eventTypeName, :eventData, :createdOn, :active, :deleted)",
                    arg("tableName", tableName),
                    arg("eventIdColumn", hasEventId ? "event_id, " : ""),
                    arg("eventIdValue", hasEventId ? ":eventId, " : ""),
                    arg("versionColumn", hasVersion ? "aggregate_version, " : ""),
                    arg("versionValue", hasVersion ? ":version, " : ""));
    }

    @Override
    public <ENTITY extends EventStoreEntity> Stream<ENTITY> query(Class<ENTITY> entityType, EventStoreEntityCriteria criteria) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(criteria, "No criteria provided");
        var tableName     = tableNameFor(entityType);
        var bindings      = new LinkedHashMap<String, Object>();
        var sql           = new StringBuilder(bind("SELECT * FROM {:tableName}", arg("tableName", tableName)))
                .append(whereClause(entityType, criteria, bindings))
                .append(orderByClause(entityType, criteria));
        var inMemoryLimit = criteria.requiresInMemoryFiltering();
        if (!inMemoryLimit && criteria.count().isPresent()) {
            sql.append(" LIMIT :limit");
            bindings.put("limit", criteria.count().get());
        }
        var entities = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                                 .createQuery(sql.toString())
                                                                                 .bindMap(bindings)
                                                                                 .map(rowMapperFor(entityType))
                                                                                 .list());
        log.trace("[{}] Loaded {} {}'s from '{}'", criteria.aggregateType().orElse("*"), entities.size(), entityType.getSimpleName(), tableName);
        if (!inMemoryLimit) {
            return entities.stream();
        }
        var matching = entities.stream()
                               .filter(entity -> criteria.matchesInMemoryCriteria(entity, jsonSerializer::readTree));
        return criteria.count().isPresent() ? matching.limit(criteria.count().get()) : matching;
    }

    @Override
    public <ENTITY extends EventStoreEntity> long count(Class<ENTITY> entityType, EventStoreEntityCriteria criteria) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(criteria, "No criteria provided");
        if (criteria.requiresInMemoryFiltering()) {
            return query(entityType, criteria.toBuilder().count(null).build()).count();
        }
        var bindings = new LinkedHashMap<String, Object>();
        var sql      = bind("SELECT COUNT(*) FROM {:tableName}", arg("tableName", tableNameFor(entityType))) + whereClause(entityType, criteria, bindings);
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(sql)
                                                                        .bindMap(bindings)
                                                                        .mapTo(Long.class)
                                                                        .one());
    }

    @Override
    public <ENTITY extends EventStoreEntity> boolean delete(Class<ENTITY> entityType, String entityId) {
        requireNonNull(entityType, "No entityType provided");
        requireNonNull(entityId, "No entityId provided");
        var tableName = tableNameFor(entityType);
        int deleted = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                               .createUpdate(bind("DELETE FROM {:tableName} WHERE entity_id = :entityId",
                                                                                                  arg("tableName", tableName)))
                                                                               .bind("entityId", entityId)
                                                                               .execute());
        log.trace("Deleted {} row(s) with entity id '{}' from '{}'", deleted, entityId, tableName);
        return deleted == 1;
    }

    private static String whereClause(Class<? extends EventStoreEntity> entityType, EventStoreEntityCriteria criteria, Map<String, Object> bindings) {
        var conditions = new ArrayList<String>();
        criteria.aggregateId().ifPresent(aggregateId -> {
            conditions.add("aggregate_id = :aggregateId");
            bindings.put("aggregateId", aggregateId);
        });
        criteria.aggregateType().ifPresent(aggregateType -> {
            conditions.add("aggregate_type_name = :aggregateTypeName");
            bindings.put("aggregateTypeName", aggregateType);
        });
        criteria.active().ifPresent(active -> {
            conditions.add("is_active = :active");
            bindings.put("active", active);
        });
        criteria.deleted().ifPresent(deleted -> {
            conditions.add("is_deleted = :deleted");
            bindings.put("deleted", deleted);
        });
        criteria.startCreatedOn().ifPresent(startCreatedOn -> {
            conditions.add("created_on >= :startCreatedOn");
            bindings.put("startCreatedOn", startCreatedOn);
        });
        criteria.endCreatedOn().ifPresent(endCreatedOn -> {
            conditions.add("created_on <= :endCreatedOn");
            bindings.put("endCreatedOn", endCreatedOn);
        });
        if (criteria.startUpdatedOn().isPresent() || criteria.endUpdatedOn().isPresent()) {
            conditions.add("updated_on IS NOT NULL");
        }
        criteria.startUpdatedOn().ifPresent(startUpdatedOn -> {
            conditions.add("updated_on >= :startUpdatedOn");
            bindings.put("startUpdatedOn", startUpdatedOn);
        });
        criteria.endUpdatedOn().ifPresent(endUpdatedOn -> {
            conditions.add("updated_on <= :endUpdatedOn");
            bindings.put("endUpdatedOn", endUpdatedOn);
        });
        if (VersionedEntity.class.isAssignableFrom(entityType)) {
            criteria.versionRange().ifPresent(versionRange -> {
                conditions.add("aggregate_version >= :versionFrom");
                bindings.put("versionFrom", versionRange.fromInclusive);
                if (versionRange.isClosedRange()) {
                    conditions.add("aggregate_version <= :versionTo");
                    bindings.put("versionTo", versionRange.toInclusive);
                }
            });
        }
        return conditions.isEmpty() ? "" : conditions.stream().collect(Collectors.joining(" AND ", " WHERE ", ""));
    }

    private static String orderByClause(Class<? extends EventStoreEntity> entityType, EventStoreEntityCriteria criteria) {
        var direction = criteria.isNewestFirst() ? "DESC" : "ASC";
        if (VersionedEntity.class.isAssignableFrom(entityType)) {
            return bind(" ORDER BY aggregate_version {:direction}, global_order {:direction}", arg("direction", direction));
        }
        return bind(" ORDER BY global_order {:direction}", arg("direction", direction));
    }

    private String tableNameFor(Class<? extends EventStoreEntity> entityType) {
        if (DomainEventEntity.class.equals(entityType)) {
            return tableNames.domainEventsTableName;
        } else if (NotificationEntity.class.equals(entityType)) {
            return tableNames.notificationsTableName;
        } else if (SnapShotEntity.class.equals(entityType)) {
            return tableNames.snapShotsTableName;
        }
        throw new EventStoreException(msg("Unsupported entity type '{}'", entityType.getName()));
    }

    @SuppressWarnings("unchecked")
    private static <ENTITY extends EventStoreEntity> RowMapper<ENTITY> rowMapperFor(Class<ENTITY> entityType) {
        if (DomainEventEntity.class.equals(entityType)) {
            return (RowMapper<ENTITY>) EventStoreEntityRowMappers.DOMAIN_EVENT;
        } else if (NotificationEntity.class.equals(entityType)) {
            return (RowMapper<ENTITY>) EventStoreEntityRowMappers.NOTIFICATION;
        }
        return (RowMapper<ENTITY>) EventStoreEntityRowMappers.SNAPSHOT;
    }
}
