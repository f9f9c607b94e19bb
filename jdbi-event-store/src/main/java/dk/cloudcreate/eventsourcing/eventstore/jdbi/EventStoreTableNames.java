package dk.cloudcreate.eventsourcing.eventstore.jdbi;

import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;

import java.util.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Names of the tables the {@link JdbiEventStoreEntityPersistence} stores its entities in.<br>
 * The names are inserted directly into the SQL statements, so they're restricted to plain SQL identifiers
 * (a letter or underscore followed by letters, digits or underscores, at most 63 characters).
 */
public final class EventStoreTableNames {
    private static final Pattern VALID_IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");

    public final String domainEventsTableName;
    public final String notificationsTableName;
    public final String snapShotsTableName;

    public EventStoreTableNames(String domainEventsTableName, String notificationsTableName, String snapShotsTableName) {
        this.domainEventsTableName = validate(domainEventsTableName, "domainEventsTableName");
        this.notificationsTableName = validate(notificationsTableName, "notificationsTableName");
        this.snapShotsTableName = validate(snapShotsTableName, "snapShotsTableName");
        if (new HashSet<>(List.of(domainEventsTableName.toLowerCase(Locale.ROOT),
                                  notificationsTableName.toLowerCase(Locale.ROOT),
                                  snapShotsTableName.toLowerCase(Locale.ROOT))).size() != 3) {
            throw new EventStoreException(msg("The table names must be different: '{}', '{}', '{}'",
                                              domainEventsTableName,
                                              notificationsTableName,
                                              snapShotsTableName));
        }
    }

    /**
     * <code>domain_events</code>, <code>notifications</code> and <code>snapshots</code>
     */
    public static EventStoreTableNames defaultTableNames() {
        return new EventStoreTableNames("domain_events", "notifications", "snapshots");
    }

    /**
     * The default table names prefixed with <code>prefix</code> and an underscore, e.g. <code>orders_domain_events</code>
     */
    public static EventStoreTableNames defaultTableNamesWithPrefix(String prefix) {
        requireNonNull(prefix, "No prefix provided");
        return new EventStoreTableNames(prefix + "_domain_events", prefix + "_notifications", prefix + "_snapshots");
    }

    public List<String> all() {
        return List.of(domainEventsTableName, notificationsTableName, snapShotsTableName);
    }

    private static String validate(String tableName, String description) {
        requireNonNull(tableName, msg("No {} provided", description));
        if (!VALID_IDENTIFIER.matcher(tableName).matches()) {
            throw new EventStoreException(msg("Invalid {} '{}'. Only letters, digits and underscores are allowed and the name must start with a letter or underscore",
                                              description,
                                              tableName));
        }
        return tableName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStoreTableNames)) return false;
        var that = (EventStoreTableNames) o;
        return domainEventsTableName.equals(that.domainEventsTableName) &&
                notificationsTableName.equals(that.notificationsTableName) &&
                snapShotsTableName.equals(that.snapShotsTableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domainEventsTableName, notificationsTableName, snapShotsTableName);
    }

    @Override
    public String toString() {
        return "EventStoreTableNames{" +
                "domainEventsTableName='" + domainEventsTableName + '\'' +
                ", notificationsTableName='" + notificationsTableName + '\'' +
                ", snapShotsTableName='" + snapShotsTableName + '\'' +
                '}';
    }
}
