package dk.cloudcreate.eventsourcing.aggregates.notifications;

import dk.cloudcreate.eventsourcing.aggregates.AggregateException;
import dk.cloudcreate.eventsourcing.aggregates.types.EventId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a notification with an already queued {@link EventId} is added to a {@link NotificationOutbox}
 */
public class DuplicateNotificationException extends AggregateException {
    public final EventId eventId;

    public DuplicateNotificationException(EventId eventId) {
        super(msg("A notification with id '{}' already exists", eventId));
        this.eventId = eventId;
    }
}
