package dk.cloudcreate.eventsourcing.aggregates.notifications;

import dk.cloudcreate.eventsourcing.aggregates.events.Notification;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The pending {@link Notification}'s of a single aggregate instance. Not thread safe.
 *
 * @param <ID> the aggregate id type
 */
public final class NotificationOutbox<ID extends AggregateId> {
    private final List<Notification<ID>> pendingNotifications = new ArrayList<>();

    /**
     * @param notification the notification to queue
     * @throws DuplicateNotificationException if a notification with the same event id is already queued
     */
    public void add(Notification<ID> notification) {
        requireNonNull(notification, "You must supply a notification");
        if (pendingNotifications.stream().anyMatch(pending -> pending.eventId().equals(notification.eventId()))) {
            throw new DuplicateNotificationException(notification.eventId());
        }
        pendingNotifications.add(notification);
    }

    /**
     * @return the pending notifications ordered by when they occurred
     */
    public List<Notification<ID>> notifications() {
        var notifications = new ArrayList<>(pendingNotifications);
        notifications.sort(Comparator.comparing(Notification::occurredOn));
        return Collections.unmodifiableList(notifications);
    }

    public boolean hasNotifications() {
        return !pendingNotifications.isEmpty();
    }

    public void markAsCommitted() {
        pendingNotifications.clear();
    }
}
