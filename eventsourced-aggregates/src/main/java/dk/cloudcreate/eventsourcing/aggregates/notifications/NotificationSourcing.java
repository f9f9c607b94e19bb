package dk.cloudcreate.eventsourcing.aggregates.notifications;

import dk.cloudcreate.eventsourcing.aggregates.events.Notification;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateId;

import java.util.List;

/**
 * Capability for aggregates that queue {@link Notification}'s for outbox style publishing.<br>
 * The aggregate only has to hold on to a {@link NotificationOutbox}:
 * <pre>{@code
 * public class Order extends AggregateRoot<OrderId, Order> implements NotificationSourcing<OrderId> {
 *     private NotificationOutbox<OrderId> notificationOutbox;
 *
 *     @Override
 *     public NotificationOutbox<OrderId> notificationOutbox() {
 *         if (notificationOutbox == null) {
 *             notificationOutbox = new NotificationOutbox<>();
 *         }
 *         return notificationOutbox;
 *     }
 * }
 * }</pre>
 *
 * @param <ID> the aggregate id type
 */
public interface NotificationSourcing<ID extends AggregateId> {
    NotificationOutbox<ID> notificationOutbox();

    /**
     * @throws DuplicateNotificationException if a notification with the same event id is already pending
     */
    default void addNotification(Notification<ID> notification) {
        notificationOutbox().add(notification);
    }

    default List<Notification<ID>> notifications() {
        return notificationOutbox().notifications();
    }

    default void markNotificationsAsCommitted() {
        notificationOutbox().markAsCommitted();
    }
}
