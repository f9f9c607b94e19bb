package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.aggregates.OrderEvents.*;
import dk.cloudcreate.eventsourcing.aggregates.events.DomainEvent;
import dk.cloudcreate.eventsourcing.aggregates.notifications.*;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.Originator;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Order aggregate used to test {@link AggregateRoot}
 */
public class Order extends AggregateRoot<OrderId, Order> implements Originator<OrderMemento>, NotificationSourcing<OrderId> {
    Map<String, Integer> productAndQuantity;
    boolean              accepted;

    private NotificationOutbox<OrderId> notificationOutbox;

    public Order() {
    }

    public Order(OrderId orderId, String sku, int quantity) {
        requireNonNull(orderId, "You must provide an orderId");
        raiseEvent(new OrderPlaced(orderId, newVersion(), sku, quantity));
    }

    public void addProduct(String sku, int quantity) {
        if (accepted) {
            throw new IllegalStateException("Order is already accepted");
        }
        raiseEvent(new ProductAdded(aggregateId(), newVersion(), sku, quantity));
    }

    public void accept() {
        if (accepted) {
            return;
        }
        raiseEvent(new OrderAccepted(aggregateId(), newVersion()));
        addNotification(new OrderAcceptedNotification(aggregateId()));
    }

    /**
     * Order doesn't handle {@link OrderArchived}, so archiving always fails
     */
    public void archive() {
        raiseEvent(new OrderArchived(aggregateId(), newVersion()));
    }

    void raise(DomainEvent<OrderId> event) {
        raiseEvent(event);
    }

    @Override
    protected void registerEventHandlers() {
        registerEventHandler(OrderPlaced.class, this::on);
        registerEventHandler(ProductAdded.class, this::on);
        registerEventHandler(OrderAccepted.class, this::on);
    }

    private void on(OrderPlaced e) {
        productAndQuantity = new HashMap<>();
        productAndQuantity.put(e.sku(), e.quantity());
    }

    private void on(ProductAdded e) {
        productAndQuantity.merge(e.sku(), e.quantity(), Integer::sum);
    }

    private void on(OrderAccepted e) {
        accepted = true;
    }

    @Override
    public OrderMemento createMemento() {
        return new OrderMemento(productAndQuantity, accepted);
    }

    @Override
    public void setMemento(OrderMemento memento) {
        requireNonNull(memento, "No memento provided");
        productAndQuantity = new HashMap<>(memento.productAndQuantity);
        accepted = memento.accepted;
    }

    @Override
    public NotificationOutbox<OrderId> notificationOutbox() {
        if (notificationOutbox == null) {
            notificationOutbox = new NotificationOutbox<>();
        }
        return notificationOutbox;
    }
}
