package dk.cloudcreate.eventsourcing.eventstore.jdbi;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventsourcing.aggregates.AggregateRoot;
import dk.cloudcreate.eventsourcing.aggregates.events.*;
import dk.cloudcreate.eventsourcing.aggregates.notifications.*;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.*;
import dk.cloudcreate.eventsourcing.aggregates.types.AggregateVersion;

public class Product extends AggregateRoot<ProductId, Product> implements Originator<Product.ProductMemento>, NotificationSourcing<ProductId> {
    private String  name;
    private boolean discontinued;

    private NotificationOutbox<ProductId> notificationOutbox;

    public Product() {
    }

    public Product(ProductId productId, String name) {
        raiseEvent(new ProductCreated(productId, newVersion(), name));
    }

    public void rename(String newName) {
        raiseEvent(new ProductRenamed(aggregateId(), newVersion(), newName));
    }

    public void discontinue() {
        if (discontinued) {
            return;
        }
        raiseEvent(new ProductDiscontinued(aggregateId(), newVersion()));
        addNotification(new ProductDiscontinuedNotification(aggregateId(), name));
    }

    public String name() {
        return name;
    }

    public boolean isDiscontinued() {
        return discontinued;
    }

    @Override
    protected void registerEventHandlers() {
        registerEventHandler(ProductCreated.class, e -> name = e.name);
        registerEventHandler(ProductRenamed.class, e -> name = e.name);
        registerEventHandler(ProductDiscontinued.class, e -> discontinued = true);
    }

    @Override
    public ProductMemento createMemento() {
        return new ProductMemento(name, discontinued);
    }

    @Override
    public void setMemento(ProductMemento memento) {
        name = memento.name;
        discontinued = memento.discontinued;
    }

    @Override
    public NotificationOutbox<ProductId> notificationOutbox() {
        if (notificationOutbox == null) {
            notificationOutbox = new NotificationOutbox<>();
        }
        return notificationOutbox;
    }

    public static class ProductCreated extends DomainEvent<ProductId> {
        String name;

        ProductCreated() {
        }

        public ProductCreated(ProductId productId, AggregateVersion version, String name) {
            super(productId, version);
            this.name = name;
        }
    }

    public static class ProductRenamed extends DomainEvent<ProductId> {
        String name;

        ProductRenamed() {
        }

        public ProductRenamed(ProductId productId, AggregateVersion version, String name) {
            super(productId, version);
            this.name = name;
        }
    }

    public static class ProductDiscontinued extends DomainEvent<ProductId> {
        ProductDiscontinued() {
        }

        public ProductDiscontinued(ProductId productId, AggregateVersion version) {
            super(productId, version);
        }
    }

    public static class ProductDiscontinuedNotification extends Notification<ProductId> {
        String name;

        ProductDiscontinuedNotification() {
        }

        public ProductDiscontinuedNotification(ProductId productId, String name) {
            super(productId);
            this.name = name;
        }
    }

    public static class ProductMemento implements Memento {
        public final String  name;
        public final boolean discontinued;

        @JsonCreator
        public ProductMemento(@JsonProperty("name") String name, @JsonProperty("discontinued") boolean discontinued) {
            this.name = name;
            this.discontinued = discontinued;
        }
    }
}
