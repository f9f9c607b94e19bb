package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.aggregates.events.DomainEvent;
import dk.cloudcreate.eventsourcing.aggregates.snapshot.*;
import dk.cloudcreate.eventsourcing.aggregates.types.*;
import org.slf4j.*;

import java.lang.reflect.Modifier;
import java.util.*;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for event sourced aggregates.<br>
 * Every state change is expressed as a {@link DomainEvent} that is applied through an event handler the concrete aggregate
 * registers in {@link #registerEventHandlers()}. New events are raised with {@link #raiseEvent(DomainEvent)}, which applies the
 * event and keeps it in the {@link #uncommittedEvents()} until the aggregate has been appended to the event store.
 * Previously persisted events are replayed with {@link #loadFromHistory(Iterable)} through the same handlers.<br>
 * <br>
 * Example:
 * <pre>{@code
 * public class Order extends AggregateRoot<OrderId, Order> {
 *     private Map<String, Integer> productAndQuantity;
 *
 *     public Order() {
 *     }
 *
 *     public Order(OrderId orderId, String sku, int quantity) {
 *         raiseEvent(new OrderPlaced(orderId, newVersion(), sku, quantity));
 *     }
 *
 *     @Override
 *     protected void registerEventHandlers() {
 *         registerEventHandler(OrderPlaced.class, this::on);
 *     }
 *
 *     private void on(OrderPlaced e) {
 *         productAndQuantity = new HashMap<>();
 *         productAndQuantity.put(e.sku(), e.quantity());
 *     }
 * }
 * }</pre>
 * Aggregates created by {@link AggregateInstanceFactory#objenesisAggregateFactory()} don't run any constructors or field initializers,
 * so the base class initializes its own state lazily and concrete aggregates should initialize their state in event handlers.
 * <br>
 * Aggregate instances are not thread safe.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
@SuppressWarnings("unchecked")
public abstract class AggregateRoot<ID extends AggregateId, AGGREGATE_TYPE extends AggregateRoot<ID, AGGREGATE_TYPE>> implements Aggregate<ID, AGGREGATE_TYPE> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRoot.class);

    private Map<Class<?>, Consumer<DomainEvent<ID>>> eventHandlers;
    private List<DomainEvent<ID>>                    uncommittedEvents;
    private ID                                       aggregateId;
    private AggregateVersion                         version;
    private boolean                                  hasBeenRehydrated;

    protected AggregateRoot() {
        initialize();
    }

    /**
     * Register an event handler for every concrete event type the aggregate can apply, using
     * {@link #registerEventHandler(Class, Consumer)}. Called once per aggregate instance before any event is applied.
     */
    protected abstract void registerEventHandlers();

    /**
     * Register the handler that mutates the aggregate state when an event of the given type is applied
     *
     * @param eventType the concrete event type
     * @param handler   the handler
     * @param <EVENT>   the event type
     * @throws DuplicateEventHandlerException if a handler has already been registered for the event type
     */
    protected final <EVENT extends DomainEvent<ID>> void registerEventHandler(Class<EVENT> eventType, Consumer<EVENT> handler) {
        requireNonNull(eventType, "You must supply an eventType");
        requireNonNull(handler, "You must supply an event handler");
        requireTrue(!eventType.isInterface() && !Modifier.isAbstract(eventType.getModifiers()),
                    msg("Event type '{}' must be a concrete event type", eventType.getName()));
        if (eventHandlers == null) {
            eventHandlers = new HashMap<>();
        }
        if (eventHandlers.containsKey(eventType)) {
            throw new DuplicateEventHandlerException(eventType, getClass());
        }
        eventHandlers.put(eventType, event -> handler.accept(eventType.cast(event)));
    }

    private void initialize() {
        eventHandlers = new HashMap<>();
        registerEventHandlers();
    }

    private Map<Class<?>, Consumer<DomainEvent<ID>>> eventHandlers() {
        if (eventHandlers == null) {
            // Instance created without running the constructor
            initialize();
        }
        return eventHandlers;
    }

    private List<DomainEvent<ID>> uncommittedEventsBuffer() {
        if (uncommittedEvents == null) {
            uncommittedEvents = new ArrayList<>();
        }
        return uncommittedEvents;
    }

    /**
     * Apply a new event and keep it in the {@link #uncommittedEvents()}.<br>
     * Raising an event with the same {@link EventId} as an event already in the {@link #uncommittedEvents()} is ignored.
     *
     * If the event is rejected the aggregate keeps the version of the last applied event, also when the event version was
     * obtained through {@link #newVersion()}.
     *
     * @param event the event
     * @throws EventHandlerNotRegisteredException if no handler has been registered for the event type
     */
    protected void raiseEvent(DomainEvent<ID> event) {
        requireNonNull(event, "You must supply an event");
        var buffer = uncommittedEventsBuffer();
        if (buffer.stream().anyMatch(uncommittedEvent -> uncommittedEvent.eventId().equals(event.eventId()))) {
            log.trace("Ignoring event '{}' with id '{}' as it has already been raised", event.getClass().getName(), event.eventId());
            return;
        }
        try {
            mutate(event);
        } catch (RuntimeException e) {
            if (version().equals(event.version())) {
                // Undo the increment performed by newVersion() for the rejected event
                version = event.version().minus(1);
            }
            throw e;
        }
        version = event.version();
        buffer.add(event);
    }

    /**
     * Dispatch the event to its registered handler
     *
     * @param event the event
     * @throws EventHandlerNotRegisteredException if no handler has been registered for the event type
     */
    protected void mutate(DomainEvent<ID> event) {
        var handler = eventHandlers().get(event.getClass());
        if (handler == null) {
            throw new EventHandlerNotRegisteredException(event.getClass(), getClass());
        }
        requireNonNull(event.aggregateId(), msg("Event '{}' doesn't have an aggregateId", event.getClass().getName()));
        if (aggregateId != null) {
            requireTrue(aggregateId.equals(event.aggregateId()),
                        msg("Aggregate '{}' with id '{}' cannot apply event '{}' that belongs to aggregate id '{}'",
                            getClass().getSimpleName(),
                            aggregateId,
                            event.getClass().getName(),
                            event.aggregateId()));
        }
        aggregateId = event.aggregateId();
        handler.accept(event);
    }

    @Override
    public AGGREGATE_TYPE loadFromHistory(Iterable<? extends DomainEvent<ID>> persistedEvents) {
        requireNonNull(persistedEvents, "You must provide the persisted events");
        var orderedEvents = new ArrayList<DomainEvent<ID>>();
        persistedEvents.forEach(orderedEvents::add);
        orderedEvents.sort(Comparator.comparingLong(event -> event.version().longValue()));
        orderedEvents.forEach(this::applyPersistedEvent);
        return (AGGREGATE_TYPE) this;
    }

    @Override
    public AGGREGATE_TYPE loadFromHistory(DomainEvent<ID> persistedEvent) {
        requireNonNull(persistedEvent, "You must provide the persisted event");
        applyPersistedEvent(persistedEvent);
        return (AGGREGATE_TYPE) this;
    }

    private void applyPersistedEvent(DomainEvent<ID> persistedEvent) {
        mutate(persistedEvent);
        version = persistedEvent.version();
        hasBeenRehydrated = true;
    }

    @Override
    public AGGREGATE_TYPE restoreFromSnapShot(SnapShot<ID> snapShot) {
        requireNonNull(snapShot, "You must provide a snapShot");
        if (!(this instanceof Originator)) {
            throw new AggregateException(msg("Aggregate '{}' cannot be restored from a snapshot as it doesn't implement {}",
                                             getClass().getName(),
                                             Originator.class.getSimpleName()));
        }
        ((Originator<Memento>) this).setMemento(snapShot.memento());
        aggregateId = snapShot.aggregateId();
        version = snapShot.version();
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Advance the aggregate version and return it. Used when creating the next event to raise:
     * <pre>{@code
     * raiseEvent(new OrderAccepted(aggregateId(), newVersion()));
     * }</pre>
     *
     * @return the new version
     */
    protected final AggregateVersion newVersion() {
        version = version().next();
        return version;
    }

    @Override
    public ID aggregateId() {
        return aggregateId;
    }

    @Override
    public AggregateVersion version() {
        if (version == null) {
            version = AggregateVersion.NO_EVENTS_APPLIED;
        }
        return version;
    }

    @Override
    public boolean isEmpty() {
        return aggregateId == null || aggregateId.isEmpty();
    }

    @Override
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    @Override
    public List<DomainEvent<ID>> uncommittedEvents() {
        var events = new ArrayList<>(uncommittedEventsBuffer());
        events.sort(Comparator.comparingLong(event -> event.version().longValue()));
        return Collections.unmodifiableList(events);
    }

    @Override
    public void markEventsAsCommitted() {
        uncommittedEventsBuffer().clear();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId +
                ", version=" + version() +
                '}';
    }
}
