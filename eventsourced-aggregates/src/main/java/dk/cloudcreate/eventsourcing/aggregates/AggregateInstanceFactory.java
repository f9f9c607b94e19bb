package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.Reflector;
import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Creates the empty aggregate instance that persisted events or a snapshot are loaded into.
 *
 * @see #defaultConstructorFactory()
 * @see #objenesisAggregateFactory()
 */
public interface AggregateInstanceFactory {
    AggregateInstanceFactory DEFAULT_CONSTRUCTOR_FACTORY = new DefaultConstructorAggregateInstanceFactory();
    AggregateInstanceFactory OBJENESIS_FACTORY           = new ObjenesisAggregateInstanceFactory();

    /**
     * @param aggregateType the concrete aggregate type
     * @return a new, empty, aggregate instance
     * @throws AggregateException if the instance couldn't be created
     */
    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType);

    /**
     * Factory that calls the no-arguments constructor of the aggregate type (it may be private)
     */
    static AggregateInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_FACTORY;
    }

    /**
     * Factory that uses {@link Objenesis}, so the aggregate type doesn't need a no-arguments constructor.<br>
     * <b>Objenesis neither runs constructors nor field initializers.</b> {@link AggregateRoot} takes care of its own state,
     * concrete aggregates must initialize their fields in their event handlers.
     */
    static AggregateInstanceFactory objenesisAggregateFactory() {
        return OBJENESIS_FACTORY;
    }

    class DefaultConstructorAggregateInstanceFactory implements AggregateInstanceFactory {
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateType, "You must provide an aggregateType");
            try {
                return Reflector.reflectOn(aggregateType).newInstance();
            } catch (RuntimeException e) {
                throw new AggregateException(msg("Failed to create an instance of '{}' using its no-arguments constructor", aggregateType.getName()), e);
            }
        }
    }

    class ObjenesisAggregateInstanceFactory implements AggregateInstanceFactory {
        private final Objenesis                                      objenesis      = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiators = new ConcurrentHashMap<>();

        @SuppressWarnings("unchecked")
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateType, "You must provide an aggregateType");
            try {
                return (AGGREGATE) instantiators.computeIfAbsent(aggregateType, objenesis::getInstantiatorOf)
                                                .newInstance();
            } catch (RuntimeException e) {
                throw new AggregateException(msg("Failed to create an instance of '{}' using Objenesis", aggregateType.getName()), e);
            }
        }
    }
}
