package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.aggregates.snapshot.Memento;

import java.util.*;

public class OrderMemento implements Memento {
    public final Map<String, Integer> productAndQuantity;
    public final boolean              accepted;

    public OrderMemento(Map<String, Integer> productAndQuantity, boolean accepted) {
        this.productAndQuantity = Map.copyOf(productAndQuantity);
        this.accepted = accepted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderMemento that = (OrderMemento) o;
        return accepted == that.accepted && productAndQuantity.equals(that.productAndQuantity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productAndQuantity, accepted);
    }
}
