package dk.cloudcreate.eventsourcing.aggregates.snapshot;

/**
 * Capability for aggregates that can capture and restore their state through a {@link Memento},
 * which allows them to be loaded from a {@link SnapShot} instead of their full event history.
 *
 * @param <MEMENTO> the memento type
 */
public interface Originator<MEMENTO extends Memento> {
    /**
     * @return a capture of every field needed to rebuild the current state
     */
    MEMENTO createMemento();

    /**
     * Replace the current state with the state captured in the memento
     */
    void setMemento(MEMENTO memento);
}
