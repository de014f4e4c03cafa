package ca.gc.cra.lattice.application.events;

import ca.gc.cra.lattice.domain.events.BusEvent;

/**
 * Receives decoded lattice events on the watcher's delivery thread.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BusEventListener {
  void onEvent(BusEvent event);
}
