package ca.gc.cra.lattice.api;

import ca.gc.cra.lattice.application.query.LatticeClient;
import ca.gc.cra.lattice.config.CompositionRoot;

/**
 * Opens the client a command runs against. Production uses the Kafka transport; tests substitute an
 * in-memory bus.
 */
@FunctionalInterface
interface ClientFactory {
  ClientFactory KAFKA = CompositionRoot::latticeClient;

  LatticeClient open(CompositionRoot root);
}
