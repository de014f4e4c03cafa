package ca.gc.cra.lattice.adapter.kafka;

import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Builds auto-completing {@link MockProducer} instances that always write to partition 0.
 */
final class MockProducers {
  private static final Partitioner FIRST_PARTITION = new Partitioner() {
    @Override
    public void configure(Map<String, ?> configs) {
      // nothing to configure
    }

    @Override
    public int partition(
        String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes, Cluster cluster) {
      return 0;
    }

    @Override
    public void close() {
      // nothing to release
    }
  };

  private MockProducers() {}

  static MockProducer<String, byte[]> subjectKeyed() {
    return new MockProducer<>(true, FIRST_PARTITION, new StringSerializer(), new ByteArraySerializer());
  }
}
