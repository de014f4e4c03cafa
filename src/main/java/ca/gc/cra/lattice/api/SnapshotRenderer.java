package ca.gc.cra.lattice.api;

import ca.gc.cra.lattice.domain.events.BusEvent;
import ca.gc.cra.lattice.domain.inventory.HostInventory;
import ca.gc.cra.lattice.domain.inventory.LinkBinding;
import ca.gc.cra.lattice.domain.inventory.WorkloadDescriptor;
import ca.gc.cra.lattice.domain.inventory.WorkloadKind;
import ca.gc.cra.lattice.domain.query.AggregatedSnapshot;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders snapshots and watched events as operator text or single-line JSON.
 *
 * <p>Text layouts:</p>
 * <pre>
 * hosts         [host-1] Uptime 42s, Labels: os,region
 * actors        Host host-1:  /  \tMActor (3)
 * bindings      Host host-1  /  \tMActor -> wascc:keyvalue,default - 2 values
 * capabilities  host-1  /  \twascc:keyvalue,default
 * </pre>
 */
final class SnapshotRenderer {
  private static final JsonFactory JSON = new JsonFactory();

  private SnapshotRenderer() {}

  static List<String> renderText(ListTarget target, AggregatedSnapshot snapshot) {
    List<String> lines = new ArrayList<>();
    for (HostInventory host : snapshot.hosts()) {
      switch (target) {
        case HOSTS -> lines.add("[" + host.hostId() + "] Uptime " + host.uptimeMillis() / 1000 + "s, Labels: "
            + String.join(",", new TreeMap<>(host.labels()).keySet()));
        case ACTORS -> {
          lines.add("");
          lines.add("Host " + host.hostId() + ":");
          for (WorkloadDescriptor actor : host.workloadsOfKind(WorkloadKind.ACTOR)) {
            lines.add("\t" + actor.id() + " (" + actor.revisionRef().orElse("?") + ")");
          }
        }
        case BINDINGS -> {
          lines.add("Host " + host.hostId());
          for (LinkBinding binding : host.bindings()) {
            lines.add("\t" + binding.workloadId() + " -> " + binding.contractId() + "," + binding.bindingName()
                + " - " + binding.configuration().size() + " values");
          }
        }
        case CAPABILITIES -> {
          lines.add(host.hostId());
          for (WorkloadDescriptor provider : host.workloadsOfKind(WorkloadKind.CAPABILITY_PROVIDER)) {
            lines.add("\t" + provider.id() + "," + provider.instance().orElse(LinkBinding.DEFAULT_BINDING));
          }
        }
        default -> throw new IllegalStateException("Unhandled list target " + target);
      }
    }
    return lines;
  }

  static String renderJson(ListTarget target, AggregatedSnapshot snapshot) {
    return write(gen -> {
      if (target == ListTarget.HOSTS) {
        gen.writeStartArray();
        for (HostInventory host : snapshot.hosts()) {
          gen.writeStartObject();
          gen.writeStringField("id", host.hostId());
          gen.writeNumberField("uptime_ms", host.uptimeMillis());
          writeStringMap(gen, "labels", host.labels());
          gen.writeEndObject();
        }
        gen.writeEndArray();
        return;
      }
      gen.writeStartObject();
      for (HostInventory host : snapshot.hosts()) {
        gen.writeArrayFieldStart(host.hostId());
        switch (target) {
          case ACTORS -> writeWorkloads(gen, host.workloadsOfKind(WorkloadKind.ACTOR));
          case CAPABILITIES -> writeWorkloads(gen, host.workloadsOfKind(WorkloadKind.CAPABILITY_PROVIDER));
          case BINDINGS -> {
            for (LinkBinding binding : host.bindings()) {
              gen.writeStartObject();
              gen.writeStringField("actor", binding.workloadId());
              gen.writeStringField("capability_id", binding.contractId());
              gen.writeStringField("binding_name", binding.bindingName());
              writeStringMap(gen, "configuration", binding.configuration());
              gen.writeEndObject();
            }
          }
          default -> throw new IllegalStateException("Unhandled list target " + target);
        }
        gen.writeEndArray();
      }
      gen.writeEndObject();
    });
  }

  static String renderEvent(BusEvent event, boolean json) {
    if (!json) {
      return event.toString();
    }
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("type", event.eventType());
      gen.writeStringField("subject", event.subject());
      gen.writeStringField("host", event.host());
      if (event.actor() != null) {
        gen.writeStringField("actor", event.actor());
      }
      if (event.capabilityId() != null) {
        gen.writeStringField("capid", event.capabilityId());
      }
      if (event.instanceName() != null) {
        gen.writeStringField("instance_name", event.instanceName());
      }
      if (event.success() != null) {
        gen.writeBooleanField("success", event.success());
      }
      gen.writeEndObject();
    });
  }

  private static void writeWorkloads(JsonGenerator gen, List<WorkloadDescriptor> workloads) throws IOException {
    for (WorkloadDescriptor workload : workloads) {
      gen.writeStartObject();
      gen.writeStringField("id", workload.id());
      gen.writeStringField("kind", workload.kind().wireTag());
      if (workload.instanceName() != null) {
        gen.writeStringField("instance_name", workload.instanceName());
      }
      if (workload.revision() != null) {
        gen.writeStringField("revision", workload.revision());
      }
      gen.writeEndObject();
    }
  }

  private static void writeStringMap(JsonGenerator gen, String field, Map<String, String> values) throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, String> entry : new TreeMap<>(values).entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static String write(JsonBody body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface JsonBody {
    void write(JsonGenerator gen) throws IOException;
  }
}
