package ca.gc.cra.lattice.application.query;

import ca.gc.cra.lattice.domain.query.QueryKind;
import ca.gc.cra.lattice.domain.query.QueryScope;
import ca.gc.cra.lattice.validation.Strings;

/**
 * Subject naming shared by the requesting side and lattice hosts.
 *
 * <ul>
 *   <li>Probes: {@code <ns>.<suffix>} for all hosts, {@code <ns>.<suffix>.<host>} for one host.</li>
 *   <li>Workload scope broadcasts on {@code <ns>.<suffix>}; the workload travels in the request.</li>
 *   <li>Launch and terminate: {@code <ns>.control.<host>.actor.launch|terminate}.</li>
 *   <li>Replies: {@code <inboxPrefix>.<correlationId>}, unique per query.</li>
 *   <li>Events: {@code <ns>.events}.</li>
 * </ul>
 *
 * @param namespace lattice namespace, e.g. {@code wasmbus}
 * @param inboxPrefix first token of reply subjects, e.g. {@code _INBOX}
 *
 * @since 0.1.0
 */
public record TopicConventions(String namespace, String inboxPrefix) {

  public static final String DEFAULT_NAMESPACE = "wasmbus";
  public static final String DEFAULT_INBOX_PREFIX = "_INBOX";

  public TopicConventions {
    namespace = Strings.requireSubject("namespace", namespace);
    inboxPrefix = Strings.requireSubject("inboxPrefix", inboxPrefix);
  }

  /**
   * Returns the conventions used by stock lattice hosts.
   *
   * @return {@code wasmbus} / {@code _INBOX}
   */
  public static TopicConventions defaults() {
    return new TopicConventions(DEFAULT_NAMESPACE, DEFAULT_INBOX_PREFIX);
  }

  /**
   * Derives the subject a request is published to.
   *
   * @param kind request kind
   * @param scope request scope
   * @return request subject
   * @throws IllegalArgumentException if a launch is not addressed to a single host
   */
  public String requestSubject(QueryKind kind, QueryScope scope) {
    if (kind == QueryKind.LAUNCH) {
      if (scope.type() != QueryScope.Type.HOST) {
        throw new IllegalArgumentException("launch requests must target a single host");
      }
      return controlSubject(scope.target(), kind.subjectSuffix());
    }
    String base = namespace + '.' + kind.subjectSuffix();
    if (scope.type() == QueryScope.Type.HOST) {
      return base + '.' + Strings.requireSubjectToken("hostId", scope.target());
    }
    return base;
  }

  public String replySubject(String correlationId) {
    return inboxPrefix + '.' + Strings.requireSubjectToken("correlationId", correlationId);
  }

  public String terminateSubject(String hostId) {
    return controlSubject(hostId, "actor.terminate");
  }

  public String eventSubject() {
    return namespace + ".events";
  }

  private String controlSubject(String hostId, String suffix) {
    return namespace + ".control." + Strings.requireSubjectToken("hostId", hostId) + '.' + suffix;
  }
}
