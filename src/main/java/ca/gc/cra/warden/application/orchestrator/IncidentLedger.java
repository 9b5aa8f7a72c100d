package ca.gc.cra.warden.application.orchestrator;

import ca.gc.cra.warden.domain.incident.IncidentStatus;
import ca.gc.cra.warden.domain.incident.SecurityIncident;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Append-only, insertion-ordered record of every incident.
 *
 * <p><strong>Thread-safety:</strong> All access synchronizes on the ledger; incidents are appended from the
 * security loop and from caller threads running the access gate.</p>
 *
 * @since 0.1.0
 */
public final class IncidentLedger {
  private final Map<String, SecurityIncident> incidents = new LinkedHashMap<>();

  /**
   * Appends an incident.
   *
   * @param incident new incident
   * @throws IllegalStateException when an incident with the same id exists
   */
  public synchronized void add(SecurityIncident incident) {
    Objects.requireNonNull(incident, "incident");
    if (incidents.putIfAbsent(incident.id(), incident) != null) {
      throw new IllegalStateException("duplicate incident id " + incident.id());
    }
  }

  public synchronized Optional<SecurityIncident> find(String incidentId) {
    return Optional.ofNullable(incidents.get(incidentId));
  }

  public synchronized int size() {
    return incidents.size();
  }

  /**
   * Most recent incidents, newest first.
   *
   * @param limit maximum number returned
   * @return incidents
   */
  public synchronized List<SecurityIncident> recent(int limit) {
    List<SecurityIncident> all = new ArrayList<>(incidents.values());
    List<SecurityIncident> result = new ArrayList<>();
    for (int i = all.size() - 1; i >= 0 && result.size() < limit; i--) {
      result.add(all.get(i));
    }
    return result;
  }

  public List<SecurityIncident> matching(Predicate<SecurityIncident> filter) {
    List<SecurityIncident> snapshot;
    synchronized (this) {
      snapshot = new ArrayList<>(incidents.values());
    }
    return snapshot.stream().filter(filter).toList();
  }

  /**
   * Incidents still detected or under investigation.
   *
   * @return open incidents in creation order
   */
  public List<SecurityIncident> active() {
    return matching(incident -> {
      IncidentStatus status = incident.status();
      return status == IncidentStatus.DETECTED || status == IncidentStatus.INVESTIGATING;
    });
  }

  public List<SecurityIncident> critical() {
    return matching(SecurityIncident::critical);
  }

  public int countWithStatus(IncidentStatus status) {
    return matching(incident -> incident.status() == status).size();
  }

  /**
   * Critical incidents created at or after {@code since} that have not been contained or resolved.
   *
   * @param since window start
   * @return count
   */
  public int openCriticalSince(Instant since) {
    return matching(incident -> incident.critical()
        && !incident.timestamp().isBefore(since)
        && incident.status() != IncidentStatus.CONTAINED
        && incident.status() != IncidentStatus.RESOLVED).size();
  }
}
