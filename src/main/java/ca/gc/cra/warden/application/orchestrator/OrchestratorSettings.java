package ca.gc.cra.warden.application.orchestrator;

/**
 * Periods of the tasks the orchestrator schedules on the security loop.
 *
 * @param watchPollIntervalMillis directory watcher poll period
 * @param integrityCheckIntervalMillis boundary integrity check period
 * @param threatScanIntervalMillis threat scan period
 * @param eventDrainIntervalMillis event channel drain period
 * @param postureIntervalMillis posture assessment period
 * @param recentIncidentsInEvidence incidents copied into evidence bundles
 * @since 0.1.0
 */
public record OrchestratorSettings(
    long watchPollIntervalMillis,
    long integrityCheckIntervalMillis,
    long threatScanIntervalMillis,
    long eventDrainIntervalMillis,
    long postureIntervalMillis,
    int recentIncidentsInEvidence) {

  public OrchestratorSettings {
    requirePositive("watchPollIntervalMillis", watchPollIntervalMillis);
    requirePositive("integrityCheckIntervalMillis", integrityCheckIntervalMillis);
    requirePositive("threatScanIntervalMillis", threatScanIntervalMillis);
    requirePositive("eventDrainIntervalMillis", eventDrainIntervalMillis);
    requirePositive("postureIntervalMillis", postureIntervalMillis);
    requirePositive("recentIncidentsInEvidence", recentIncidentsInEvidence);
  }

  private static void requirePositive(String name, long value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
