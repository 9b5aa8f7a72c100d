package ca.gc.cra.warden.application.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.incident.ComplianceStatus;
import ca.gc.cra.warden.domain.incident.SecurityPosture;
import ca.gc.cra.warden.domain.incident.SystemHealth;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class PostureAssessorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final SystemHealth HEALTHY = new SystemHealth(100.0, 100.0, 100.0, 100.0);

  @Test
  void meanAggregatesTheFourScores() {
    SystemHealth health = new SystemHealth(100.0, 90.0, 80.0, 70.0);

    assertEquals(85.0, PostureAggregator.MEAN.aggregate(health), 1e-9);
  }

  @Test
  void complianceBoundaryIsInclusiveAtNinetyFive() {
    SecurityPosture atThreshold = new PostureAssessor(health -> 95.0).assess(HEALTHY, 0, 0, NOW);
    SecurityPosture justBelow = new PostureAssessor(health -> 94.9).assess(HEALTHY, 0, 0, NOW);

    assertEquals(ComplianceStatus.COMPLIANT, atThreshold.complianceStatus());
    assertTrue(atThreshold.recommendations().isEmpty());
    assertEquals(ComplianceStatus.WARNING, justBelow.complianceStatus());
    assertEquals(List.of("Enhance overall security posture to achieve 95%+ compliance"),
        justBelow.recommendations());
  }

  @Test
  void aggregateIsClampedIntoRange() {
    SecurityPosture posture = new PostureAssessor(health -> 130.0).assess(HEALTHY, 0, 0, NOW);

    assertEquals(100.0, posture.overallScore(), 1e-9);
    assertEquals(NOW, posture.lastAssessment());
  }

  @Test
  void weakSubsystemsProduceTargetedRecommendations() {
    SystemHealth health = new SystemHealth(85.0, 89.0, 79.0, 100.0);

    List<String> recommendations = PostureAssessor.recommendations(88.25, health, 6);

    assertEquals(List.of(
        "Enhance overall security posture to achieve 95%+ compliance",
        "Increase path validation monitoring",
        "Enhance boundary enforcement policies",
        "Investigate active threats immediately",
        "Consider implementing additional isolation layers",
        "Review path traversal prevention rules",
        "Strengthen file system boundary enforcement"), recommendations);
  }

  @Test
  void smallThreatBacklogGetsASingleRecommendation() {
    assertEquals(List.of("Address active security threats immediately"),
        PostureAssessor.recommendations(100.0, HEALTHY, 5));
    assertTrue(PostureAssessor.recommendations(100.0, HEALTHY, 0).isEmpty());
  }

  @Test
  void complianceBuckets() {
    assertEquals(ComplianceStatus.WARNING, ComplianceStatus.fromScore(85.0));
    assertEquals(ComplianceStatus.VIOLATION, ComplianceStatus.fromScore(84.9));
    assertEquals(ComplianceStatus.VIOLATION, ComplianceStatus.fromScore(70.0));
    assertEquals(ComplianceStatus.CRITICAL, ComplianceStatus.fromScore(69.9));
  }
}
