package ca.gc.cra.warden.application.boundary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExecutionContextTest {

  private final ExecutionContext context = new ExecutionContext();
  private final ExecutorService executor = Executors.newFixedThreadPool(2);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void scopesNestAndRestoreOnClose() {
    try (var outer = context.enter("proj1")) {
      try (var inner = context.enter("proj2")) {
        assertEquals(Optional.of("proj2"), context.activeProject());
      }
      assertEquals(Optional.of("proj1"), context.activeProject());
      outer.close();
      outer.close();
      assertTrue(context.activeProject().isEmpty());
    }
    assertThrows(IllegalArgumentException.class, () -> context.enter(" "));
  }

  @Test
  void concurrentScopesAreIsolatedPerThread() throws Exception {
    CountDownLatch bothEntered = new CountDownLatch(2);
    CountDownLatch release = new CountDownLatch(1);

    Future<Optional<String>> first = executor.submit(() -> observeWhileBothOpen("proj1", bothEntered, release));
    Future<Optional<String>> second = executor.submit(() -> observeWhileBothOpen("proj2", bothEntered, release));
    assertTrue(bothEntered.await(5, TimeUnit.SECONDS));
    assertTrue(context.activeProject().isEmpty());
    assertTrue(context.attributedProject().isEmpty());
    release.countDown();

    assertEquals(Optional.of("proj1"), first.get(5, TimeUnit.SECONDS));
    assertEquals(Optional.of("proj2"), second.get(5, TimeUnit.SECONDS));
  }

  @Test
  void singleOpenProjectIsAttributedAcrossThreads() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> holder = executor.submit(() -> {
      try (var scope = context.enter("proj1")) {
        entered.countDown();
        release.await(5, TimeUnit.SECONDS);
      }
      return null;
    });
    assertTrue(entered.await(5, TimeUnit.SECONDS));

    assertTrue(context.activeProject().isEmpty());
    assertEquals(Optional.of("proj1"), context.attributedProject());

    release.countDown();
    holder.get(5, TimeUnit.SECONDS);
    assertTrue(context.attributedProject().isEmpty());
  }

  private Optional<String> observeWhileBothOpen(String projectId, CountDownLatch bothEntered, CountDownLatch release)
      throws InterruptedException {
    try (var scope = context.enter(projectId)) {
      bothEntered.countDown();
      release.await(5, TimeUnit.SECONDS);
      return context.activeProject();
    }
  }
}
