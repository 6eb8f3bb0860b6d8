package nl.pdok.spider.application.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import nl.pdok.spider.testing.CapturedLogs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
  private static final Duration WAIT = Duration.ofMillis(5);

  private final CapturedLogs logs = CapturedLogs.create("retry");

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void defaultsAreThreeAttemptsFiveSecondsApart() {
    RetryPolicy policy = RetryPolicy.defaults(logs.logger());

    assertEquals(3, policy.maxAttempts());
    assertEquals(Duration.ofSeconds(5), policy.backoff());
  }

  @Test
  void succeedsOnThirdAttemptAfterTwoWaits() throws Exception {
    RetryPolicy policy = new RetryPolicy(3, WAIT, logs.logger());
    AtomicInteger attempts = new AtomicInteger();

    String value = policy.execute("GetCapabilities https://example.org/wms", () -> {
      if (attempts.incrementAndGet() < 3) {
        throw new IOException("connection reset");
      }
      return "ok";
    });

    assertEquals("ok", value);
    assertEquals(3, attempts.get());
    List<String> warnings = logs.messages(Level.WARN);
    assertEquals(2, warnings.size());
    assertTrue(warnings.get(0).startsWith("Attempt 1/3 for GetCapabilities https://example.org/wms failed"),
        warnings.get(0));
    assertTrue(warnings.stream().allMatch(message -> message.endsWith("retrying in 5 ms")), warnings.toString());
  }

  @Test
  void exhaustionCarriesAttemptsAndLastCause() {
    RetryPolicy policy = new RetryPolicy(3, WAIT, logs.logger());
    AtomicInteger attempts = new AtomicInteger();

    RetryExhaustedException ex = assertThrows(RetryExhaustedException.class,
        () -> policy.execute("GetCapabilities", () -> {
          throw new IOException("failure " + attempts.incrementAndGet());
        }));

    assertEquals(3, ex.attempts());
    IOException cause = assertInstanceOf(IOException.class, ex.getCause());
    assertEquals("failure 3", cause.getMessage());
    assertEquals(2, logs.messages(Level.WARN).size());
  }

  @Test
  void interruptionIsNotRetried() {
    RetryPolicy policy = new RetryPolicy(3, WAIT, logs.logger());
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(InterruptedException.class, () -> policy.execute("GetCapabilities", () -> {
      attempts.incrementAndGet();
      throw new InterruptedException("stop");
    }));

    assertEquals(1, attempts.get());
    assertTrue(logs.messages(Level.WARN).isEmpty());
  }

  @Test
  void errorsPropagateWithoutRetry() {
    RetryPolicy policy = new RetryPolicy(3, WAIT, logs.logger());
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(AssertionError.class, () -> policy.execute("GetCapabilities", () -> {
      attempts.incrementAndGet();
      throw new AssertionError("bug");
    }));

    assertEquals(1, attempts.get());
  }

  @Test
  void singleAttemptPolicyNeverWaits() {
    RetryPolicy policy = new RetryPolicy(1, Duration.ofSeconds(5), logs.logger());

    RetryExhaustedException ex = assertThrows(RetryExhaustedException.class,
        () -> policy.execute("GetCapabilities", () -> {
          throw new IOException("down");
        }));

    assertEquals(1, ex.attempts());
    assertTrue(logs.messages(Level.WARN).isEmpty());
  }

  @Test
  void zeroBackoffRetriesImmediately() throws Exception {
    RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, logs.logger());
    AtomicInteger attempts = new AtomicInteger();

    int value = policy.execute("GetCapabilities", () -> {
      if (attempts.incrementAndGet() == 1) {
        throw new IOException("reset");
      }
      return 7;
    });

    assertEquals(7, value);
    assertTrue(logs.contains(Level.WARN, "retrying in 0 ms"));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, logs.logger()));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ofSeconds(-1), logs.logger()));
  }
}
