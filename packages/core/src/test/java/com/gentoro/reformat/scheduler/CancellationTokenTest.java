package com.gentoro.reformat.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CancellationTokenTest {

  @Test
  @DisplayName("cancel trips the latch once and reports whether it did")
  void cancelIsIdempotent() {
    CancellationToken token = new CancellationToken();
    assertFalse(token.isCancelled());

    assertTrue(token.cancel());
    assertFalse(token.cancel());
    assertTrue(token.isCancelled());
  }

  @Test
  @DisplayName("Listeners run exactly once")
  void listenersRunOnce() {
    CancellationToken token = new CancellationToken();
    AtomicInteger calls = new AtomicInteger();
    token.onCancel(calls::incrementAndGet);

    token.cancel();
    token.cancel();

    assertEquals(1, calls.get());
  }

  @Test
  @DisplayName("A listener registered after cancellation runs immediately")
  void lateListenerRunsImmediately() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    AtomicInteger calls = new AtomicInteger();

    token.onCancel(calls::incrementAndGet);

    assertEquals(1, calls.get());
  }

  @Test
  @DisplayName("A failing listener does not stop the others")
  void failingListenerIsContained() {
    CancellationToken token = new CancellationToken();
    AtomicInteger calls = new AtomicInteger();
    token.onCancel(
        () -> {
          throw new IllegalStateException("listener");
        });
    token.onCancel(calls::incrementAndGet);

    assertDoesNotThrow(token::cancel);
    assertEquals(1, calls.get());
  }

  @Test
  @DisplayName("TaskContext reflects the token")
  void contextSeesToken() {
    CancellationToken token = new CancellationToken();
    TaskContext ctx = new TaskContext(3, token);
    assertEquals(3, ctx.index());
    assertDoesNotThrow(ctx::throwIfCancelled);

    token.cancel();

    assertTrue(ctx.isCancelled());
    assertThrows(TaskCanceledException.class, ctx::throwIfCancelled);
    assertFalse(new TaskContext(0, null).cancelChecker().isCancelled());
  }
}
