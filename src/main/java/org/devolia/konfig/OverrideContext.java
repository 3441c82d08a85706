package org.devolia.konfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * A scoped set of option overrides.
 *
 * <p>Obtained from {@link Konfig#override(Map)}. Each {@link #enable()} pushes a fresh layer and
 * each {@link #disable()} removes the most recent one pushed by this context, so a context can be
 * nested within itself. Typical use:
 *
 * <pre>
 * try (OverrideContext ignored = config.override(Map.of("DEBUG", true)).enable()) {
 *   ...
 * }
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class OverrideContext implements AutoCloseable {

  private static final AtomicLong COUNTER = new AtomicLong();

  private final OverrideStack stack;
  private final Map<String, ?> values;
  private final Deque<String> activeIds = new ArrayDeque<>();

  OverrideContext(OverrideStack stack, Map<String, ?> values) {
    this.stack = stack;
    this.values = values;
  }

  /**
   * Activates the overrides.
   *
   * @return this context, for try-with-resources
   * @throws org.devolia.konfig.exception.ForbiddenOverrideException if strict validation fails
   */
  public OverrideContext enable() {
    push();
    return this;
  }

  /**
   * Deactivates the overrides enabled last.
   *
   * @throws IllegalStateException if the context is not enabled
   */
  public void disable() {
    String id = activeIds.poll();
    if (id == null) {
      throw new IllegalStateException("Override is not enabled");
    }
    stack.deactivate(id);
  }

  /**
   * Tells whether a layer pushed by this context is still active.
   *
   * <p>Layers removed by {@link Konfig#unconfigureAll()} are forgotten here as well.
   */
  public boolean isEnabled() {
    activeIds.removeIf(id -> !stack.isActive(id));
    return !activeIds.isEmpty();
  }

  @Override
  public void close() {
    disable();
  }

  private String push() {
    String id = "override-" + COUNTER.incrementAndGet();
    stack.activate(id, values);
    activeIds.push(id);
    return id;
  }

  // Removes one layer pushed by this context; a no-op once unconfigureAll has dropped it
  private void release(String id) {
    activeIds.remove(id);
    if (stack.isActive(id)) {
      stack.deactivate(id);
    }
  }

  /** Wraps a call so the overrides are active while it runs. */
  public <T> Callable<T> wrap(Callable<T> callable) {
    return () -> {
      try (OverrideContext ignored = enable()) {
        return callable.call();
      }
    };
  }

  public Runnable wrapRunnable(Runnable runnable) {
    return () -> {
      try (OverrideContext ignored = enable()) {
        runnable.run();
      }
    };
  }

  /**
   * Wraps an asynchronous call so the overrides stay active until the returned stage completes.
   *
   * @param supplier starts the asynchronous work
   * @return a supplier of the wrapped stage
   */
  public <T> Supplier<CompletableFuture<T>> wrapAsync(
      Supplier<? extends CompletionStage<T>> supplier) {
    return () -> {
      String id = push();
      CompletionStage<T> stage;
      try {
        stage = supplier.get();
      } catch (RuntimeException e) {
        release(id);
        throw e;
      }
      return stage.toCompletableFuture().whenComplete((result, error) -> release(id));
    };
  }

  /**
   * Wraps set-up and tear-down hooks so the overrides span everything in between.
   *
   * <p>The overrides are activated before {@code setUp}. If {@code setUp} fails, they are
   * deactivated and the failure is rethrown. {@code tearDown} always deactivates them, even when
   * it fails itself. Layers already removed by {@link Konfig#unconfigureAll()} are skipped.
   *
   * @param setUp runs after activation
   * @param tearDown runs before deactivation
   * @return the wrapped hooks
   */
  public Lifecycle wrapLifecycle(Action setUp, Action tearDown) {
    return new Lifecycle(setUp, tearDown);
  }

  /** A hook that may fail. */
  @FunctionalInterface
  public interface Action {
    void run() throws Exception;
  }

  /** Set-up and tear-down hooks wrapped by {@link #wrapLifecycle(Action, Action)}. */
  public final class Lifecycle {

    private final Action setUp;
    private final Action tearDown;
    private String id;

    private Lifecycle(Action setUp, Action tearDown) {
      this.setUp = setUp;
      this.tearDown = tearDown;
    }

    public void setUp() throws Exception {
      String pushed = push();
      try {
        setUp.run();
      } catch (Exception | Error e) {
        release(pushed);
        throw e;
      }
      id = pushed;
    }

    /**
     * Runs the tear-down hook, then deactivates the overrides.
     *
     * @throws IllegalStateException if {@link #setUp()} has not completed
     */
    public void tearDown() throws Exception {
      if (id == null) {
        throw new IllegalStateException("Override is not enabled");
      }
      try {
        tearDown.run();
      } finally {
        release(id);
        id = null;
      }
    }
  }
}
