package dualstore.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs calls on a fixed pool of daemon threads and waits for them up to a deadline.
 *
 * <p>A call that misses its deadline is cancelled with interruption. JDBC drivers are free to
 * ignore the interrupt, so a timed-out write may still be applied later; callers must treat
 * every timed-out mutation as "maybe applied".
 *
 * <p>At most {@code queueCapacity} calls wait for a free worker. A call submitted beyond that
 * fails at once with a {@link RemoteCallException} instead of queueing behind workers that are
 * blocked on a hung remote.
 */
public final class TimeLimiter implements AutoCloseable {
  public static final int DEFAULT_QUEUE_CAPACITY = 64;

  private final ThreadPoolExecutor executor;

  /**
   * Creates a limiter with {@link #DEFAULT_QUEUE_CAPACITY} waiting slots.
   */
  public TimeLimiter(String threadPrefix, int workers) {
    this(threadPrefix, workers, DEFAULT_QUEUE_CAPACITY);
  }

  /**
   * @param threadPrefix  name prefix for the worker threads
   * @param workers       number of worker threads, must be &gt; 0
   * @param queueCapacity calls allowed to wait for a worker, must be &gt; 0
   */
  public TimeLimiter(String threadPrefix, int workers, int queueCapacity) {
    Objects.requireNonNull(threadPrefix, "threadPrefix");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be > 0");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    this.executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity), new DaemonThreadFactory(threadPrefix),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Runs {@code task} and blocks until it finishes or {@code timeout} elapses.
   *
   * @throws RemoteCallException if the task throws, times out, is rejected because the queue
   *                             is full, or the caller is interrupted
   */
  public <T> T call(Callable<T> task, Duration timeout) {
    Future<T> future = submit(task);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      cancel(future);
      throw new RemoteCallException("Call timed out after " + timeout.toMillis() + " ms", true, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new RemoteCallException(String.valueOf(cause.getMessage()), false, cause);
    } catch (InterruptedException e) {
      cancel(future);
      Thread.currentThread().interrupt();
      throw new RemoteCallException("Interrupted while waiting for call", false, e);
    }
  }

  /**
   * Starts {@code task} without waiting. The returned future completes exceptionally with a
   * {@link RemoteCallException} when the task fails, misses {@code timeout} or finds the
   * queue full.
   */
  public <T> CompletableFuture<T> callAsync(Callable<T> task, Duration timeout) {
    CompletableFuture<T> result = new CompletableFuture<>();
    Future<?> running;
    try {
      running = submit(() -> {
        try {
          result.complete(task.call());
        } catch (Throwable t) {
          result.completeExceptionally(
              new RemoteCallException(String.valueOf(t.getMessage()), false, t));
        }
        return null;
      });
    } catch (RemoteCallException e) {
      return CompletableFuture.failedFuture(e);
    }
    result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((value, error) -> {
          if (error instanceof TimeoutException) {
            cancel(running);
          }
        });
    return result.handle((value, error) -> {
      if (error == null) {
        return value;
      }
      if (error instanceof TimeoutException) {
        throw new RemoteCallException(
            "Call timed out after " + timeout.toMillis() + " ms", true, error);
      }
      throw (RemoteCallException) error;
    });
  }

  /** Calls waiting for a free worker. */
  public int queuedCalls() {
    return executor.getQueue().size();
  }

  private <T> Future<T> submit(Callable<T> task) {
    try {
      return executor.submit(task);
    } catch (RejectedExecutionException e) {
      throw new RemoteCallException(executor.isShutdown()
          ? "Limiter is shut down"
          : "Remote call queue is full (" + executor.getQueue().size() + " waiting)", false, e);
    }
  }

  // A cancelled call that never started still holds a queue slot until it is removed.
  private void cancel(Future<?> future) {
    future.cancel(true);
    if (future instanceof Runnable) {
      executor.remove((Runnable) future);
    }
  }

  /**
   * Stops accepting calls, gives running calls up to {@code grace} to finish, then interrupts
   * whatever is left.
   */
  public void close(Duration grace) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
