package com.piigateway.api.rate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory sliding-window rate limiter with temporary blocking.
 *
 * <p>Each client identifier owns one {@link ClientState}, guarded by its own monitor, so
 * evaluations for the same client are linearized while different clients never contend.
 * State is local to one process and is lost on restart.
 */
public class SlidingWindowRateLimiter {
  static final long WINDOW_MILLIS = Duration.ofSeconds(60).toMillis();
  private static final long NOT_BLOCKED = Long.MIN_VALUE;

  private final Map<String, ClientState> stateByClient = new ConcurrentHashMap<>();
  private final int requestsPerMinute;
  private final int burstLimit;
  private final Duration blockDuration;
  private final Clock clock;

  /**
   * Creates a limiter with fixed limits.
   *
   * @param requestsPerMinute steady-state cap per rolling 60-second window
   * @param burstLimit window size at which the client gets blocked
   * @param blockDuration how long a block lasts
   * @param clock wall-clock source
   */
  public SlidingWindowRateLimiter(
      int requestsPerMinute, int burstLimit, Duration blockDuration, Clock clock) {
    if (requestsPerMinute <= 0) {
      throw new IllegalArgumentException("requestsPerMinute must be positive");
    }
    if (burstLimit <= 0) {
      throw new IllegalArgumentException("burstLimit must be positive");
    }
    if (blockDuration == null || blockDuration.isNegative() || blockDuration.isZero()) {
      throw new IllegalArgumentException("blockDuration must be positive");
    }
    this.requestsPerMinute = requestsPerMinute;
    this.burstLimit = burstLimit;
    this.blockDuration = blockDuration;
    this.clock = clock;
  }

  /**
   * Evaluates a request from {@code clientId} at the current clock instant.
   *
   * @param clientId caller identity key
   * @return admission decision
   */
  public RateLimitDecision evaluate(String clientId) {
    return evaluate(clientId, clock.instant());
  }

  /**
   * Evaluates a request from {@code clientId} arriving at {@code now}.
   *
   * <p>An active block rejects without touching the window. Otherwise the window is pruned;
   * reaching {@code burstLimit} imposes a block and clears the window, reaching
   * {@code requestsPerMinute} rejects, and anything else is admitted and recorded. Rejected
   * requests are never appended to the window.
   *
   * @param clientId caller identity key
   * @param now arrival instant
   * @return admission decision
   */
  public RateLimitDecision evaluate(String clientId, Instant now) {
    long nowMillis = now.toEpochMilli();
    while (true) {
      ClientState state = stateByClient.computeIfAbsent(clientId, ignored -> new ClientState());
      synchronized (state) {
        if (state.evicted) {
          // Lost a race with the idle sweep; retry against the replacement state.
          continue;
        }
        return decide(state, nowMillis);
      }
    }
  }

  private RateLimitDecision decide(ClientState state, long nowMillis) {
    if (state.blockedUntilMillis != NOT_BLOCKED) {
      if (nowMillis < state.blockedUntilMillis) {
        return RateLimitDecision.reject(
            RejectionReason.BLOCKED, ceilSeconds(state.blockedUntilMillis - nowMillis));
      }
      state.blockedUntilMillis = NOT_BLOCKED;
    }

    Deque<Long> timestamps = state.timestamps;
    prune(timestamps, nowMillis);

    if (timestamps.size() >= burstLimit) {
      state.blockedUntilMillis = nowMillis + blockDuration.toMillis();
      timestamps.clear();
      return RateLimitDecision.reject(RejectionReason.BURST, blockDuration.toSeconds());
    }

    if (timestamps.size() >= requestsPerMinute) {
      long elapsed = nowMillis - timestamps.peekFirst();
      return RateLimitDecision.reject(RejectionReason.RATE, ceilSeconds(WINDOW_MILLIS - elapsed));
    }

    timestamps.addLast(nowMillis);
    long sinceOldest = Math.max(0L, nowMillis - timestamps.peekFirst());
    return RateLimitDecision.admit(
        requestsPerMinute, requestsPerMinute - timestamps.size(), sinceOldest / 1000L);
  }

  /**
   * Drops client states that hold no recent requests and no active block.
   *
   * @param now reference instant
   * @return number of evicted clients
   */
  public int sweepIdle(Instant now) {
    long nowMillis = now.toEpochMilli();
    int evicted = 0;
    for (Map.Entry<String, ClientState> entry : stateByClient.entrySet()) {
      ClientState state = entry.getValue();
      synchronized (state) {
        if (state.evicted) {
          continue;
        }
        prune(state.timestamps, nowMillis);
        boolean blocked =
            state.blockedUntilMillis != NOT_BLOCKED && nowMillis < state.blockedUntilMillis;
        if (state.timestamps.isEmpty() && !blocked) {
          state.evicted = true;
          stateByClient.remove(entry.getKey(), state);
          evicted++;
        }
      }
    }
    return evicted;
  }

  /** Number of client identifiers currently holding state. */
  public int trackedClients() {
    return stateByClient.size();
  }

  public int getRequestsPerMinute() {
    return requestsPerMinute;
  }

  public int getBurstLimit() {
    return burstLimit;
  }

  public Duration getBlockDuration() {
    return blockDuration;
  }

  public Clock getClock() {
    return clock;
  }

  private static void prune(Deque<Long> timestamps, long nowMillis) {
    while (!timestamps.isEmpty() && nowMillis - timestamps.peekFirst() >= WINDOW_MILLIS) {
      timestamps.pollFirst();
    }
  }

  private static long ceilSeconds(long millis) {
    return Math.max(1L, (millis + 999L) / 1000L);
  }

  /** Window and block entry of one client. Guarded by its own monitor. */
  private static final class ClientState {
    private final Deque<Long> timestamps = new ArrayDeque<>();
    private long blockedUntilMillis = NOT_BLOCKED;
    private boolean evicted;
  }
}
