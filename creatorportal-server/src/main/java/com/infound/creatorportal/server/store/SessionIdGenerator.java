package com.infound.creatorportal.server.store;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Generates session ids as decimal microsecond timestamps.
 * <p>
 * Ids from one generator are unique and strictly increasing even when the clock stalls or steps
 * back; ids from different nodes order by wall clock. The resulting strings sort correctly
 * under {@link SessionIdOrder}.
 */
public class SessionIdGenerator implements Supplier<String> {

  private final Clock clock;
  private final AtomicLong last = new AtomicLong();

  public SessionIdGenerator() {
    this(Clock.systemUTC());
  }

  public SessionIdGenerator(Clock clock) {
    this.clock = clock;
  }

  @Override
  public String get() {
    Instant now = clock.instant();
    long micros = Math.addExact(Math.multiplyExact(now.getEpochSecond(), 1_000_000L),
        now.getNano() / 1_000L);
    return Long.toString(last.updateAndGet(previous -> Math.max(micros, previous + 1)));
  }
}
