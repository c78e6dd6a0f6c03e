package com.flightcatalog.airline.support;

import com.flightcatalog.airline.domain.IdGenerator;
import java.util.concurrent.atomic.AtomicInteger;

/** Predictable {@code prefix-N} ids for assertions. */
public class DeterministicIdGenerator implements IdGenerator {
  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger();

  public DeterministicIdGenerator() {
    this("test-id");
  }

  public DeterministicIdGenerator(String prefix) {
    this.prefix = prefix;
  }

  @Override
  public String generate() {
    return prefix + "-" + counter.incrementAndGet();
  }
}
