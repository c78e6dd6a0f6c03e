package com.flightcatalog.airline.usecase;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Lock shared by every use case that writes to the catalog.
 *
 * <p>Create (check codes, then save), update (read, patch, then save) and delete all run
 * while holding it, so none of them can interleave with another inside one process.
 */
public class CatalogWriteLock {
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Runs the action while holding the lock.
   *
   * @param action write sequence to run
   * @param <T> result type
   * @return the action's result
   */
  public <T> T withLock(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
