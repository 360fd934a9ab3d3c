package com.termguide.disambiguation.service.guidance;

import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.util.concurrent.RateLimiter;

/** Ceiling on embedding lookups, shared by every worker resolving one batch. */
public interface CallBudget {

  /** Claims one lookup. Returns false once the budget is spent; the caller must not embed. */
  boolean tryAcquire();

  int used();

  static CallBudget unlimited() {
    AtomicInteger used = new AtomicInteger();
    return new CallBudget() {
      @Override
      public boolean tryAcquire() {
        used.incrementAndGet();
        return true;
      }

      @Override
      public int used() {
        return used.get();
      }
    };
  }

  /**
   * At most {@code maxCalls} lookups. When a rate limiter is supplied, each granted lookup also
   * waits for a permit so concurrent batches share one embedding call rate.
   */
  static CallBudget capped(int maxCalls, RateLimiter rateLimiter) {
    AtomicInteger used = new AtomicInteger();
    return new CallBudget() {
      @Override
      public boolean tryAcquire() {
        while (true) {
          int current = used.get();
          if (current >= maxCalls) {
            return false;
          }
          if (used.compareAndSet(current, current + 1)) {
            if (rateLimiter != null) {
              rateLimiter.acquire();
            }
            return true;
          }
        }
      }

      @Override
      public int used() {
        return used.get();
      }
    };
  }
}
