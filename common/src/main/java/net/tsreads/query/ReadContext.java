// This file is part of TSReads.
// Copyright (C) 2021  The TSReads Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsreads.query;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Ticker;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

/**
 * Carries the cancellation state of one read request: an optional deadline
 * and an explicit cancel flag. Metadata lookups, shard scans and cursor
 * iteration all check it. The flag may be set from another thread; 
 * everything else about a request runs on the caller's thread.
 * 
 * @since 1.0
 */
public class ReadContext {
  
  /** Marker for "no deadline". */
  private static final long NO_DEADLINE = Long.MAX_VALUE;
  
  private final Ticker ticker;
  
  /** Deadline in ticker nanoseconds or {@link #NO_DEADLINE}. */
  private final long deadline;
  
  private volatile boolean cancelled;
  
  protected ReadContext(final Ticker ticker, final long deadline) {
    this.ticker = ticker;
    this.deadline = deadline;
  }
  
  /** @return A context without a deadline. */
  public static ReadContext background() {
    return new ReadContext(Ticker.systemTicker(), NO_DEADLINE);
  }
  
  /**
   * @param timeout How long the request may take.
   * @param unit The unit of the timeout.
   * @return A context that expires after the timeout.
   */
  public static ReadContext withTimeout(final long timeout, 
                                        final TimeUnit unit) {
    return withTimeout(timeout, unit, Ticker.systemTicker());
  }
  
  /**
   * @param timeout How long the request may take.
   * @param unit The unit of the timeout.
   * @param ticker The non-null ticker used to measure time.
   * @return A context that expires after the timeout.
   */
  public static ReadContext withTimeout(final long timeout, 
                                        final TimeUnit unit, 
                                        final Ticker ticker) {
    if (ticker == null) {
      throw new IllegalArgumentException("Ticker cannot be null.");
    }
    return new ReadContext(ticker, ticker.read() + unit.toNanos(timeout));
  }
  
  /** Cancels the request. Safe to call from any thread. */
  public void cancel() {
    cancelled = true;
  }
  
  /** @return True if the request was cancelled or its deadline passed. */
  public boolean isDone() {
    return cancelled || (deadline != NO_DEADLINE && ticker.read() >= deadline);
  }
  
  /** @return Whether the context has a deadline. */
  public boolean hasDeadline() {
    return deadline != NO_DEADLINE;
  }
  
  /** @return The milliseconds left before the deadline, rounded up, or 
   * {@link Long#MAX_VALUE} if there is no deadline. May be zero or negative.*/
  public long remainingMillis() {
    if (deadline == NO_DEADLINE) {
      return Long.MAX_VALUE;
    }
    final long remaining = deadline - ticker.read();
    if (remaining <= 0) {
      return 0;
    }
    return TimeUnit.NANOSECONDS.toMillis(remaining + 999_999);
  }
  
  /**
   * Throws if the request was cancelled or its deadline passed.
   * @throws ReadCancelledException if done.
   */
  public void checkCancelled() {
    if (cancelled) {
      throw new ReadCancelledException("Read was cancelled.");
    }
    if (deadline != NO_DEADLINE && ticker.read() >= deadline) {
      throw new ReadCancelledException("Read deadline exceeded.");
    }
  }
  
  /**
   * Waits for a deferred from a collaborator, bounded by the deadline and
   * the optional per call limit.
   * @param stage A description of what is being waited on, used in errors.
   * @param deferred The non-null deferred to wait on.
   * @param max_wait_ms A limit on the wait in milliseconds, 0 for none.
   * @return The result of the deferred.
   * @throws ReadCancelledException if the request was cancelled, the 
   * deadline passed or the thread was interrupted.
   * @throws StoreUpstreamException if the deferred resolved to an exception
   * or the per call limit was reached.
   */
  public <T> T join(final String stage, 
                    final Deferred<T> deferred, 
                    final long max_wait_ms) {
    checkCancelled();
    final long remaining = remainingMillis();
    final long wait = max_wait_ms > 0 ? Math.min(max_wait_ms, remaining) 
        : remaining;
    try {
      if (wait == Long.MAX_VALUE) {
        return deferred.join();
      }
      if (wait <= 0) {
        throw new ReadCancelledException("Read deadline exceeded before " 
            + stage);
      }
      return deferred.join(wait);
    } catch (ReadException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelled = true;
      throw new ReadCancelledException("Interrupted waiting on " + stage, e);
    } catch (TimeoutException e) {
      if (isDone()) {
        throw new ReadCancelledException("Read deadline exceeded waiting on " 
            + stage, e);
      }
      throw new StoreUpstreamException("Timed out after " + wait 
          + "ms waiting on " + stage, e);
    } catch (Exception e) {
      throw new StoreUpstreamException("Failed " + stage, e);
    }
  }
}
