/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded queue of pending chunk writes.  {@link #offer(Object)} waits for
 * room, so a {@link java.util.concurrent.ThreadPoolExecutor} built on it
 * stalls the assembling thread instead of rejecting a completed chunk.
 *
 * @param <E> element type
 */
public class LimitedQueue<E> extends LinkedBlockingQueue<E> {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(LimitedQueue.class);

  private final int capacity;

  /**
   * @param capacity number of entries held before producers wait
   */
  public LimitedQueue(int capacity) {
    super(capacity);
    this.capacity = capacity;
  }

  /**
   * @return number of entries held before producers wait
   */
  public int getCapacity() {
    return capacity;
  }

  /**
   * Add an entry, waiting while the queue is full.
   *
   * @return false only if the caller was interrupted while waiting; the
   *         interrupt flag is then set again
   */
  @Override
  public boolean offer(E e) {
    if (super.offer(e)) {
      return true;
    }
    LOGGER.trace("Queue full ({} entries), waiting", capacity);
    try {
      put(e);
      return true;
    }
    catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Interrupted while waiting for room in the queue");
      return false;
    }
  }

}
