package com.jentfoo.imagebatch.pool;

import org.threadly.concurrent.future.ListenableFuture;

/**
 * Fixed size pool that performs the CPU bound codec work.  A pool is created for one chunk of
 * files, and closed once that chunk is complete.
 */
public interface WorkerPool {
  public int getWorkerCount();

  /**
   * Accepts the raw bytes of an image file and starts decoding it.
   *
   * @param bytes complete contents of the source file
   * @return handle to follow the image through preprocessing and encoding
   */
  public ImageHandle ingestImage(byte[] bytes);

  /**
   * Releases the pool's workers.  No further images may be ingested after this is invoked.
   *
   * @return future which completes once the workers have been released
   */
  public ListenableFuture<?> close();
}
