package com.jentfoo.imagebatch.pool.imageio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadly.concurrent.PriorityScheduler;
import org.threadly.concurrent.future.FutureUtils;
import org.threadly.concurrent.future.ListenableFuture;

import com.jentfoo.imagebatch.pool.ImageHandle;
import com.jentfoo.imagebatch.pool.WorkerPool;
import com.jentfoo.imagebatch.pool.WorkerPoolFactory;

public class ImageIoWorkerPool implements WorkerPool {
  private static final Logger log = LoggerFactory.getLogger(ImageIoWorkerPool.class);

  private final int workerCount;
  private final PriorityScheduler scheduler;
  private volatile boolean closed;

  public ImageIoWorkerPool(int workerCount) {
    if (workerCount < 1) {
      throw new IllegalArgumentException("Must have at least one worker: " + workerCount);
    }

    this.workerCount = workerCount;
    this.scheduler = new PriorityScheduler(workerCount);
    this.closed = false;

    log.debug("Started image pool with {} workers", workerCount);
  }

  @Override
  public int getWorkerCount() {
    return workerCount;
  }

  @Override
  public ImageHandle ingestImage(byte[] bytes) {
    if (closed) {
      throw new IllegalStateException("Image pool has been closed");
    }

    return new ImageIoImageHandle(scheduler, bytes);
  }

  @Override
  public ListenableFuture<?> close() {
    if (! closed) {
      closed = true;
      // queued work is allowed to finish, threads exit once idle
      scheduler.shutdown();

      log.debug("Shutdown image pool with {} workers", workerCount);
    }

    return FutureUtils.immediateResultFuture(null);
  }

  public static class Factory implements WorkerPoolFactory {
    @Override
    public WorkerPool construct(int workerCount) {
      return new ImageIoWorkerPool(workerCount);
    }
  }
}
