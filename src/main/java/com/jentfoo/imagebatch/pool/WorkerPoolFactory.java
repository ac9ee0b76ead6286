package com.jentfoo.imagebatch.pool;

public interface WorkerPoolFactory {
  public WorkerPool construct(int workerCount);
}
