package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadly.concurrent.PriorityScheduler;
import org.threadly.concurrent.future.FutureUtils;
import org.threadly.concurrent.future.ListenableFuture;
import org.threadly.util.ExceptionUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.jentfoo.imagebatch.codec.CodecDescriptor;
import com.jentfoo.imagebatch.codec.CodecOption;
import com.jentfoo.imagebatch.codec.CodecRegistry;
import com.jentfoo.imagebatch.codec.EncodeJob;
import com.jentfoo.imagebatch.codec.StructuredLiteral;
import com.jentfoo.imagebatch.pool.DecodedImage;
import com.jentfoo.imagebatch.pool.EncodedOutput;
import com.jentfoo.imagebatch.pool.ImageHandle;
import com.jentfoo.imagebatch.pool.WorkerPool;
import com.jentfoo.imagebatch.pool.WorkerPoolFactory;
import com.jentfoo.imagebatch.progress.ProgressReporter;
import com.jentfoo.imagebatch.progress.ProgressState;
import com.jentfoo.imagebatch.result.OutputArtifact;
import com.jentfoo.imagebatch.result.ResultAggregator;

public class PipelineCoordinator {
  private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);
  public static final String RESULTS_HEADING = "Results:";

  private final WorkerPoolFactory poolFactory;
  private final ConversionSettings settings;

  public PipelineCoordinator(WorkerPoolFactory poolFactory, ConversionSettings settings) {
    this.poolFactory = poolFactory;
    this.settings = settings;
  }

  public void processChunk(List<File> files, ProgressReporter progress, ResultAggregator results) {
    WorkerPool pool = poolFactory.construct(settings.getMaxConcurrentFiles());
    try {
      // filled by decode tasks, only read after the decode barrier
      ImageHandle[] handles = new ImageHandle[files.size()];
      List<StageTask> decoded = decode(pool, handles, files, progress, results);
      List<StageTask> preprocessed = preprocess(handles, decoded, results);
      encode(pool, handles, preprocessed, files.size(), progress, results);
    } finally {
      closePool(pool);
    }

    progress.finish(RESULTS_HEADING);
  }

  private List<StageTask> decode(final WorkerPool pool, final ImageHandle[] handles,
                                 final List<File> files, final ProgressReporter progress,
                                 final ResultAggregator results) {
    ProgressState progressState = progress.getProgressState();
    progressState.reset();
    progress.setStatus("Decoding");
    progressState.setTotalOffset(files.size());
    progress.setProgress(0, files.size(), null);

    // source reads run next to the pool, ingest happens as each read completes
    PriorityScheduler readers = new PriorityScheduler(Math.max(1, Math.min(files.size(),
                                                                  settings.getMaxConcurrentFiles())));
    try {
      final AtomicInteger decodedCount = new AtomicInteger();
      List<StageTask> tasks = new ArrayList<StageTask>(files.size());
      for (int i = 0; i < files.size(); i++) {
        final int index = i;
        final File file = files.get(i);
        ListenableFuture<?> future;
        try {
          future = readers.submit(new Callable<byte[]>() {
            @Override
            public byte[] call() throws IOException {
              return FileUtils.readFile(file);
            }
          }).flatMap(new Function<byte[], ListenableFuture<DecodedImage>>() {
            @Override
            public ListenableFuture<DecodedImage> apply(byte[] bytes) {
              ImageHandle handle;
              try {
                handle = pool.ingestImage(bytes);
              } catch (RuntimeException e) {
                return FutureUtils.immediateFailureFuture(e);
              }
              handles[index] = handle;

              return handle.decoded();
            }
          }).map(new Function<DecodedImage, DecodedImage>() {
            @Override
            public DecodedImage apply(DecodedImage image) {
              results.create(index, file, image.getSize());
              synchronized (progress) {
                progress.setProgress(decodedCount.incrementAndGet(), files.size(), file);
              }

              return image;
            }
          });
        } catch (RuntimeException e) {
          future = FutureUtils.immediateFailureFuture(e);
        }
        tasks.add(new StageTask(index, file, future));
      }

      return awaitStage(PipelineStage.Decode, tasks, results);
    } finally {
      // after an abort nothing waits on reads still queued
      readers.shutdownNow();
    }
  }

  private List<StageTask> preprocess(ImageHandle[] handles, List<StageTask> decoded,
                                     ResultAggregator results) {
    Map<String, JsonNode> preprocessOptions = buildPreprocessOptions();

    List<StageTask> tasks = new ArrayList<StageTask>(decoded.size());
    for (StageTask task : decoded) {
      ImageHandle handle = handles[task.index];
      handle.preprocess(preprocessOptions);
      tasks.add(new StageTask(task.index, task.file, handle.decoded()));
    }

    return awaitStage(PipelineStage.Preprocess, tasks, results);
  }

  private void encode(WorkerPool pool, ImageHandle[] handles, List<StageTask> preprocessed,
                      int attemptedCount, final ProgressReporter progress,
                      final ResultAggregator results) {
    // decode progress stays counted so the fraction continues from where decode left it
    progress.getProgressState().setProgressOffset(attemptedCount);
    progress.setStatus("Encoding (" + pool.getWorkerCount() + " threads)");
    final int jobsStarted = preprocessed.size();
    progress.setProgress(0, jobsStarted, null);

    final AtomicInteger jobsFinished = new AtomicInteger();
    List<StageTask> tasks = new ArrayList<StageTask>(preprocessed.size());
    for (StageTask task : preprocessed) {
      final int index = task.index;
      final File file = task.file;
      final ImageHandle handle = handles[index];
      ListenableFuture<?> future;
      try {
        future = handle.encode(buildEncodeJob()).map(new Function<Object, List<OutputArtifact>>() {
          @Override
          public List<OutputArtifact> apply(Object ignored) {
            List<OutputArtifact> written = writeOutputs(index, file, handle, results);
            synchronized (progress) {
              progress.setProgress(jobsFinished.incrementAndGet(), jobsStarted, file);
            }

            return written;
          }
        });
      } catch (RuntimeException e) {
        future = FutureUtils.immediateFailureFuture(e);
      }
      tasks.add(new StageTask(index, file, future));
    }

    awaitStage(PipelineStage.Encode, tasks, results);
  }

  private List<OutputArtifact> writeOutputs(int index, File sourceFile, ImageHandle handle,
                                            ResultAggregator results) {
    List<OutputArtifact> written = new ArrayList<OutputArtifact>(handle.encodedWith().size());
    for (Map.Entry<String, ListenableFuture<EncodedOutput>> entry : handle.encodedWith().entrySet()) {
      EncodedOutput output;
      try {
        output = entry.getValue().get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw ExceptionUtils.makeRuntime(e);
      } catch (ExecutionException e) {
        throw ExceptionUtils.makeRuntime(e.getCause());
      }

      File outputFile = FileUtils.makeOutputFile(settings.getOutputDir(), sourceFile,
                                                 settings.getSuffix(), output.getExtension());
      try {
        FileUtils.writeFile(outputFile, output.getBinary());
      } catch (IOException e) {
        throw ExceptionUtils.makeRuntime(e);
      }

      OutputArtifact artifact = new OutputArtifact(output.getBinary(), output.getExtension(),
                                                   output.getInfoText(), outputFile);
      results.appendOutput(index, artifact);
      written.add(artifact);
    }

    return written;
  }

  private List<StageTask> awaitStage(PipelineStage stage, List<StageTask> tasks,
                                     ResultAggregator results) {
    List<ListenableFuture<?>> futures = new ArrayList<ListenableFuture<?>>(tasks.size());
    for (StageTask task : tasks) {
      futures.add(task.future);
    }

    try {
      if (settings.getFailurePolicy() == FailurePolicy.AbortChunk) {
        FutureUtils.blockTillAllCompleteOrFirstError(futures);

        return tasks;
      } else {
        FutureUtils.blockTillAllComplete(futures);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageFailedException(stage, null, e);
    } catch (ExecutionException e) {
      throw new StageFailedException(stage, findFailedFile(tasks), e.getCause());
    }

    List<StageTask> survivors = new ArrayList<StageTask>(tasks.size());
    for (StageTask task : tasks) {
      Throwable failure = task.getFailure();
      if (failure == null) {
        survivors.add(task);
      } else {
        log.warn("Skipping {}, {} failed", task.file, stage.getDisplayName(), failure);
        results.recordFailure(task.index, task.file, stage.getDisplayName(),
                              String.valueOf(failure.getMessage()));
      }
    }

    return survivors;
  }

  private static File findFailedFile(List<StageTask> tasks) {
    for (StageTask task : tasks) {
      if (task.future.isDone() && task.getFailure() != null) {
        return task.file;
      }
    }

    return null;
  }

  private void closePool(WorkerPool pool) {
    try {
      pool.close().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      ExceptionUtils.handleException(e.getCause());
    }
  }

  protected Map<String, JsonNode> buildPreprocessOptions() {
    Map<String, JsonNode> result = new LinkedHashMap<String, JsonNode>();
    for (CodecDescriptor preprocessor : CodecRegistry.getPreprocessors()) {
      String config = settings.getPreprocessorConfig(preprocessor.getName());
      if (config != null) {
        result.put(preprocessor.getName(), StructuredLiteral.parse(config));
      }
    }

    return result;
  }

  protected EncodeJob buildEncodeJob() {
    Map<String, CodecOption> encoderOptions = new LinkedHashMap<String, CodecOption>();
    for (CodecDescriptor encoder : CodecRegistry.getEncoders()) {
      String config = settings.getEncoderConfig(encoder.getName());
      if (config != null) {
        encoderOptions.put(encoder.getName(), CodecOption.parse(config));
      }
    }

    return new EncodeJob(settings.getMaxOptimizerRounds(),
                         settings.getOptimizerButteraugliTarget(),
                         encoderOptions);
  }

  private static class StageTask {
    private final int index;
    private final File file;
    private final ListenableFuture<?> future;

    private StageTask(int index, File file, ListenableFuture<?> future) {
      this.index = index;
      this.file = file;
      this.future = future;
    }

    // only valid once the future is done
    private Throwable getFailure() {
      try {
        future.get();

        return null;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return e;
      } catch (ExecutionException e) {
        return e.getCause();
      }
    }
  }
}
