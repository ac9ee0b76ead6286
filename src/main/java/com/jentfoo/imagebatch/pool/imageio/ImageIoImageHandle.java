package com.jentfoo.imagebatch.pool.imageio;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

import javax.imageio.ImageIO;

import org.threadly.concurrent.SubmitterExecutor;
import org.threadly.concurrent.future.FutureUtils;
import org.threadly.concurrent.future.ListenableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.jentfoo.imagebatch.codec.CodecOption;
import com.jentfoo.imagebatch.codec.CodecRegistry;
import com.jentfoo.imagebatch.codec.EncodeJob;
import com.jentfoo.imagebatch.pool.DecodedImage;
import com.jentfoo.imagebatch.pool.EncodedOutput;
import com.jentfoo.imagebatch.pool.ImageHandle;

class ImageIoImageHandle implements ImageHandle {
  private final SubmitterExecutor executor;
  private final long sourceSize;
  private volatile ListenableFuture<BufferedImage> bitmap;
  private volatile Map<String, ListenableFuture<EncodedOutput>> encodedWith;

  protected ImageIoImageHandle(SubmitterExecutor executor, final byte[] bytes) {
    this.executor = executor;
    this.sourceSize = bytes.length;
    this.bitmap = executor.submit(new Callable<BufferedImage>() {
      @Override
      public BufferedImage call() throws IOException {
        return decode(bytes);
      }
    });
    this.encodedWith = Collections.emptyMap();
  }

  protected static BufferedImage decode(byte[] bytes) throws IOException {
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
    if (image == null) {
      throw new IOException("Unsupported or unrecognized image data (" + bytes.length + " bytes)");
    }

    return image;
  }

  @Override
  public ListenableFuture<DecodedImage> decoded() {
    return bitmap.map(new Function<BufferedImage, DecodedImage>() {
      @Override
      public DecodedImage apply(BufferedImage image) {
        return new DecodedImage(sourceSize, image.getWidth(), image.getHeight());
      }
    });
  }

  @Override
  public void preprocess(Map<String, JsonNode> optionsByName) {
    if (optionsByName.isEmpty()) {
      return;
    }

    final Map<String, JsonNode> options = new LinkedHashMap<String, JsonNode>(optionsByName);
    bitmap = bitmap.flatMap(new Function<BufferedImage, ListenableFuture<BufferedImage>>() {
      @Override
      public ListenableFuture<BufferedImage> apply(final BufferedImage image) {
        return executor.submit(new Callable<BufferedImage>() {
          @Override
          public BufferedImage call() {
            return ImageIoPreprocessor.apply(image, options);
          }
        });
      }
    });
  }

  @Override
  public ListenableFuture<?> encode(final EncodeJob job) {
    Map<String, ListenableFuture<EncodedOutput>> outputs =
        new LinkedHashMap<String, ListenableFuture<EncodedOutput>>();
    for (Map.Entry<String, CodecOption> entry : job.getEncoderOptions().entrySet()) {
      final ImageIoEncoder encoder = new ImageIoEncoder(CodecRegistry.getEncoder(entry.getKey()));
      final CodecOption option = entry.getValue();
      outputs.put(entry.getKey(), bitmap.flatMap(new Function<BufferedImage, ListenableFuture<EncodedOutput>>() {
        @Override
        public ListenableFuture<EncodedOutput> apply(final BufferedImage image) {
          return executor.submit(new Callable<EncodedOutput>() {
            @Override
            public EncodedOutput call() throws IOException {
              return encoder.encode(image, option, job);
            }
          });
        }
      }));
    }
    encodedWith = Collections.unmodifiableMap(outputs);

    return FutureUtils.makeFailurePropagatingCompleteFuture(outputs.values());
  }

  @Override
  public Map<String, ListenableFuture<EncodedOutput>> encodedWith() {
    return encodedWith;
  }
}
