package com.jentfoo.imagebatch.pool.imageio;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

import com.jentfoo.imagebatch.codec.CodecDescriptor;
import com.jentfoo.imagebatch.codec.CodecOption;
import com.jentfoo.imagebatch.codec.EncodeJob;
import com.jentfoo.imagebatch.pool.EncodedOutput;

class ImageIoEncoder {
  private static final int DEFAULT_QUALITY = 75;
  private static final int MAX_QUALITY = 100;

  private final CodecDescriptor descriptor;

  protected ImageIoEncoder(CodecDescriptor descriptor) {
    this.descriptor = descriptor;
  }

  private boolean isLossy() {
    return ! "png".equals(descriptor.getExtension());
  }

  protected EncodedOutput encode(BufferedImage image, CodecOption option,
                                 EncodeJob job) throws IOException {
    if (! isLossy()) {
      return new EncodedOutput(write(image, -1), descriptor.getExtension(), null);
    } else if (option.isAuto()) {
      return optimize(image, job);
    }

    int quality = option.getConfig().path("quality").asInt(DEFAULT_QUALITY);
    quality = Math.max(0, Math.min(MAX_QUALITY, quality));

    return new EncodedOutput(write(image, quality), descriptor.getExtension(), null);
  }

  private EncodedOutput optimize(BufferedImage image, EncodeJob job) throws IOException {
    double target = job.getOptimizerButteraugliTarget();
    int low = 0;
    int high = MAX_QUALITY;
    int bestQuality = -1;
    byte[] best = null;
    for (int round = 0; round < job.getMaxOptimizerRounds() && low <= high; round++) {
      int quality = (low + high) / 2;
      byte[] candidate = write(image, quality);
      BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(candidate));
      if (decoded == null) {
        // no reader to compare against, settle for the default
        break;
      }

      if (ImageDistance.distance(image, decoded) <= target) {
        best = candidate;
        bestQuality = quality;
        high = quality - 1;
      } else {
        low = quality + 1;
      }
    }

    if (best == null) {
      bestQuality = job.getMaxOptimizerRounds() > 0 ? Math.min(MAX_QUALITY, low) : DEFAULT_QUALITY;
      best = write(image, bestQuality);
    }

    return new EncodedOutput(best, descriptor.getExtension(),
                             String.format(Locale.ROOT, " using quality %d (optimized for %.2f distance)",
                                           bestQuality, target));
  }

  private ImageWriter newWriter() {
    Iterator<ImageWriter> it = ImageIO.getImageWritersBySuffix(descriptor.getExtension());
    if (! it.hasNext()) {
      throw new UnsupportedOperationException("No ImageIO writer available for " +
                                                descriptor.getDisplayName() + " (." +
                                                descriptor.getExtension() + ")");
    }

    return it.next();
  }

  // quality < 0 writes with the writer defaults
  private byte[] write(BufferedImage image, int quality) throws IOException {
    ImageWriter writer = newWriter();
    try {
      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      ImageOutputStream ios = ImageIO.createImageOutputStream(bytes);
      try {
        writer.setOutput(ios);
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (quality >= 0 && param.canWriteCompressed()) {
          param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
          if (param.getCompressionType() == null && param.getCompressionTypes() != null) {
            param.setCompressionType(param.getCompressionTypes()[0]);
          }
          param.setCompressionQuality(quality / (float)MAX_QUALITY);
        }

        BufferedImage encodable = image;
        if (writer.getOriginatingProvider() != null &&
            ! writer.getOriginatingProvider().canEncodeImage(image)) {
          encodable = flatten(image);
        }
        writer.write(null, new IIOImage(encodable, null, null), param);
      } finally {
        ios.close();
      }

      return bytes.toByteArray();
    } finally {
      writer.dispose();
    }
  }

  // drops alpha onto a white background for writers which can not store it (ie jpeg)
  private static BufferedImage flatten(BufferedImage image) {
    BufferedImage result = new BufferedImage(image.getWidth(), image.getHeight(),
                                             BufferedImage.TYPE_INT_RGB);
    Graphics2D g = result.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, image.getWidth(), image.getHeight());
      g.drawImage(image, 0, 0, null);
    } finally {
      g.dispose();
    }

    return result;
  }
}
