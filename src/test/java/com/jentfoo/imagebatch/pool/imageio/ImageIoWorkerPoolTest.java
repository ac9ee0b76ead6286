package com.jentfoo.imagebatch.pool.imageio;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.jentfoo.imagebatch.codec.CodecOption;
import com.jentfoo.imagebatch.codec.EncodeJob;
import com.jentfoo.imagebatch.codec.StructuredLiteral;
import com.jentfoo.imagebatch.pool.DecodedImage;
import com.jentfoo.imagebatch.pool.EncodedOutput;
import com.jentfoo.imagebatch.pool.ImageHandle;

class ImageIoWorkerPoolTest {
  private ImageIoWorkerPool pool;

  @BeforeEach
  void setup() {
    pool = new ImageIoWorkerPool(2);
  }

  @AfterEach
  void cleanup() {
    pool.close();
  }

  private ImageHandle ingestGradient(int width, int height) throws IOException {
    return pool.ingestImage(ImageIoTestUtils.toPng(ImageIoTestUtils.makeGradient(width, height)));
  }

  private static EncodeJob makeJob(String... encoderAndConfig) {
    Map<String, CodecOption> options = new LinkedHashMap<String, CodecOption>();
    for (int i = 0; i < encoderAndConfig.length; i += 2) {
      options.put(encoderAndConfig[i], CodecOption.parse(encoderAndConfig[i + 1]));
    }

    return new EncodeJob(6, 1.4, options);
  }

  @Test
  void decodeReportsDimensions() throws Exception {
    byte[] png = ImageIoTestUtils.toPng(ImageIoTestUtils.makeGradient(20, 10));

    DecodedImage image = pool.ingestImage(png).decoded().get();

    assertEquals(20, image.getWidth());
    assertEquals(10, image.getHeight());
    assertEquals(png.length, image.getSize());
  }

  @Test
  void undecodableDataFails() {
    ImageHandle handle = pool.ingestImage("not an image".getBytes());

    ExecutionException e = assertThrows(ExecutionException.class, () -> handle.decoded().get());
    assertTrue(e.getCause() instanceof IOException);
  }

  @Test
  void preprocessReplacesBitmap() throws Exception {
    ImageHandle handle = ingestGradient(20, 10);
    Map<String, JsonNode> options = new LinkedHashMap<String, JsonNode>();
    options.put("resize", StructuredLiteral.parse("{width: 10}"));
    options.put("rotate", StructuredLiteral.parse("{numRotations: 1}"));

    handle.preprocess(options);
    DecodedImage image = handle.decoded().get();

    assertEquals(5, image.getWidth());
    assertEquals(10, image.getHeight());
  }

  @Test
  void emptyPreprocessLeavesImage() throws Exception {
    ImageHandle handle = ingestGradient(8, 4);

    handle.preprocess(Collections.<String, JsonNode>emptyMap());

    assertEquals(8, handle.decoded().get().getWidth());
  }

  @Test
  void encodeProducesOutputPerEncoder() throws Exception {
    ImageHandle handle = ingestGradient(16, 16);

    handle.encode(makeJob("mozjpeg", "{quality: 80}", "oxipng", "{}")).get();

    assertEquals(2, handle.encodedWith().size());
    EncodedOutput jpg = handle.encodedWith().get("mozjpeg").get();
    EncodedOutput png = handle.encodedWith().get("oxipng").get();
    assertEquals("jpg", jpg.getExtension());
    assertEquals("png", png.getExtension());
    assertNull(jpg.getInfoText());

    BufferedImage roundTrip = ImageIO.read(new ByteArrayInputStream(png.getBinary()));
    assertEquals(16, roundTrip.getWidth());
    assertEquals(ImageIoTestUtils.makeGradient(16, 16).getRGB(3, 7), roundTrip.getRGB(3, 7));
  }

  @Test
  void autoSearchesQuality() throws Exception {
    ImageHandle handle = ingestGradient(32, 32);

    handle.encode(makeJob("mozjpeg", "auto")).get();

    EncodedOutput output = handle.encodedWith().get("mozjpeg").get();
    assertTrue(output.getSize() > 0);
    assertTrue(output.getInfoText().startsWith(" using quality "), output.getInfoText());
    assertTrue(output.getInfoText().endsWith("(optimized for 1.40 distance)"), output.getInfoText());
  }

  @Test
  void missingWriterFailsEncode() throws Exception {
    ImageHandle handle = ingestGradient(4, 4);

    ExecutionException e = assertThrows(ExecutionException.class, () -> {
      handle.encode(makeJob("wp2", "auto")).get();
    });
    assertTrue(e.getCause() instanceof UnsupportedOperationException);
  }

  @Test
  void closedPoolRejectsImages() throws IOException {
    byte[] png = ImageIoTestUtils.toPng(ImageIoTestUtils.makeGradient(2, 2));
    pool.close();

    assertThrows(IllegalStateException.class, () -> pool.ingestImage(png));
  }
}
