package com.jentfoo.imagebatch.pool;

import java.util.Map;

import org.threadly.concurrent.future.ListenableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.jentfoo.imagebatch.codec.EncodeJob;

public interface ImageHandle {
  /**
   * Future for the current decoded state of the image.  This is replaced by
   * {@link #preprocess(Map)}, so it should be requested again after preprocessing.
   *
   * @return future for the decoded image
   */
  public ListenableFuture<DecodedImage> decoded();

  /**
   * Applies the named preprocessors (in the codec table order) to the decoded image.
   *
   * @param optionsByName parsed options keyed by preprocessor name
   */
  public void preprocess(Map<String, JsonNode> optionsByName);

  /**
   * Starts one encode per enabled format in the job.
   *
   * @param job encoders and tuning values to encode with
   * @return future that completes once every output has resolved, or fails with the first failure
   */
  public ListenableFuture<?> encode(EncodeJob job);

  /**
   * Outputs of the last {@link #encode(EncodeJob)} keyed by encoder name, in job order.
   *
   * @return map of encoder name to the future for its output
   */
  public Map<String, ListenableFuture<EncodedOutput>> encodedWith();
}
