package com.scholary.media.transcriber.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.scholary.media.transcriber.config.TranscriptionProperties;
import com.scholary.media.transcriber.memory.WorkerPoolSizer;
import com.scholary.media.transcriber.service.TranscriptionFailedException;
import com.scholary.media.transcriber.service.TranscriptionPipeline;
import com.scholary.media.transcriber.service.TranscriptionRequest;
import com.scholary.media.transcriber.service.TranscriptionResult;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point.
 *
 * <p>Usage: {@code --input=<media file> [--session-name=<name>] [--keywords=a,b,c]
 * [--chunk-seconds=<n>]}. The result is printed to stdout as JSON. Without {@code --input} only the
 * effective configuration is logged.
 */
@Component
public class TranscribeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscribeCommandRunner.class);

  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private final TranscriptionPipeline pipeline;
  private final WorkerPoolSizer sizer;
  private final TranscriptionProperties properties;
  private final ObjectMapper objectMapper;
  private final PrintStream out;

  private int exitCode;

  @Autowired
  public TranscribeCommandRunner(
      TranscriptionPipeline pipeline,
      WorkerPoolSizer sizer,
      TranscriptionProperties properties,
      ObjectMapper objectMapper) {
    this(pipeline, sizer, properties, objectMapper, System.out);
  }

  TranscribeCommandRunner(
      TranscriptionPipeline pipeline,
      WorkerPoolSizer sizer,
      TranscriptionProperties properties,
      ObjectMapper objectMapper,
      PrintStream out) {
    this.pipeline = pipeline;
    this.sizer = sizer;
    this.properties = properties;
    this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    String input = single(args, "input");
    if (input == null) {
      LOGGER.info(
          "No --input given. tempDir={}, chunking={}, workers available now={}",
          properties.tempDir(),
          properties.chunking(),
          sizer.optimalWorkers());
      return;
    }

    TranscriptionRequest request;
    try {
      request =
          new TranscriptionRequest(
              Paths.get(input),
              single(args, "session-name"),
              keywords(single(args, "keywords")),
              chunkSeconds(single(args, "chunk-seconds")));
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid arguments: {}", e.getMessage());
      exitCode = EXIT_USAGE;
      return;
    }

    try {
      TranscriptionResult result = pipeline.transcribe(request);
      out.println(objectMapper.writeValueAsString(result));
    } catch (TranscriptionFailedException e) {
      LOGGER.error("Session {} failed: {}", e.getSessionId(), e.getMessage());
      exitCode = EXIT_FAILED;
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to write result", e);
      exitCode = EXIT_FAILED;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private static String single(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
  }

  static List<String> keywords(String raw) {
    if (raw == null) {
      return null;
    }
    List<String> keywords = new ArrayList<>();
    for (String part : raw.split(",")) {
      if (!part.isBlank()) {
        keywords.add(part.strip());
      }
    }
    return keywords;
  }

  static Integer chunkSeconds(String raw) {
    if (raw == null) {
      return null;
    }
    try {
      return Integer.valueOf(raw.strip());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--chunk-seconds must be a whole number: " + raw, e);
    }
  }
}
