package com.scholary.media.transcriber.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.media.transcriber.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for calling the faster-whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building multipart requests, sending files,
 * parsing responses, and retrying on transient failures.
 *
 * <p>One instance is created per transcription worker through the {@link SpeechModelFactory}
 * bean, so each worker keeps its own connection pool for the lifetime of the session.
 */
public class WhisperClient implements SpeechModel {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  /**
   * Transcribe an audio chunk.
   *
   * <p>Sends the audio file to the Whisper API as multipart/form-data and returns the parsed
   * response. Retries transient failures with exponential backoff, but never past the deadline
   * given in the options.
   *
   * @param audioFile the audio file to transcribe
   * @param options request options, including the overall timeout
   * @return the transcription response
   * @throws WhisperException if transcription fails after retries or the deadline passes
   */
  @Override
  public WhisperResponse transcribe(Path audioFile, TranscribeOptions options) {
    LOGGER.debug(
        "Transcribing chunk: file={}, index={}, wordTimestamps={}",
        audioFile.getFileName(),
        options.chunkIndex(),
        options.wordTimestamps());

    long deadline = System.nanoTime() + options.timeout().toNanos();
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
      if (remaining.isNegative() || remaining.isZero()) {
        break;
      }
      try {
        return attemptTranscribe(audioFile, options, requestTimeout(remaining));
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          if (System.nanoTime() + Duration.ofMillis(backoffMs).toNanos() >= deadline) {
            break;
          }
          structuredLogger.logTranscribeRetry(
              options.chunkIndex(),
              attempt,
              properties.maxRetries(),
              e.getClass().getSimpleName(),
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WhisperException("Transcription interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", e);
      }
    }

    if (System.nanoTime() >= deadline) {
      throw new WhisperException(
          String.format("Transcription timed out after %ds", options.timeout().toSeconds()),
          lastException);
    }
    throw new WhisperException(
        String.format("Transcription failed after %d attempts", attempt), lastException);
  }

  private Duration requestTimeout(Duration remaining) {
    Duration configured = Duration.ofSeconds(properties.readTimeout());
    return remaining.compareTo(configured) < 0 ? remaining : configured;
  }

  /**
   * Attempt a single transcription request.
   *
   * @throws IOException if the request fails
   * @throws InterruptedException if the request is interrupted
   */
  private WhisperResponse attemptTranscribe(
      Path audioFile, TranscribeOptions options, Duration timeout)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(audioFile, options, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(timeout)
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.debug(
        "Transcription successful: {} segments, language={}",
        whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no multipart support, so the body is assembled by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="chunk.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * small
   * --boundary
   * Content-Disposition: form-data; name="word_timestamps"
   *
   * true
   * ...
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      Path audioFile, TranscribeOptions options, String boundary) throws IOException {

    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "model", properties.model());
    appendField(sb, boundary, "word_timestamps", String.valueOf(options.wordTimestamps()));
    appendField(sb, boundary, "chunkIndex", String.valueOf(options.chunkIndex()));
    if (properties.language() != null && !properties.language().isBlank()) {
      appendField(sb, boundary, "language", properties.language());
    }
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
