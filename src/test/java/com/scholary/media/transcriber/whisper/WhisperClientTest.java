package com.scholary.media.transcriber.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WhisperClientTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private final AtomicInteger status = new AtomicInteger(200);
  private final AtomicReference<String> body = new AtomicReference<>();
  private final AtomicReference<String> receivedBody = new AtomicReference<>();
  private final AtomicInteger requests = new AtomicInteger();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/api/v1/transcribe",
        exchange -> {
          requests.incrementAndGet();
          receivedBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.ISO_8859_1));
          byte[] response = body.get().getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status.get(), response.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(response);
          }
        });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void transcribe_shouldSendMultipartAndParseSegments() throws IOException {
    body.set(
        "{\"text\":\"hello world\",\"language\":\"en\",\"duration\":3.2,"
            + "\"segments\":[{\"start\":0.0,\"end\":1.5,\"text\":\" hello\",\"id\":0},"
            + "{\"start\":1.5,\"end\":3.2,\"text\":\" world\"}]}");
    Path audio = Files.write(tempDir.resolve("lecture_part_000.wav"), new byte[] {1, 2, 3});

    WhisperResponse response =
        client(3)
            .transcribe(audio, TranscribeOptions.withWordTimestamps(Duration.ofSeconds(10), 0));

    assertThat(response.text()).isEqualTo("hello world");
    assertThat(response.segments()).hasSize(2);
    assertThat(response.segments().get(1).start()).isEqualTo(1.5);
    assertThat(response.language()).isEqualTo("en");
    assertThat(receivedBody.get())
        .contains("filename=\"lecture_part_000.wav\"")
        .contains("name=\"model\"\r\n\r\nbase")
        .contains("name=\"word_timestamps\"\r\n\r\ntrue")
        .doesNotContain("name=\"language\"");
  }

  @Test
  void transcribe_shouldFailAfterConfiguredAttempts() throws IOException {
    status.set(500);
    body.set("{\"detail\":\"model crashed\"}");
    Path audio = Files.write(tempDir.resolve("a.wav"), new byte[] {1});

    assertThatThrownBy(
            () ->
                client(1)
                    .transcribe(
                        audio, TranscribeOptions.withWordTimestamps(Duration.ofSeconds(10), 4)))
        .isInstanceOf(WhisperException.class)
        .hasMessageContaining("failed after 1 attempts")
        .hasRootCauseMessage("Whisper API returned status 500: {\"detail\":\"model crashed\"}");
    assertThat(requests.get()).isEqualTo(1);
  }

  @Test
  void fullText_shouldFallBackToSegments() {
    WhisperResponse response =
        new WhisperResponse(
            null,
            List.of(new TranscriptSegment(0, 1, " a "), new TranscriptSegment(1, 2, "b")),
            null);

    assertThat(response.fullText()).isEqualTo("a b");
  }

  private WhisperClient client(int maxRetries) {
    String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    return new WhisperClient(
        new WhisperProperties(baseUrl, "base", "", 5, 10, maxRetries), new ObjectMapper());
  }
}
