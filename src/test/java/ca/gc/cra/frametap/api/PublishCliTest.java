package ca.gc.cra.frametap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PublishCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void dryRunDescribesTestPattern() {
    ExitCode code = PublishCli.run(new String[] {
        "sourceId=cam-2", "jpeg=false", "topicSuffix=true", "logEvery=5", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Publish dry-run: no frames will be sent."));
    assertTrue(out.contains(" Target           : bind tcp://*:5555"));
    assertTrue(out.contains(" Images           : test pattern 320x240"));
    assertTrue(out.contains(" Topic            : VideoFrame/cam-2"));
    assertTrue(out.contains(" Log every        : 5 frames"));
    assertTrue(out.contains(" Count            : unbounded"));
  }

  @Test
  void imagesFromMustBeADirectory() {
    ExitCode code = PublishCli.run(new String[] {"imagesFrom=" + tempDir.resolve("missing"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: publish"));
  }

  @Test
  void imagesFromDirectoryIsShownInPlan() {
    ExitCode code = PublishCli.run(new String[] {"imagesFrom=" + tempDir, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(" Images           : " + tempDir.toAbsolutePath().normalize()));
  }

  @Test
  void sourceIdWithSlashIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, PublishCli.run(new String[] {"sourceId=a/b", "--dry-run"}));
  }

  @Test
  void helpIsPrinted() {
    assertEquals(ExitCode.SUCCESS, PublishCli.run(new String[] {"-h"}));
    assertTrue(buffer.toString().contains("FrameTap publisher"));
  }
}
