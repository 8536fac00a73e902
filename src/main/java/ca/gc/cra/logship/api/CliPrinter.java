package ca.gc.cra.logship.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text and dry-run plans.
 *
 * <p>Writes to the stdout file descriptor directly so operator-facing text stays separate from SLF4J output
 * routed by {@code logback.xml}.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints lines to stdout.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void println(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = override != null ? override : STDOUT;
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }
}
