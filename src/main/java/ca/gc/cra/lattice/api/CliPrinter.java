package ca.gc.cra.lattice.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes command output (listings, usage, watched events) to stdout, separate from log output.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String line) {
    PrintWriter writer = writer();
    synchronized (writer) {
      writer.println(line);
    }
  }

  /**
   * Prints lines as one block; concurrent event output cannot interleave inside it.
   *
   * @param lines lines to emit
   */
  public static void printLines(List<String> lines) {
    if (lines == null || lines.isEmpty()) {
      return;
    }
    PrintWriter writer = writer();
    synchronized (writer) {
      for (String line : lines) {
        writer.println(line);
      }
      writer.flush();
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
