//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import pystub.model.Module;

/**
 * Writes stubs for a batch of modules. Each module is rendered independently; a module that fails
 * to render or write is reported on stderr and does not stop the rest of the batch.
 */
public class StubGenerator {

  /** A module to be stubbed, with the formatting of its source and the stub's destination. */
  public static class Unit {
    public final Module module;
    public final Formatting format;
    public final Path dest;

    public Unit (Module module, Formatting format, Path dest) {
      this.module = Preconditions.checkNotNull(module);
      this.format = Preconditions.checkNotNull(format);
      this.dest = Preconditions.checkNotNull(dest);
    }

    @Override public String toString () {
      return dest.toString();
    }
  }

  public StubGenerator () {
    this(new StubFileWriter(StubEmitter.forPython()));
  }

  public StubGenerator (StubFileWriter writer) {
    _writer = writer;
  }

  /** Writes a stub for each of {@code units}.
    * @return the number of stubs that were successfully written. */
  public int process (Iterable<Unit> units) {
    int written = 0;
    for (Unit unit : units) {
      try {
        _writer.write(unit.module, unit.format, unit.dest);
        written++;
      } catch (IOException | RuntimeException e) {
        System.err.println("Failed to write stub [dest=" + unit + ", error=" + e + "]");
        e.printStackTrace(System.err);
      }
    }
    return written;
  }

  /** Writes a stub for {@code unit}.
    * @return true if the stub was written, false if it failed (the failure is logged). */
  public boolean process (Unit unit) {
    return process(Collections.singletonList(unit)) == 1;
  }

  private final StubFileWriter _writer;
}
