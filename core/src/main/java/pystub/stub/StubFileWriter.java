//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import pystub.model.Module;

/**
 * Writes the stub for a module to a file. The file is replaced wholesale; nothing is merged with
 * what was there before.
 */
public class StubFileWriter {

  public StubFileWriter (StubEmitter emitter) {
    _emitter = emitter;
  }

  /**
   * Renders {@code module} with {@code format} and writes the result to {@code dest} as UTF-8,
   * overwriting any existing file. The stub is rendered in full before the file is opened, so a
   * rendering failure leaves {@code dest} untouched.
   *
   * @throws IOException if the file cannot be written. A partially written file is not removed.
   * @throws RenderException if an expression in a declaration cannot be rendered.
   */
  public void write (Module module, Formatting format, Path dest) throws IOException {
    String text = _emitter.emit(module, format);
    MoreFiles.asCharSink(dest, StandardCharsets.UTF_8).write(text);
  }

  private final StubEmitter _emitter;
}
