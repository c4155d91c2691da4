//
// Pystub - declaration stubs for analyzed Python code

package pystub.model;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A possibly relative reference to a module, as it appears in an import statement. For example
 * {@code ..pkg.mod} has two leading dots and the name parts {@code [pkg, mod]}, while the bare
 * {@code .} of {@code from . import x} has one leading dot and no name parts.
 */
public final class ModuleName {

  /** The number of leading dots; zero for an absolute reference. */
  public final int leadingDots;

  /** The dot separated segments of the name. Empty only for a bare relative reference. */
  public final List<String> nameParts;

  /** Creates an absolute reference from its dotted name, i.e. {@code "os.path"}. */
  public static ModuleName absolute (String dotted) {
    return new ModuleName(0, ImmutableList.copyOf(dotted.split("\\.")));
  }

  public ModuleName (int leadingDots, List<String> nameParts) {
    Preconditions.checkArgument(leadingDots >= 0, "Negative leading dots: %s", leadingDots);
    Preconditions.checkArgument(leadingDots > 0 || !nameParts.isEmpty(),
                                "Absolute module reference with no name parts");
    this.leadingDots = leadingDots;
    this.nameParts = ImmutableList.copyOf(nameParts);
  }

  @Override public boolean equals (Object other) {
    return (other instanceof ModuleName) && leadingDots == ((ModuleName)other).leadingDots &&
      nameParts.equals(((ModuleName)other).nameParts);
  }
  @Override public int hashCode () {
    return leadingDots ^ nameParts.hashCode();
  }
  @Override public String toString () {
    return Strings.repeat(".", leadingDots) + Joiner.on('.').join(nameParts);
  }
}
