package visualwatch.compare;

import java.nio.file.Path;

/** Compares a fresh capture with a reference image. */
public interface ComparisonProvider {

    ComparisonResult compare(Path current, Path reference, ComparisonOptions options) throws ComparisonException;
}
