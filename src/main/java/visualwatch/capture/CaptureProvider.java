package visualwatch.capture;

import visualwatch.model.CaptureTarget;

/**
 * Produces an image of a {@link CaptureTarget}.
 *
 * <p>Implementations must be safe to call from the scheduler's timer threads;
 * two sessions may capture at the same time.
 */
public interface CaptureProvider {

    CaptureResult capture(CaptureTarget target, CaptureOptions options) throws CaptureException;

    /** Returns true if this provider can capture targets of the given kind. */
    boolean supports(CaptureTarget target);

    /** Releases browsers or other native resources. Default: nothing to release. */
    default void close() {}
}
