package visualwatch.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.model.CaptureTarget;

import java.util.List;

/**
 * Sends each capture to the first delegate that supports the target kind.
 */
public class RoutingCaptureProvider implements CaptureProvider {

    private static final Logger log = LoggerFactory.getLogger(RoutingCaptureProvider.class);

    private final List<CaptureProvider> delegates;

    public RoutingCaptureProvider(List<CaptureProvider> delegates) {
        if (delegates == null || delegates.isEmpty()) {
            throw new IllegalArgumentException("At least one capture provider is required");
        }
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(CaptureTarget target) {
        return delegates.stream().anyMatch(d -> d.supports(target));
    }

    @Override
    public CaptureResult capture(CaptureTarget target, CaptureOptions options) throws CaptureException {
        for (CaptureProvider delegate : delegates) {
            if (delegate.supports(target)) {
                return delegate.capture(target, options);
            }
        }
        throw new CaptureException(CaptureException.UNSUPPORTED_TARGET,
                "No capture provider for " + target.kind() + " targets");
    }

    @Override
    public void close() {
        for (CaptureProvider delegate : delegates) {
            try {
                delegate.close();
            } catch (RuntimeException e) {
                log.warn("Capture provider {} failed to close: {}", delegate.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
