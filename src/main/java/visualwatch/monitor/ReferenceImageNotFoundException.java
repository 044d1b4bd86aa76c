package visualwatch.monitor;

import java.nio.file.Path;

public class ReferenceImageNotFoundException extends MonitoringException {

    private final Path referenceImage;

    public ReferenceImageNotFoundException(Path referenceImage) {
        super(REFERENCE_IMAGE_NOT_FOUND, "Reference image not found: " + referenceImage);
        this.referenceImage = referenceImage;
    }

    public Path getReferenceImage() { return referenceImage; }
}
