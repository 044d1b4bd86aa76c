package visualwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a monitoring session captures on every tick.
 *
 * <p>Serialised with a {@code type} discriminator so that session documents
 * read back into the right variant:
 * <pre>
 * {"type":"url","url":"https://example.com","viewport":{"width":1200,"height":800}}
 * {"type":"window","windowTitle":"Calculator"}
 * {"type":"region","x":0,"y":0,"width":640,"height":480}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CaptureTarget.Url.class,    name = "url"),
        @JsonSubTypes.Type(value = CaptureTarget.Window.class, name = "window"),
        @JsonSubTypes.Type(value = CaptureTarget.Region.class, name = "region")
})
public interface CaptureTarget {

    /** Short label for log lines ({@code url}, {@code window}, {@code region}). */
    @JsonIgnore
    String kind();

    // ── Variants ──────────────────────────────────────────────────────────

    /** A web page rendered in a browser, optionally at a fixed viewport. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Url(String url, Viewport viewport) implements CaptureTarget {

        public Url {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url target requires a non-blank url");
            }
        }

        public Url(String url) {
            this(url, null);
        }

        @Override
        public String kind() { return "url"; }
    }

    /** A desktop window located by title (and optionally owning process). */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Window(String windowTitle, String processName) implements CaptureTarget {

        public Window {
            if (windowTitle == null || windowTitle.isBlank()) {
                throw new IllegalArgumentException("window target requires a window title");
            }
        }

        @Override
        public String kind() { return "window"; }
    }

    /** A rectangular region of the primary screen. */
    record Region(int x, int y, int width, int height) implements CaptureTarget {

        public Region {
            if (x < 0 || y < 0) {
                throw new IllegalArgumentException("region origin must be non-negative: " + x + "," + y);
            }
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("region size must be positive: " + width + "x" + height);
            }
        }

        @Override
        public String kind() { return "region"; }
    }

    /** Browser viewport size in CSS pixels. */
    record Viewport(int width, int height) {

        public Viewport {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("viewport size must be positive: " + width + "x" + height);
            }
        }
    }
}
