package work.btool.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An encoding file attached to runs. {@code tag} is a tag expression; {@code null} or blank means
 * the encoding is always attached where it is declared.
 */
public record Encoding(Path file, String tag) {
    public Encoding {
        Objects.requireNonNull(file, "file");
        tag = tag == null || tag.isBlank() ? null : tag.trim();
    }

    public static Encoding untagged(Path file) {
        return new Encoding(file, null);
    }

    public boolean isTagged() {
        return tag != null;
    }
}
