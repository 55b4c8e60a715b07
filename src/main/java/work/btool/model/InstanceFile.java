package work.btool.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One member file of an instance. {@code cmdline} and {@code cmdlinePost} are only set when the
 * member declared its own fragments.
 */
public record InstanceFile(Path path, String cmdline, String cmdlinePost) {
    public InstanceFile {
        Objects.requireNonNull(path, "path");
        cmdline = cmdline == null || cmdline.isBlank() ? null : cmdline;
        cmdlinePost = cmdlinePost == null || cmdlinePost.isBlank() ? null : cmdlinePost;
    }

    public static InstanceFile of(Path path) {
        return new InstanceFile(path, null, null);
    }
}
