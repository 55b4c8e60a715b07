package work.btool.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A solver under test at one version. {@code settings} holds the declared settings in declaration
 * order; settings carrying variables stand for the family they expand to. Settings rejected while
 * building (duplicate names, broken variables) are kept in {@code rejectedSettings} with the reason.
 */
public record SystemSpec(
    String name,
    String version,
    String measures,
    Config config,
    String cmdline,
    String cmdlinePost,
    List<Setting> settings,
    Map<String, String> rejectedSettings
) {
    public SystemSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(config, "config");
        measures = measures == null ? "" : measures;
        cmdline = cmdline == null ? "" : cmdline;
        cmdlinePost = cmdlinePost == null ? "" : cmdlinePost;
        settings = settings == null ? List.of() : List.copyOf(settings);
        rejectedSettings = rejectedSettings == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(rejectedSettings));
    }

    public static String key(String name, String version) {
        return name + "-" + version;
    }

    /** Directory-friendly identifier, {@code name-version}. */
    public String id() {
        return key(name, version);
    }

    public Optional<Setting> declaredSetting(String settingName) {
        return settings.stream().filter(s -> s.name().equals(settingName)).findFirst();
    }

    public Optional<String> settingRejection(String settingName) {
        return Optional.ofNullable(rejectedSettings.get(settingName));
    }
}
