package work.rospkg.identification;

import java.util.Locale;

/**
 * Why a location was excluded from identification.
 */
public enum SkipReason {
    IGNORE_MARKER,
    LEGACY_MANIFEST,
    MISSING_SETUP_SCRIPT;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
