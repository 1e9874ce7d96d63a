package domain.model;

import java.util.Locale;

/** SELECT-body shape used to populate one target table. */
public enum Strategy {
    DIRECT,
    UNION,
    PIVOT,
    MISSING_SOURCE;

    /**
     * Lenient parse for the optional {@code strategy} field of a mapping.
     *
     * @return the matching constant, or {@code null} when blank or unknown
     */
    public static Strategy parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim()
                .toUpperCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
        for (Strategy s : values()) {
            if (s.name().equals(v)) return s;
        }
        return null;
    }
}
