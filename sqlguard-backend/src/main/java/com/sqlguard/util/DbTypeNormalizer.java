package com.sqlguard.util;

import java.util.Locale;
import java.util.Map;

/**
 * Maps DSN schemes and their aliases onto the canonical dbType.
 */
public final class DbTypeNormalizer {

    public static final String POSTGRES = "postgres";

    private static final Map<String, String> ALIASES = Map.of(
            "postgres", POSTGRES,
            "postgresql", POSTGRES,
            "pg", POSTGRES
    );

    private DbTypeNormalizer() {
    }

    /**
     * Normalize a scheme or dbType.
     *
     * @param dbType incoming value, may be null
     * @return canonical dbType, or the lowercased input when it has no alias
     */
    public static String normalize(String dbType) {
        if (dbType == null) {
            return "";
        }
        String v = dbType.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(v, v);
    }
}
