package com.sqlguard.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcConnectionInfoResolverTest {

    private final JdbcConnectionInfoResolver resolver = new JdbcConnectionInfoResolver();

    @Test
    void buildsJdbcUrlFromPostgresDsn() {
        JdbcConnectionInfo info = resolver.resolve("postgresql://agent:pw@db.internal/shop?sslmode=require");

        assertEquals("jdbc:postgresql://db.internal:5432/shop", info.getUrl());
        assertEquals("agent", info.getUsername());
        assertEquals("pw", info.getPassword());
        assertEquals(DbTypeNormalizer.POSTGRES, info.getDbType());
        assertEquals("require", info.getProperties().get("sslmode"));
    }

    @Test
    void passesJdbcUrlThrough() {
        JdbcConnectionInfo info = resolver.resolve(" jdbc:postgresql://db:5433/shop?user=a ");

        assertEquals("jdbc:postgresql://db:5433/shop?user=a", info.getUrl());
        assertNull(info.getUsername());
        assertTrue(info.getProperties().isEmpty());
    }

    @Test
    void rejectsOtherDatabases() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve("mysql://u:p@db/shop"));
        assertEquals("Unsupported database type: mysql", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve("  "));
    }

    @Test
    void normalizesSchemeAliases() {
        assertEquals("postgres", DbTypeNormalizer.normalize(" PG "));
        assertEquals("postgres", DbTypeNormalizer.normalize("PostgreSQL"));
        assertEquals("oracle", DbTypeNormalizer.normalize("Oracle"));
        assertEquals("", DbTypeNormalizer.normalize(null));
    }
}
