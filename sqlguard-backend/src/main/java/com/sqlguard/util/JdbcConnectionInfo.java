package com.sqlguard.util;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    private String password;
    private String dbType;
    /** Driver properties carried over from the DSN query string (sslmode, ...). */
    @Singular
    private Map<String, String> properties;
}
