package com.sqlguard.config;

import com.sqlguard.service.BackendContext;
import com.sqlguard.service.BackendProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class BackendConfiguration {

    @Bean
    public DatabaseSettings databaseSettings(Environment environment) {
        return DatabaseSettings.fromEnvironment(environment);
    }

    /**
     * The mode is fixed here for the lifetime of the process; the pool closes with the context.
     */
    @Bean(destroyMethod = "close")
    public BackendContext backendContext(BackendProbe backendProbe, DatabaseSettings databaseSettings) {
        return backendProbe.probe(databaseSettings);
    }
}
