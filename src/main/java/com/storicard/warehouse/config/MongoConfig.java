package com.storicard.warehouse.config;

import com.mongodb.MongoCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Adds document store credentials from {@code pipeline.mongo} when a username is configured;
 * host, port and database come from {@code spring.data.mongodb}.
 */
@Slf4j
@Configuration
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer mongoCredentialsCustomizer(PipelineProperties properties) {
        PipelineProperties.Mongo mongo = properties.getMongo();
        return builder -> {
            if (!StringUtils.hasText(mongo.getUsername())) {
                log.debug("No MongoDB username configured, connecting without credentials");
                return;
            }
            char[] password = mongo.getPassword() == null ? new char[0] : mongo.getPassword().toCharArray();
            builder.credential(MongoCredential.createCredential(
                mongo.getUsername(), mongo.getAuthenticationDatabase(), password));
        };
    }
}
