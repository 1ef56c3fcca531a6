package com.nikoh.matchmaking.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "nikoh.storage")
public class StorageProperties {

    /**
     * Root directory for uploaded documents and selfies
     */
    private String rootDir = "./uploads";
}
