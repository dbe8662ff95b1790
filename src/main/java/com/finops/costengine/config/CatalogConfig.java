package com.finops.costengine.config;

import com.finops.costengine.engine.rightsizing.ResourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public ResourceCatalog resourceCatalog(CatalogProperties properties) {
        ResourceCatalog catalog = ResourceCatalog.of(properties.getEntries());
        log.info("Loaded resource catalog with {} entries", catalog.size());
        return catalog;
    }
}
