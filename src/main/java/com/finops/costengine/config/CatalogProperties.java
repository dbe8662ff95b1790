package com.finops.costengine.config;

import com.finops.costengine.model.CatalogEntry;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource catalog loaded from configuration ({@code catalog.entries}).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    private List<CatalogEntry> entries = new ArrayList<>();
}
