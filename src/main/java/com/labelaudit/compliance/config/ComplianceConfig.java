package com.labelaudit.compliance.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.labelaudit.compliance.service.merge.MergePolicy;
import com.labelaudit.compliance.service.history.TrendCalculator;
import com.labelaudit.compliance.service.rules.RuleCatalogue;
import com.labelaudit.compliance.service.rules.RuleCatalogueLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

@Configuration
public class ComplianceConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return defaultObjectMapper();
    }

    /** Mapper used for the rule catalogue and history files. */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleCatalogueLoader ruleCatalogueLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new RuleCatalogueLoader(objectMapper, resourceLoader);
    }

    /** Loaded once at startup; a defective catalogue stops the context. */
    @Bean
    public RuleCatalogue ruleCatalogue(RuleCatalogueLoader loader, ComplianceProperties properties) {
        return loader.load(properties.getCatalogueLocation());
    }

    @Bean
    public MergePolicy mergePolicy() {
        return MergePolicy.defaults();
    }

    @Bean
    public TrendCalculator trendCalculator(ComplianceProperties properties) {
        return new TrendCalculator(properties.getTrend().getWindow(), properties.getTrend().getEpsilon());
    }
}
