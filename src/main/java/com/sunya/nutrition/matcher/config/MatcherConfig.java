package com.sunya.nutrition.matcher.config;

import com.sunya.nutrition.catalog.CatalogRepository;
import com.sunya.nutrition.matcher.FruitMatcher;
import com.sunya.nutrition.safety.SafetyValidator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(MatcherProperties.class)
public class MatcherConfig {

    @Bean
    public FruitMatcher fruitMatcher(CatalogRepository catalog, SafetyValidator safetyValidator,
                                     MatcherProperties props, Clock clock) {
        return new FruitMatcher(catalog, safetyValidator, props.toOptions(), clock.instant());
    }
}
