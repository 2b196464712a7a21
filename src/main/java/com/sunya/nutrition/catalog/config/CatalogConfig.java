package com.sunya.nutrition.catalog.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.catalog.CatalogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogConfig {

    @Bean
    public CatalogRepository catalogRepository(CatalogProperties props, ResourceLoader loader, ObjectMapper om)
            throws IOException {
        Resource products = loader.getResource(props.getProductsLocation());
        Resource foods = loader.getResource(props.getFoodsLocation());

        try (InputStream p = products.getInputStream(); InputStream f = foods.getInputStream()) {
            CatalogRepository repo = CatalogRepository.load(om, p, f);
            log.info("catalog loaded products={} foods={}", repo.products().size(), repo.foods().size());
            return repo;
        }
    }
}
