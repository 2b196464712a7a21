package com.sunya.nutrition.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.nutrition.catalog")
public class CatalogProperties {

    private String productsLocation = "classpath:catalog/products.json";
    private String foodsLocation = "classpath:catalog/foods.json";

    public String getProductsLocation() { return productsLocation; }
    public void setProductsLocation(String productsLocation) { this.productsLocation = productsLocation; }

    public String getFoodsLocation() { return foodsLocation; }
    public void setFoodsLocation(String foodsLocation) { this.foodsLocation = foodsLocation; }
}
