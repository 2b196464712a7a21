package com.sunya.nutrition.acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.nutrition.cache")
public class NutritionCacheProperties {

    /** blank = memory only */
    private String persistenceDir = "";

    /** 0 = unbounded */
    private long maxSize = 0;

    public String getPersistenceDir() { return persistenceDir; }
    public void setPersistenceDir(String persistenceDir) { this.persistenceDir = persistenceDir; }

    public long getMaxSize() { return maxSize; }
    public void setMaxSize(long maxSize) { this.maxSize = maxSize; }
}
