package com.sunya.nutrition.matcher.config;

import com.sunya.nutrition.matcher.MatchOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.nutrition.matcher")
public class MatcherProperties {

    /** SIMILAR results below this overall score (0-100) are dropped */
    private int minSimilarityThreshold = 50;
    private boolean includeSynonyms = true;
    private boolean filterUnsafe = true;
    private int maxAlternatives = 3;

    public MatchOptions toOptions() {
        return new MatchOptions(minSimilarityThreshold, includeSynonyms, maxAlternatives, filterUnsafe);
    }

    public int getMinSimilarityThreshold() { return minSimilarityThreshold; }
    public void setMinSimilarityThreshold(int minSimilarityThreshold) { this.minSimilarityThreshold = minSimilarityThreshold; }

    public boolean isIncludeSynonyms() { return includeSynonyms; }
    public void setIncludeSynonyms(boolean includeSynonyms) { this.includeSynonyms = includeSynonyms; }

    public boolean isFilterUnsafe() { return filterUnsafe; }
    public void setFilterUnsafe(boolean filterUnsafe) { this.filterUnsafe = filterUnsafe; }

    public int getMaxAlternatives() { return maxAlternatives; }
    public void setMaxAlternatives(int maxAlternatives) { this.maxAlternatives = maxAlternatives; }
}
