package com.sunya.nutrition.safety.config;

import com.sunya.nutrition.requirements.DailyRequirementCalculator;
import com.sunya.nutrition.safety.FoodSafetyRules;
import com.sunya.nutrition.safety.NutritionIntelligenceEngine;
import com.sunya.nutrition.safety.SafetyValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SafetyRulesConfig {

    @Bean
    public DailyRequirementCalculator dailyRequirementCalculator() {
        return new DailyRequirementCalculator();
    }

    @Bean
    public NutritionIntelligenceEngine nutritionIntelligenceEngine(DailyRequirementCalculator calculator, Clock clock) {
        return new NutritionIntelligenceEngine(calculator, clock);
    }

    @Bean
    public SafetyValidator safetyValidator(NutritionIntelligenceEngine engine) {
        return engine.safetyValidator();
    }

    @Bean
    public FoodSafetyRules foodSafetyRules() {
        return new FoodSafetyRules();
    }
}
