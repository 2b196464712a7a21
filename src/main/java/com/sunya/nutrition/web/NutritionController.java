package com.sunya.nutrition.web;

import com.sunya.nutrition.acquisition.NutritionAcquisitionService;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.safety.NutritionIntelligenceEngine;
import com.sunya.nutrition.safety.NutritionIntelligenceResult;
import com.sunya.nutrition.safety.SafetyReport;
import com.sunya.nutrition.safety.SafetyValidator;
import com.sunya.nutrition.web.dto.AnalyzeRequest;
import com.sunya.nutrition.web.dto.SafetyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/nutrition")
public class NutritionController {

    private final NutritionAcquisitionService acquisition;
    private final NutritionIntelligenceEngine engine;
    private final SafetyValidator safetyValidator;

    @GetMapping
    public NutritionSearchResult search(@RequestParam("q") String q) {
        return acquisition.fetchNutrition(q);
    }

    @PostMapping("/analyze")
    public NutritionIntelligenceResult analyze(@Valid @RequestBody AnalyzeRequest body) {
        return engine.analyze(body.record(), body.profile(), body.options());
    }

    @PostMapping("/safety")
    public SafetyReport safety(@Valid @RequestBody SafetyRequest body) {
        return safetyValidator.getSafetyReport(body.record(), body.profile());
    }
}
