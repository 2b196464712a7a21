package com.sunya.nutrition.web;

import com.sunya.nutrition.recommendation.Recommendation;
import com.sunya.nutrition.recommendation.RecommendationService;
import com.sunya.nutrition.web.dto.QueryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/recommendations")
public class RecommendationController {

    private final RecommendationService service;

    @PostMapping
    public Recommendation recommend(@Valid @RequestBody QueryRequest body) {
        return service.recommend(body.query(), body.profile(), body.options());
    }
}
