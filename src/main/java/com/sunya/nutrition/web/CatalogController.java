package com.sunya.nutrition.web;

import com.sunya.nutrition.matcher.AlternativeSuggestion;
import com.sunya.nutrition.matcher.FruitMatchResult;
import com.sunya.nutrition.matcher.FruitMatcher;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.recommendation.CatalogRanking;
import com.sunya.nutrition.recommendation.RecommendationService;
import com.sunya.nutrition.web.dto.QueryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/catalog")
public class CatalogController {

    private final FruitMatcher matcher;
    private final RecommendationService recommendations;

    @GetMapping("/match")
    public FruitMatchResult match(@RequestParam("q") String q) {
        return matcher.matchFruitToProduct(q);
    }

    @GetMapping("/similar")
    public List<FruitMatchResult> similar(@RequestParam("q") String q) {
        return matcher.findSimilarFruits(q);
    }

    /** 204 when no candidate is similar enough (or all of them are blocked). */
    @PostMapping("/alternative")
    public ResponseEntity<AlternativeSuggestion> alternative(@Valid @RequestBody QueryRequest body) {
        return matcher.getBestAlternative(body.query(), body.profile())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/ranking")
    public CatalogRanking ranking(@Valid @RequestBody(required = false) UserProfile profile) {
        return recommendations.rankCatalog(profile);
    }
}
