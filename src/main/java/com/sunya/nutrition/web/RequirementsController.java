package com.sunya.nutrition.web;

import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.requirements.DailyRequirementCalculator;
import com.sunya.nutrition.requirements.DailyRequirements;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/requirements")
public class RequirementsController {

    private final DailyRequirementCalculator calculator;

    @PostMapping
    public DailyRequirements calculate(@Valid @RequestBody UserProfile profile) {
        return calculator.calculateDailyRequirements(profile);
    }
}
