package com.sunya.nutrition.profile;

public enum FitnessGoal {
    MUSCLE_GAIN,
    WEIGHT_LOSS,
    ENDURANCE,
    GENERAL_WELLNESS
}
