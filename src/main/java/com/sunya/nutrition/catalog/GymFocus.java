package com.sunya.nutrition.catalog;

import com.sunya.nutrition.profile.FitnessGoal;

public enum GymFocus {
    MUSCLE_GAIN,
    FAT_LOSS,
    ENDURANCE,
    GENERAL;

    public boolean supports(FitnessGoal goal) {
        return switch (this) {
            case MUSCLE_GAIN -> goal == FitnessGoal.MUSCLE_GAIN;
            case FAT_LOSS -> goal == FitnessGoal.WEIGHT_LOSS;
            case ENDURANCE -> goal == FitnessGoal.ENDURANCE;
            case GENERAL -> goal == FitnessGoal.GENERAL_WELLNESS;
        };
    }
}
