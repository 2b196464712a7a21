package com.sunya.nutrition.profile;

public enum Gender { MALE, FEMALE }
