package com.sunya.nutrition.matcher;

public enum AvailabilityStatus { IN_STOCK, LIMITED, OUT_OF_STOCK }
