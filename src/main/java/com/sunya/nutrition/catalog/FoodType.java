package com.sunya.nutrition.catalog;

public enum FoodType { FRESH, DEHYDRATED, COOKED }
