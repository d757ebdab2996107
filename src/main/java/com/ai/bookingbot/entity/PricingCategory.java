package com.ai.bookingbot.entity;

public enum PricingCategory {
    PRIVATE,
    OUTCALL
}
