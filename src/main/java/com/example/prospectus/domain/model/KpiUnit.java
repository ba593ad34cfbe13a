package com.example.prospectus.domain.model;

public enum KpiUnit {
    CURRENCY,
    PERCENTAGE,
    RATIO,
    DIMENSIONLESS
}
