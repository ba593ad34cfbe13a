package com.example.prospectus.domain.model;

import java.math.BigDecimal;

public record TrendPoint(String period, BigDecimal value) {
}
