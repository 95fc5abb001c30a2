package com.example.careplan.household.model;

import java.math.BigDecimal;

public record HouseholdSplit(BigDecimal primary, BigDecimal partner) {
}
