package com.cnj.saude.analysis;

import java.math.BigDecimal;

/**
 * One category of a frequency table.
 *
 * @param value      category value as found in the data
 * @param count      occurrences of the value in the subset
 * @param percentage share of the subset total, two decimal places
 */
public record FrequencyEntry(String value, long count, BigDecimal percentage) {}
