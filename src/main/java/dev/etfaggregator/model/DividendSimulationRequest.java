package dev.etfaggregator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * Input of a dividend simulation: how much goes into which fund, for how long.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DividendSimulationRequest(
        String ticker,
        BigDecimal investmentAmount,
        Integer holdingPeriodMonths) {
}
