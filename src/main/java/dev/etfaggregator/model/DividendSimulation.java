package dev.etfaggregator.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * Projected income of holding one ETF. Amounts are written as strings so their scale is kept;
 * estimates and the share count are rounded to cents.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DividendSimulation(
        String ticker,
        String fundName,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal investmentAmount,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal sharesPurchased,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal currentPrice,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal distributionYield,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal annualDividendEstimate,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal monthlyDividendEstimate,
        int holdingPeriodMonths,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalDividendEstimate) {
}
