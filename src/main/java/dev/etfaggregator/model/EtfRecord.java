package dev.etfaggregator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One normalized ETF listing. Only {@code ticker} is required; every numeric field is
 * independently nullable because source coverage varies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EtfRecord {

    private String ticker;
    private String fundName;
    private String isin;
    private String cusip;
    private LocalDate inceptionDate;

    // Pricing
    private BigDecimal navAmount;
    private LocalDate navAsOf;
    private BigDecimal expenseRatio;

    // Returns (%)
    private BigDecimal ytdReturn;
    private BigDecimal oneYearReturn;
    private BigDecimal threeYearReturn;
    private BigDecimal fiveYearReturn;
    private BigDecimal tenYearReturn;
    private BigDecimal sinceInceptionReturn;

    // Classification
    private String assetClass;
    private String region;
    private String marketType;

    // Distributions
    private BigDecimal distributionYield;
    @Builder.Default
    private DistributionFrequency distributionFrequency = DistributionFrequency.UNKNOWN;

    private String productPageUrl;
    private String detailPageUrl;
}
