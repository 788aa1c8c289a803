package dev.etfaggregator.service;

import dev.etfaggregator.model.DividendSimulation;
import dev.etfaggregator.model.DividendSimulationRequest;
import dev.etfaggregator.model.EtfRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Estimates the distributions an investment in one ETF would pay, from its stored NAV and
 * distribution yield. All arithmetic is decimal; only the reported figures are rounded.
 */
@Slf4j
@Component
public class DividendSimulator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final int CENTS = 2;

    /**
     * Simulate holding the fund named by {@code request.ticker()}, looked up across every
     * collection in order and ignoring case.
     *
     * @throws NoSuchElementException   if no stored record carries the ticker
     * @throws IllegalArgumentException if the request is incomplete or the fund lacks a NAV
     *                                  or a distribution yield
     */
    public DividendSimulation simulate(Map<String, List<EtfRecord>> byCollection, DividendSimulationRequest request) {
        validate(request);
        EtfRecord etf = findByTicker(byCollection, request.ticker())
                .orElseThrow(() -> new NoSuchElementException("ETF '" + request.ticker() + "' not found"));
        BigDecimal nav = etf.getNavAmount();
        BigDecimal yield = etf.getDistributionYield();
        if (yield == null || yield.signum() == 0) {
            throw new IllegalArgumentException("ETF '" + etf.getTicker() + "' does not have distribution yield data");
        }
        if (nav == null || nav.signum() <= 0) {
            throw new IllegalArgumentException("ETF '" + etf.getTicker() + "' does not have a NAV");
        }

        BigDecimal investment = request.investmentAmount();
        int months = request.holdingPeriodMonths();

        BigDecimal shares = investment.divide(nav, MathContext.DECIMAL128);
        BigDecimal annual = investment.multiply(yield).divide(HUNDRED, MathContext.DECIMAL128);
        BigDecimal monthly = annual.divide(MONTHS_PER_YEAR, MathContext.DECIMAL128);
        BigDecimal total = monthly.multiply(BigDecimal.valueOf(months));

        log.debug("Simulated {} on {} for {} months", investment, etf.getTicker(), months);
        return new DividendSimulation(
                etf.getTicker(),
                etf.getFundName(),
                investment,
                cents(shares),
                nav,
                yield,
                cents(annual),
                cents(monthly),
                months,
                cents(total));
    }

    static Optional<EtfRecord> findByTicker(Map<String, List<EtfRecord>> byCollection, String ticker) {
        String wanted = ticker.trim();
        return byCollection.values().stream()
                .flatMap(Collection::stream)
                .filter(etf -> etf.getTicker() != null && etf.getTicker().equalsIgnoreCase(wanted))
                .findFirst();
    }

    private static void validate(DividendSimulationRequest request) {
        if (request.ticker() == null || request.ticker().isBlank()) {
            throw new IllegalArgumentException("ticker is required");
        }
        if (request.investmentAmount() == null || request.investmentAmount().signum() <= 0) {
            throw new IllegalArgumentException("investment_amount must be positive");
        }
        if (request.holdingPeriodMonths() == null || request.holdingPeriodMonths() < 1) {
            throw new IllegalArgumentException("holding_period_months must be at least 1");
        }
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(CENTS, RoundingMode.HALF_EVEN);
    }
}
