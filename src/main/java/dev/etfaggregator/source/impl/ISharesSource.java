package dev.etfaggregator.source.impl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.etfaggregator.config.SourcesConfig;
import dev.etfaggregator.metrics.AggregatorMetrics;
import dev.etfaggregator.model.EtfRecord;
import dev.etfaggregator.source.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * iShares product screener. The document is a JSON object keyed by portfolio id; numeric and
 * date fields come as {@code {"d": display, "r": raw}} pairs.
 */
@Slf4j
@Component
public class ISharesSource extends AbstractEtfSource {

    private static final String SITE = "https://www.ishares.com";
    private static final String SCREENER_URL = SITE + "/us/product-screener/product-screener-v3.1.jsn"
            + "?dcrPath=/templatedata/config/product-screener-v3/data/en/us-ishares/ishares-product-screener-backend-config"
            + "&siteEntryPassthrough=true";

    public ISharesSource(WebClient.Builder webClientBuilder, AggregatorMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig.getIshares());
    }

    @Override
    public String identity() {
        return "iShares";
    }

    @Override
    protected String defaultUrl() {
        return SCREENER_URL;
    }

    @Override
    public Mono<String> fetch() {
        return timedGet(getUrl());
    }

    @Override
    public List<EtfRecord> parse(String raw) {
        JsonNode root = readJson(raw);
        if (!root.isObject()) {
            log.warn("{} - unexpected screener document, expected an object keyed by portfolio id", identity());
            return List.of();
        }
        List<Map.Entry<String, JsonNode>> portfolios = new ArrayList<>();
        root.fields().forEachRemaining(portfolios::add);
        return mapItems(portfolios, this::toRecord);
    }

    private EtfRecord toRecord(Map.Entry<String, JsonNode> portfolio) {
        JsonNode fund = portfolio.getValue();
        String ticker = SourceValues.text(fund, "localExchangeTicker");
        String fundName = SourceValues.text(fund, "fundName");
        String isin = SourceValues.text(fund, "isin");
        if (ticker == null || fundName == null || isin == null) {
            throw new SourceParseException("portfolio " + portfolio.getKey() + " lacks ticker, fund name or ISIN");
        }

        String productPage = SourceValues.text(fund, "productPageUrl");
        return EtfRecord.builder()
                .ticker(ticker)
                .fundName(fundName)
                .isin(isin)
                .cusip(SourceValues.text(fund, "cusip"))
                .inceptionDate(SourceValues.displayDate(display(fund, "inceptionDate")))
                .navAmount(raw(fund, "navAmount"))
                .navAsOf(SourceValues.displayDate(display(fund, "navAmountAsOf")))
                .expenseRatio(raw(fund, "fees"))
                .ytdReturn(performance(fund, "YearToDate"))
                .oneYearReturn(performance(fund, "OneYearAnnualized"))
                .threeYearReturn(performance(fund, "ThreeYearAnnualized"))
                .fiveYearReturn(performance(fund, "FiveYearAnnualized"))
                .tenYearReturn(performance(fund, "TenYearAnnualized"))
                .sinceInceptionReturn(performance(fund, "SinceInceptionAnnualized"))
                .assetClass(SourceValues.text(fund, "aladdinAssetClass"))
                .region(SourceValues.text(fund, "aladdinRegion"))
                .marketType(SourceValues.text(fund, "aladdinMarketType"))
                .distributionYield(raw(fund, "distributionYield"))
                .productPageUrl(productPage)
                .detailPageUrl(absolute(productPage))
                .build();
    }

    /**
     * Quarterly NAV figure, falling back to the price based one.
     */
    private static BigDecimal performance(JsonNode fund, String period) {
        return SourceValues.firstOf(raw(fund, "quarterlyNav" + period), raw(fund, "price" + period));
    }

    private static BigDecimal raw(JsonNode fund, String field) {
        JsonNode value = fund.get(field);
        if (value == null) {
            return null;
        }
        return SourceValues.decimal(value.isObject() ? value.get("r") : value);
    }

    private static String display(JsonNode fund, String field) {
        JsonNode value = fund.get(field);
        if (value == null || !value.isObject()) {
            return null;
        }
        return SourceValues.text(value, "d");
    }

    private static String absolute(String productPage) {
        if (productPage == null) {
            return null;
        }
        return productPage.startsWith("/") ? SITE + productPage : productPage;
    }
}
