package dev.etfaggregator.source.impl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.etfaggregator.config.SourcesConfig;
import dev.etfaggregator.metrics.AggregatorMetrics;
import dev.etfaggregator.model.DistributionFrequency;
import dev.etfaggregator.model.EtfRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Goldman Sachs Asset Management fund finder, queried through its GraphQL endpoint.
 */
@Slf4j
@Component
public class GoldmanSachsSource extends AbstractEtfSource {

    private static final String FUNDS_URL = "https://am.gs.com/services/funds";
    private static final String PRODUCT_URL = "https://am.gs.com/en-us/institutions/products/";
    private static final int PAGE_LIMIT = 500;

    private static final String QUERY = """
            query getFunds($fundRequest: FundRequest) {
              fundData(fundRequest: $fundRequest) {
                funds {
                  fundName
                  fundType
                  shareClasses {
                    shareClassId
                    ticker
                    shareClassInceptionDate
                    distributionFrequency
                    dailyPerformance { nav { asAtDate value } }
                    monthlyPerformance {
                      asAtDate
                      annualisedReturns1yr
                      annualisedReturns3yr
                      annualisedReturns5yr
                      annualisedReturns10yr
                      annualisedReturnsSinceIncept
                    }
                  }
                }
              }
            }
            """;

    public GoldmanSachsSource(WebClient.Builder webClientBuilder, AggregatorMetrics metrics,
                              SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig.getGoldmanSachs());
    }

    @Override
    public String identity() {
        return "GoldmanSachs";
    }

    @Override
    protected String defaultUrl() {
        return FUNDS_URL;
    }

    @Override
    public Mono<String> fetch() {
        return timedPost(getUrl(), buildRequest());
    }

    Map<String, Object> buildRequest() {
        Map<String, Object> fundRequest = Map.of(
                "country", "us",
                "language", "en",
                "audience", "institutions",
                "disabledFunds", List.of(),
                "limit", PAGE_LIMIT,
                "offset", 0,
                "sortBy", "FN",
                "sortOrder", "ASC",
                "filterParam", Map.of("searchText", ""));
        return Map.of(
                "operationName", "getFunds",
                "variables", Map.of("fundRequest", fundRequest),
                "query", QUERY);
    }

    @Override
    public List<EtfRecord> parse(String raw) {
        JsonNode funds = readJson(raw).path("data").path("fundData").path("funds");
        if (!funds.isArray()) {
            log.warn("{} - response carries no fund list", identity());
            return List.of();
        }

        List<ShareClass> shareClasses = new ArrayList<>();
        for (JsonNode fund : funds) {
            if (!"ETF".equals(SourceValues.text(fund, "fundType"))) {
                continue;
            }
            String fundName = SourceValues.text(fund, "fundName");
            for (JsonNode shareClass : fund.path("shareClasses")) {
                if (SourceValues.text(shareClass, "ticker") != null) {
                    shareClasses.add(new ShareClass(fundName, shareClass));
                }
            }
        }
        return mapItems(shareClasses, this::toRecord);
    }

    private EtfRecord toRecord(ShareClass item) {
        JsonNode shareClass = item.node();
        String ticker = SourceValues.text(shareClass, "ticker");
        JsonNode nav = shareClass.path("dailyPerformance").path("nav");
        JsonNode monthly = shareClass.path("monthlyPerformance");
        String detailUrl = PRODUCT_URL + ticker;

        return EtfRecord.builder()
                .ticker(ticker)
                .fundName(item.fundName() != null ? item.fundName() : ticker)
                .inceptionDate(SourceValues.isoDate(SourceValues.text(shareClass, "shareClassInceptionDate")))
                .navAmount(SourceValues.decimal(nav.get("value")))
                .navAsOf(SourceValues.isoDate(SourceValues.text(nav, "asAtDate")))
                .oneYearReturn(SourceValues.decimal(monthly.get("annualisedReturns1yr")))
                .threeYearReturn(SourceValues.decimal(monthly.get("annualisedReturns3yr")))
                .fiveYearReturn(SourceValues.decimal(monthly.get("annualisedReturns5yr")))
                .tenYearReturn(SourceValues.decimal(monthly.get("annualisedReturns10yr")))
                .sinceInceptionReturn(SourceValues.decimal(monthly.get("annualisedReturnsSinceIncept")))
                .region("US")
                .marketType("ETF")
                .distributionFrequency(DistributionFrequency.fromText(
                        SourceValues.text(shareClass, "distributionFrequency")))
                .productPageUrl(detailUrl)
                .detailPageUrl(detailUrl)
                .build();
    }

    private record ShareClass(String fundName, JsonNode node) {
    }
}
