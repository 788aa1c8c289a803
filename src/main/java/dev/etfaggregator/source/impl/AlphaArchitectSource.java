package dev.etfaggregator.source.impl;

import dev.etfaggregator.config.SourcesConfig;
import dev.etfaggregator.metrics.AggregatorMetrics;
import dev.etfaggregator.model.EtfRecord;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Alpha Architect fund site. Funds are linked from the landing page as {@code /ticker/}.
 */
@Slf4j
@Component
public class AlphaArchitectSource extends AbstractEtfSource {

    private static final String FUNDS_URL = "https://funds.alphaarchitect.com/";
    private static final Pattern TICKER_LINK = Pattern.compile("^/([a-z]{3,5})/?$", Pattern.CASE_INSENSITIVE);
    private static final Set<String> NAVIGATION = Set.of("FUNDS", "HOME", "ABOUT", "NEWS", "BLOG");

    public AlphaArchitectSource(WebClient.Builder webClientBuilder, AggregatorMetrics metrics,
                                SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig.getAlphaArchitect());
    }

    @Override
    public String identity() {
        return "Alpha Architect";
    }

    @Override
    protected String defaultUrl() {
        return FUNDS_URL;
    }

    @Override
    public Mono<String> fetch() {
        return timedGet(getUrl());
    }

    @Override
    public List<EtfRecord> parse(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, getUrl());
        Set<String> seen = new LinkedHashSet<>();
        List<EtfRecord> records = new ArrayList<>();

        for (Element link : document.select("a[href]")) {
            String href = link.attr("href").trim();
            Matcher matcher = TICKER_LINK.matcher(href);
            if (!matcher.matches()) {
                continue;
            }
            String ticker = matcher.group(1).toUpperCase(Locale.ROOT);
            if (NAVIGATION.contains(ticker) || !seen.add(ticker)) {
                continue;
            }

            String text = link.text().trim();
            String title = link.attr("title").trim();
            String fundName = !text.isEmpty() ? text : !title.isEmpty() ? title : ticker;
            String url = link.absUrl("href");

            records.add(EtfRecord.builder()
                    .ticker(ticker)
                    .fundName(fundName)
                    .region("US")
                    .marketType("ETF")
                    .productPageUrl(url)
                    .detailPageUrl(url)
                    .build());
        }
        log.debug("{} - found {} fund links", identity(), records.size());
        return records;
    }
}
