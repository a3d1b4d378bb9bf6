package com.dealtracker.bot.service;

import com.dealtracker.bot.exception.MarkupException;
import com.dealtracker.bot.markup.Marker;
import com.dealtracker.bot.markup.MarkupNode;
import com.dealtracker.bot.markup.MarkupParser;
import com.dealtracker.bot.model.ExtractionResult;
import com.dealtracker.bot.model.ListingCandidate;
import com.dealtracker.bot.model.RawPage;
import com.dealtracker.bot.model.SkipReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads product cards off a search/category results page.
 *
 * Page structure relied on:
 *   div[data-component-type=s-search-result]   one per product, in display order
 *     h2 > a[href]                              title and product link
 *     span.a-offscreen                          screen-reader price, e.g. "₹1,299.00"
 *     span.a-price-whole + span.a-price-fraction  split price fallback
 *     span.a-text-price > span.a-offscreen      struck-through MRP
 *
 * Never fails: a card that breaks these assumptions is skipped and the rest are still read.
 * An unreadable page yields no listings.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingExtractor {

    static final Marker RESULT_CARD = Marker.withAttribute("div", "data-component-type", "s-search-result");
    static final Marker HEADING = Marker.tag("h2");
    static final Marker LINK = Marker.tag("a");
    static final Marker SCREEN_READER_PRICE = Marker.withClass("span", "a-offscreen");
    static final Marker PRICE_WHOLE = Marker.withClass("span", "a-price-whole");
    static final Marker PRICE_FRACTION = Marker.withClass("span", "a-price-fraction");
    static final Marker STRIKETHROUGH_PRICE = Marker.withClass("span", "a-text-price");

    private final MarkupParser markupParser;
    private final PriceNormalizer priceNormalizer;

    /**
     * @param page      fetched category page
     * @param maxItems  stop once this many listings have been accepted
     * @param baseDomain prefix for relative product links, e.g. "https://www.amazon.in"
     * @return listings in document order, at most maxItems, never null
     */
    public List<ListingCandidate> extract(RawPage page, int maxItems, String baseDomain) {
        MarkupNode root;
        try {
            root = markupParser.parse(page);
        } catch (MarkupException e) {
            log.warn("Unreadable page from {}: {}", page.sourceUrl(), e.getMessage());
            return List.of();
        }

        List<ListingCandidate> listings = new ArrayList<>();
        Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);

        for (MarkupNode card : root.findAll(RESULT_CARD)) {
            if (listings.size() >= maxItems) break;

            ExtractionResult result = extractCard(card, baseDomain);
            if (result.isAccepted()) {
                listings.add(result.candidate());
            } else {
                log.debug("Skipping result card on {}: {}", page.sourceUrl(), result.skipReason());
                skipped.merge(result.skipReason(), 1, Integer::sum);
            }
        }

        log.debug("Extracted {} listings from {} (skipped: {})", listings.size(), page.sourceUrl(), skipped);
        return listings;
    }

    ExtractionResult extractCard(MarkupNode card, String baseDomain) {
        try {
            Optional<MarkupNode> heading = card.findFirst(HEADING);
            Optional<MarkupNode> anchor = heading.flatMap(h -> h.findFirst(LINK));
            if (anchor.isEmpty()) {
                return ExtractionResult.skipped(SkipReason.MISSING_TITLE_LINK);
            }

            String title = heading.get().text();
            String href = anchor.get().attr("href").trim();
            if (title.isEmpty() || href.isEmpty()) {
                return ExtractionResult.skipped(SkipReason.MISSING_TITLE_LINK);
            }

            Optional<BigDecimal> price = parsePrice(card);
            if (price.isEmpty()) {
                return ExtractionResult.skipped(SkipReason.MISSING_PRICE);
            }

            return ExtractionResult.accepted(ListingCandidate.builder()
                    .title(title)
                    .link(resolveLink(href, baseDomain))
                    .price(price.get())
                    .mrp(parseMrp(card).orElse(null))
                    .build());

        } catch (RuntimeException e) {
            log.debug("Malformed result card: {}", e.getMessage());
            return ExtractionResult.skipped(SkipReason.MALFORMED_CARD);
        }
    }

    // ── Prices ───────────────────────────────────────────────────────────────

    /**
     * Screen-reader price first; split whole/fraction spans only when that is missing or unreadable.
     */
    Optional<BigDecimal> parsePrice(MarkupNode card) {
        Optional<BigDecimal> offscreen = card.findFirst(SCREEN_READER_PRICE)
                .map(MarkupNode::text)
                .flatMap(priceNormalizer::normalize);
        if (offscreen.isPresent()) {
            return offscreen;
        }

        String whole = card.findFirst(PRICE_WHOLE).map(MarkupNode::text).orElse("");
        if (whole.isEmpty()) {
            return Optional.empty();
        }
        whole = whole.replace(",", "");
        // the whole span usually carries its own trailing decimal point
        if (whole.endsWith(".")) {
            whole = whole.substring(0, whole.length() - 1);
        }

        String fraction = card.findFirst(PRICE_FRACTION).map(MarkupNode::text).orElse("");
        return priceNormalizer.normalize(fraction.isEmpty() ? whole : whole + "." + fraction);
    }

    Optional<BigDecimal> parseMrp(MarkupNode card) {
        return card.findFirst(STRIKETHROUGH_PRICE)
                .flatMap(strike -> strike.findFirst(SCREEN_READER_PRICE))
                .map(MarkupNode::text)
                .flatMap(priceNormalizer::normalize);
    }

    // ── Links ────────────────────────────────────────────────────────────────

    static String resolveLink(String href, String baseDomain) {
        if (href.startsWith("http://") || href.startsWith("https://")) {
            return href;
        }
        if (href.startsWith("//")) {
            return "https:" + href;
        }
        String base = baseDomain.endsWith("/") ? baseDomain.substring(0, baseDomain.length() - 1) : baseDomain;
        return href.startsWith("/") ? base + href : base + "/" + href;
    }
}
