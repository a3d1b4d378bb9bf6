package com.dealtracker.bot.service;

import com.dealtracker.bot.exception.FetchException;
import com.dealtracker.bot.model.AlertMessage;
import com.dealtracker.bot.model.CategoryTarget;
import com.dealtracker.bot.model.ClassifiedListing;
import com.dealtracker.bot.model.ListingCandidate;
import com.dealtracker.bot.model.RawPage;
import com.dealtracker.bot.model.RunConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * One category, end to end: fetch → extract → classify → compose.
 *
 * Dispatch is left to the caller so pacing and delivery failures are handled in one place.
 * A failed fetch yields no messages for this pass; the category is simply tried again next pass.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CategoryPipeline {

    private final PageFetcher pageFetcher;
    private final ListingExtractor listingExtractor;
    private final DealClassifier dealClassifier;
    private final AlertComposer alertComposer;

    /**
     * @return alerts for every qualifying listing, in page order (may be empty, never null)
     */
    public List<AlertMessage> run(CategoryTarget category, RunConfig config) {
        RawPage page;
        try {
            page = pageFetcher.fetch(category.sourceUrl());
        } catch (FetchException e) {
            log.warn("Failed to GET category page for {}: {}", category.name(), e.getMessage());
            return List.of();
        }

        List<ListingCandidate> candidates =
                listingExtractor.extract(page, config.getMaxItemsPerCategory(), config.getBaseDomain());

        List<AlertMessage> messages = new ArrayList<>();
        int megaDeals = 0;
        for (ListingCandidate candidate : candidates) {
            ClassifiedListing listing = dealClassifier.classify(candidate, config);
            if (!listing.isQualifies()) continue;

            if (listing.isMegaDeal()) megaDeals++;
            String text = alertComposer.compose(listing, category.name(), config);
            messages.add(new AlertMessage(text, category.name(), listing));
        }

        log.info("Category {}: {} listings extracted, {} qualifying ({} mega deals)",
                category.name(), candidates.size(), messages.size(), megaDeals);
        return messages;
    }
}
