package com.dealtracker.bot.markup;

import com.dealtracker.bot.exception.MarkupException;
import com.dealtracker.bot.model.RawPage;

public interface MarkupParser {

    /**
     * Parse a fetched page into a navigable tree rooted at the document.
     *
     * @throws MarkupException if the body cannot be decoded at all
     */
    MarkupNode parse(RawPage page) throws MarkupException;
}
