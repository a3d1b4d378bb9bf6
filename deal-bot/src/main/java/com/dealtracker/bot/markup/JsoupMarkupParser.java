package com.dealtracker.bot.markup;

import com.dealtracker.bot.exception.MarkupException;
import com.dealtracker.bot.model.RawPage;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Parses raw page bytes with jsoup. The charset is sniffed from the
 * {@code <meta>} declaration or BOM, falling back to UTF-8.
 */
@Component
@Slf4j
public class JsoupMarkupParser implements MarkupParser {

    @Override
    public MarkupNode parse(RawPage page) throws MarkupException {
        byte[] body = page.body() == null ? new byte[0] : page.body();
        String baseUri = page.sourceUrl() == null ? "" : page.sourceUrl();
        try {
            Document document = Jsoup.parse(new ByteArrayInputStream(body), null, baseUri);
            log.debug("Parsed {} bytes from {} (title: {})", body.length, baseUri, document.title());
            return new JsoupMarkupNode(document);
        } catch (IOException e) {
            throw new MarkupException("Could not parse page from " + baseUri + ": " + e.getMessage(), e);
        }
    }
}
