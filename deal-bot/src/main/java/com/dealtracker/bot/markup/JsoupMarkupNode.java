package com.dealtracker.bot.markup;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link MarkupNode} backed by a jsoup element.
 */
public class JsoupMarkupNode implements MarkupNode {

    private final Element element;

    public JsoupMarkupNode(Element element) {
        this.element = element;
    }

    @Override
    public Optional<MarkupNode> findFirst(Marker marker) {
        return Optional.ofNullable(element.selectFirst(marker.toCssSelector()))
                .map(JsoupMarkupNode::new);
    }

    @Override
    public List<MarkupNode> findAll(Marker marker) {
        return element.select(marker.toCssSelector()).stream()
                .map(JsoupMarkupNode::new)
                .collect(Collectors.toList());
    }

    @Override
    public String text() {
        return element.text().trim();
    }

    @Override
    public String attr(String name) {
        return element.attr(name);
    }
}
