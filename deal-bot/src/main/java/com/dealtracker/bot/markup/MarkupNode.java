package com.dealtracker.bot.markup;

import java.util.List;
import java.util.Optional;

/**
 * The only view of a parsed page that extraction depends on.
 * Searches cover all descendants of this node, in document order.
 */
public interface MarkupNode {

    Optional<MarkupNode> findFirst(Marker marker);

    List<MarkupNode> findAll(Marker marker);

    /** Combined text of this node and its descendants, whitespace-normalised and trimmed */
    String text();

    /** Attribute value, or an empty string when the attribute is absent */
    String attr(String name);
}
