package com.dealtracker.bot.markup;

import java.util.Objects;

/**
 * A fixed structural marker identifying nodes in a listing page:
 * a tag name, optionally narrowed by a CSS class or by an attribute value.
 *
 * Examples:
 *  - {@code Marker.tag("h2")}
 *  - {@code Marker.withClass("span", "a-offscreen")}
 *  - {@code Marker.withAttribute("div", "data-component-type", "s-search-result")}
 */
public record Marker(String tag, String cssClass, String attribute, String attributeValue) {

    public Marker {
        Objects.requireNonNull(tag, "tag");
    }

    public static Marker tag(String tag) {
        return new Marker(tag, null, null, null);
    }

    public static Marker withClass(String tag, String cssClass) {
        return new Marker(tag, cssClass, null, null);
    }

    public static Marker withAttribute(String tag, String attribute, String value) {
        return new Marker(tag, null, attribute, value);
    }

    /** CSS selector equivalent, e.g. {@code div[data-component-type="s-search-result"]} */
    public String toCssSelector() {
        StringBuilder selector = new StringBuilder(tag);
        if (cssClass != null) {
            selector.append('.').append(cssClass);
        }
        if (attribute != null) {
            selector.append('[').append(attribute);
            if (attributeValue != null) {
                selector.append("=\"").append(attributeValue.replace("\"", "\\\"")).append('"');
            }
            selector.append(']');
        }
        return selector.toString();
    }
}
