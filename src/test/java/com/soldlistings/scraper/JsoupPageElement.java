package com.soldlistings.scraper;

import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.util.List;

/**
 * {@link PageElement} over a parsed jsoup element, for tests that run without a browser.
 */
class JsoupPageElement implements PageElement {
    private final Element element;

    JsoupPageElement(Element element) {
        this.element = element;
    }

    static List<PageElement> select(Element root, String selector) {
        try {
            return root.select(selector).stream().<PageElement>map(JsoupPageElement::new).toList();
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new BrowserSessionException("Invalid selector: " + selector, e);
        }
    }

    @Override
    public List<PageElement> locate(String selector) {
        return select(element, selector);
    }

    @Override
    public String html() {
        return element.outerHtml();
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public String attribute(String name) {
        return element.hasAttr(name) ? element.attr(name) : null;
    }

    @Override
    public PageElement closest(String selector) {
        for (Element e = element; e != null; e = e.parent()) {
            if (e.is(selector)) {
                return new JsoupPageElement(e);
            }
        }
        return null;
    }
}
