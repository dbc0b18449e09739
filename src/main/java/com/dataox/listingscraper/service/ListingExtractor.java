package com.dataox.listingscraper.service;

import com.dataox.listingscraper.driver.Anchor;
import com.dataox.listingscraper.model.ListingRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the anchors of a rendered result page into listing records.
 *
 * <p>An anchor counts as a listing only when its text carries a thousands-grouped price such
 * as {@code 300,000}. Anchors that point to category pages ("عقارات في ...") are navigation,
 * not listings, and are dropped even if they show a price.
 */
@Component
public class ListingExtractor {

    static final Pattern PRICE = Pattern.compile("[0-9]{1,3}(?:,[0-9]{3})+(?:\\.[0-9]+)?");
    // innerText turns &nbsp; into U+00A0, so whitespace has to be the Unicode kind
    static final Pattern AREA = Pattern.compile("([0-9]+)[\\s\\uFEFF]*م²", Pattern.UNICODE_CHARACTER_CLASS);
    static final String CATEGORY_MARKER = "عقارات في";
    static final int MAX_TITLE_LENGTH = 100;

    public List<ListingRecord> extract(List<Anchor> anchors) {
        List<ListingRecord> out = new ArrayList<>();
        for (Anchor a : anchors) {
            ListingRecord r = toListing(a);
            if (r != null) out.add(r);
        }
        return out;
    }

    ListingRecord toListing(Anchor anchor) {
        String text = anchor.text() == null ? "" : anchor.text();
        if (text.contains(CATEGORY_MARKER)) return null;

        Matcher price = PRICE.matcher(text);
        if (!price.find()) return null;

        Matcher area = AREA.matcher(text);
        return new ListingRecord(
                title(anchor.headingText(), text),
                price.group(),
                area.find() ? area.group(1) : ListingRecord.AREA_NOT_AVAILABLE,
                anchor.href()
        );
    }

    private String title(String heading, String text) {
        if (heading != null && !heading.isEmpty()) return heading;
        int nl = text.indexOf('\n');
        String firstLine = nl < 0 ? text : text.substring(0, nl);
        return firstLine.length() > MAX_TITLE_LENGTH ? firstLine.substring(0, MAX_TITLE_LENGTH) : firstLine;
    }
}
