package com.dataox.listingscraper.service;

import com.dataox.listingscraper.model.ListingRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses listings that share a link. The surviving record carries the values of the last
 * occurrence but sits where the first occurrence was.
 */
@Component
public class ListingDeduplicator {

    public List<ListingRecord> dedupe(List<ListingRecord> records) {
        // LinkedHashMap keeps the original insertion slot when a key is re-put
        Map<String, ListingRecord> byLink = new LinkedHashMap<>();
        for (ListingRecord r : records) {
            byLink.put(r.link(), r);
        }
        return new ArrayList<>(byLink.values());
    }
}
