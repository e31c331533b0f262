package ch.so.arp.rag.pipeline;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of the stored collection, used to verify an ingestion.
 *
 * @param totalEntries      number of entries in the collection
 * @param entriesPerSource  entries grouped by source, sorted by source
 * @param missingSource     entries without a source
 * @param minLength         shortest chunk text, 0 if empty
 * @param maxLength         longest chunk text, 0 if empty
 * @param averageLength     mean chunk text length, 0 if empty
 * @param oversizedEntries  entries longer than the configured chunk size
 */
public record IndexReport(int totalEntries, Map<String, Integer> entriesPerSource, int missingSource,
        int minLength, int maxLength, double averageLength, int oversizedEntries) {

    public IndexReport {
        entriesPerSource = Collections.unmodifiableMap(new TreeMap<>(entriesPerSource));
    }
}
