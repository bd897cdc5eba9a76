package com.oceanintel.argo.service;

import com.oceanintel.argo.model.FilterCriteria;
import com.oceanintel.argo.model.IndexEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Stream;

/**
 * Selects the index entries inside a box and an inclusive date range.
 *
 * Order-preserving and never re-sorting: with maxProfiles set, the result is the
 * first N matches in index order, so the same index and criteria always select
 * the same profiles.
 */
@Component
public class ProfileFilter {

    public List<IndexEntry> select(Stream<IndexEntry> entries, FilterCriteria criteria) {
        Stream<IndexEntry> matches = entries.filter(e -> matches(e, criteria));
        if (criteria.maxProfiles() > 0) {
            matches = matches.limit(criteria.maxProfiles());
        }
        return matches.toList();
    }

    public List<IndexEntry> select(List<IndexEntry> entries, FilterCriteria criteria) {
        return select(entries.stream(), criteria);
    }

    public boolean matches(IndexEntry entry, FilterCriteria criteria) {
        return criteria.containsPosition(entry.latitude(), entry.longitude())
                && criteria.containsDate(entry.date().toLocalDate());
    }
}
