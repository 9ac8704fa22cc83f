package com.bbthechange.seatwatch.repository.impl;

import com.bbthechange.seatwatch.exception.DuplicateTrackedSectionException;
import com.bbthechange.seatwatch.model.AvailabilityStatus;
import com.bbthechange.seatwatch.model.TrackedSection;
import com.bbthechange.seatwatch.repository.TrackedSectionRepository;
import com.bbthechange.seatwatch.util.SectionNumbers;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-lifetime store keyed by user id.
 * Each user's list is guarded by its own monitor; all access to a list happens while holding it.
 */
@Repository
public class InMemoryTrackedSectionRepository implements TrackedSectionRepository {

    private final ConcurrentHashMap<String, List<TrackedSection>> sectionsByUser = new ConcurrentHashMap<>();

    @Override
    public TrackedSection add(String userId, String term, String subject, String courseNumber,
                              String section, String crn) {
        TrackedSection item = new TrackedSection(
                term,
                SectionNumbers.normalizeSubject(subject),
                courseNumber,
                SectionNumbers.normalizeSection(section),
                crn
        );

        List<TrackedSection> sections = sectionsByUser.computeIfAbsent(userId, id -> new ArrayList<>());
        synchronized (sections) {
            if (sections.stream().anyMatch(existing -> existing.getCrn().equals(crn))) {
                throw new DuplicateTrackedSectionException(userId, crn);
            }
            sections.add(item);
            return new TrackedSection(item);
        }
    }

    @Override
    public boolean remove(String userId, String crn) {
        List<TrackedSection> sections = sectionsByUser.get(userId);
        if (sections == null) {
            return false;
        }
        synchronized (sections) {
            return sections.removeIf(item -> item.getCrn().equals(crn));
        }
    }

    @Override
    public void clear(String userId) {
        List<TrackedSection> sections = sectionsByUser.get(userId);
        if (sections == null) {
            return;
        }
        synchronized (sections) {
            sections.clear();
        }
    }

    @Override
    public List<TrackedSection> list(String userId) {
        List<TrackedSection> sections = sectionsByUser.get(userId);
        if (sections == null) {
            return List.of();
        }
        return copyOf(sections);
    }

    @Override
    public Optional<AvailabilityStatus> updateStatus(String userId, String crn, AvailabilityStatus status) {
        List<TrackedSection> sections = sectionsByUser.get(userId);
        if (sections == null) {
            return Optional.empty();
        }
        synchronized (sections) {
            for (TrackedSection item : sections) {
                if (item.getCrn().equals(crn)) {
                    AvailabilityStatus previous = item.getStatus();
                    item.applyStatus(status);
                    return Optional.of(previous);
                }
            }
        }
        // Removed between dispatch and completion of the poll
        return Optional.empty();
    }

    @Override
    public Map<String, List<TrackedSection>> snapshot() {
        Map<String, List<TrackedSection>> snapshot = new LinkedHashMap<>();
        sectionsByUser.forEach((userId, sections) -> {
            List<TrackedSection> copy = copyOf(sections);
            if (!copy.isEmpty()) {
                snapshot.put(userId, copy);
            }
        });
        return snapshot;
    }

    @Override
    public int countAll() {
        int total = 0;
        for (List<TrackedSection> sections : sectionsByUser.values()) {
            synchronized (sections) {
                total += sections.size();
            }
        }
        return total;
    }

    private static List<TrackedSection> copyOf(List<TrackedSection> sections) {
        synchronized (sections) {
            return sections.stream()
                    .map(TrackedSection::new)
                    .collect(Collectors.toList());
        }
    }
}
