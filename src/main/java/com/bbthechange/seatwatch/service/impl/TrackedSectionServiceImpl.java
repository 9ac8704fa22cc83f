package com.bbthechange.seatwatch.service.impl;

import com.bbthechange.seatwatch.dto.TrackSectionRequest;
import com.bbthechange.seatwatch.dto.TrackedSectionDTO;
import com.bbthechange.seatwatch.exception.ValidationException;
import com.bbthechange.seatwatch.model.TrackedSection;
import com.bbthechange.seatwatch.repository.TrackedSectionRepository;
import com.bbthechange.seatwatch.service.SeatNotificationTextGenerator;
import com.bbthechange.seatwatch.service.TrackedSectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class TrackedSectionServiceImpl implements TrackedSectionService {

    private static final Logger logger = LoggerFactory.getLogger(TrackedSectionServiceImpl.class);

    private final TrackedSectionRepository repository;
    private final SeatNotificationTextGenerator textGenerator;

    public TrackedSectionServiceImpl(TrackedSectionRepository repository,
                                     SeatNotificationTextGenerator textGenerator) {
        this.repository = repository;
        this.textGenerator = textGenerator;
    }

    @Override
    public TrackedSectionDTO track(String userId, TrackSectionRequest request) {
        requireUser(userId);
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        requireField("term", request.getTerm());
        requireField("subject", request.getSubject());
        requireField("courseNumber", request.getCourseNumber());
        requireField("section", request.getSection());
        requireField("crn", request.getCrn());

        TrackedSection added = repository.add(userId, request.getTerm(), request.getSubject(),
                request.getCourseNumber(), request.getSection(), request.getCrn());

        logger.info("User {} now tracks {} (CRN {}) in term {}",
                userId, added.getLabel(), added.getCrn(), added.getTerm());
        return toDto(added);
    }

    @Override
    public boolean untrack(String userId, String crn) {
        requireUser(userId);
        boolean removed = repository.remove(userId, crn == null ? null : crn.trim());
        if (removed) {
            logger.info("User {} stopped tracking CRN {}", userId, crn);
        } else {
            logger.debug("User {} does not track CRN {}", userId, crn);
        }
        return removed;
    }

    @Override
    public void clear(String userId) {
        requireUser(userId);
        repository.clear(userId);
        logger.info("Cleared tracking list of user {}", userId);
    }

    @Override
    public List<TrackedSectionDTO> getTracked(String userId) {
        requireUser(userId);
        return repository.list(userId).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    private TrackedSectionDTO toDto(TrackedSection section) {
        return TrackedSectionDTO.from(section, textGenerator.getTrackedSummary(section));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User ID is required");
        }
    }

    private static void requireField(String name, String value) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException(name + " is required");
        }
    }
}
