package com.bbthechange.seatwatch.controller;

import com.bbthechange.seatwatch.dto.TrackSectionRequest;
import com.bbthechange.seatwatch.dto.TrackedSectionDTO;
import com.bbthechange.seatwatch.service.TrackedSectionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for a user's tracked sections: track, untrack, clear and list.
 */
@RestController
@RequestMapping("/users/{userId}/tracked-sections")
@Validated
public class TrackedSectionController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(TrackedSectionController.class);

    private final TrackedSectionService trackedSectionService;

    @Autowired
    public TrackedSectionController(TrackedSectionService trackedSectionService) {
        this.trackedSectionService = trackedSectionService;
    }

    /**
     * List tracked sections in the order they were added.
     * GET /users/{userId}/tracked-sections
     */
    @GetMapping
    public ResponseEntity<List<TrackedSectionDTO>> getTracked(@PathVariable String userId) {
        logger.debug("Getting tracked sections for user: {}", userId);
        return ResponseEntity.ok(trackedSectionService.getTracked(userId));
    }

    /**
     * Track a section.
     * POST /users/{userId}/tracked-sections
     */
    @PostMapping
    public ResponseEntity<TrackedSectionDTO> track(
            @PathVariable String userId,
            @Valid @RequestBody TrackSectionRequest request) {
        logger.debug("Tracking CRN {} for user: {}", request.getCrn(), userId);
        TrackedSectionDTO created = trackedSectionService.track(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /**
     * Stop tracking a section.
     * DELETE /users/{userId}/tracked-sections/{crn}
     */
    @DeleteMapping("/{crn}")
    public ResponseEntity<?> untrack(@PathVariable String userId, @PathVariable String crn) {
        if (!trackedSectionService.untrack(userId, crn)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("NOT_FOUND", "CRN " + crn + " is not tracked"));
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Clear the tracking list.
     * DELETE /users/{userId}/tracked-sections
     */
    @DeleteMapping
    public ResponseEntity<Void> clear(@PathVariable String userId) {
        trackedSectionService.clear(userId);
        return ResponseEntity.noContent().build();
    }
}
