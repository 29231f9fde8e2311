package com.mentorship.scheduling.controller;

import com.mentorship.scheduling.dto.AvailabilityRuleRequest;
import com.mentorship.scheduling.dto.AvailabilityRuleResponse;
import com.mentorship.scheduling.dto.Slot;
import com.mentorship.scheduling.service.AvailabilityService;
import com.mentorship.scheduling.service.SlotService;
import com.mentorship.scheduling.utils.TimeFormats;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/availability")
public class AvailabilityController {

    static final String USER_HEADER = "X-User-Id";

    private final AvailabilityService availabilityService;
    private final SlotService slotService;

    public AvailabilityController(AvailabilityService availabilityService, SlotService slotService) {
        this.availabilityService = availabilityService;
        this.slotService = slotService;
    }

    @GetMapping("/{mentorId}/{date}")
    public List<Slot> slots(@PathVariable Long mentorId, @PathVariable String date) {
        return slotService.generateSlots(mentorId, TimeFormats.parseDate(date, "date"));
    }

    @GetMapping("/{mentorId}")
    public List<AvailabilityRuleResponse> rules(@PathVariable Long mentorId) {
        return availabilityService.getRules(mentorId).stream()
                .map(AvailabilityRuleResponse::from)
                .toList();
    }

    /** The caller is the mentor whose rule is created or updated. */
    @PostMapping
    public ResponseEntity<AvailabilityRuleResponse> saveRule(@RequestHeader(USER_HEADER) Long userId,
                                                             @Valid @RequestBody AvailabilityRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AvailabilityRuleResponse.from(availabilityService.saveRule(userId, request)));
    }

    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long ruleId) {
        availabilityService.deleteRule(ruleId, userId);
        return ResponseEntity.noContent().build();
    }
}
