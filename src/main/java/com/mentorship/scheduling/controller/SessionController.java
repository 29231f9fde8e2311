package com.mentorship.scheduling.controller;

import com.mentorship.scheduling.dto.CancelRequest;
import com.mentorship.scheduling.dto.CreateSessionRequest;
import com.mentorship.scheduling.dto.RescheduleRequest;
import com.mentorship.scheduling.dto.SessionPageResponse;
import com.mentorship.scheduling.dto.SessionResponse;
import com.mentorship.scheduling.dto.UpdateStatusRequest;
import com.mentorship.scheduling.service.BookingValidator;
import com.mentorship.scheduling.service.SessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static com.mentorship.scheduling.controller.AvailabilityController.USER_HEADER;

@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final BookingValidator bookingValidator;
    private final SessionService sessionService;

    public SessionController(BookingValidator bookingValidator, SessionService sessionService) {
        this.bookingValidator = bookingValidator;
        this.sessionService = sessionService;
    }

    /** The caller books as mentee. */
    @PostMapping
    public ResponseEntity<SessionResponse> book(@RequestHeader(USER_HEADER) Long userId,
                                                @Valid @RequestBody CreateSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(
                bookingValidator.bookSlot(request.mentorId(), userId, request.scheduledAt(), request.duration())));
    }

    @GetMapping("/{id}")
    public SessionResponse get(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return SessionResponse.from(sessionService.getSession(id, userId));
    }

    @GetMapping
    public SessionPageResponse list(@RequestHeader(USER_HEADER) Long userId,
                                    @RequestParam(required = false) String role,
                                    @RequestParam(required = false) String status,
                                    @RequestParam(required = false) Boolean upcoming,
                                    @RequestParam(required = false) Integer limit,
                                    @RequestParam(required = false) Integer offset) {
        return sessionService.listSessions(userId, role, status, upcoming, limit, offset);
    }

    @PatchMapping("/{id}/status")
    public SessionResponse updateStatus(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id,
                                        @Valid @RequestBody UpdateStatusRequest request) {
        return SessionResponse.from(sessionService.updateStatus(id, userId, request.status(), request.reason()));
    }

    @PatchMapping("/{id}/reschedule")
    public SessionResponse reschedule(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id,
                                      @Valid @RequestBody RescheduleRequest request) {
        return SessionResponse.from(sessionService.reschedule(id, userId,
                request.newScheduledAt(), request.reason(), request.message()));
    }

    @PatchMapping("/{id}/confirm")
    public SessionResponse confirm(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return SessionResponse.from(sessionService.confirmAttendance(id, userId));
    }

    @DeleteMapping("/{id}")
    public SessionResponse cancel(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id,
                                  @Valid @RequestBody(required = false) CancelRequest request) {
        return SessionResponse.from(sessionService.cancel(id, userId, request != null ? request.reason() : null));
    }
}
