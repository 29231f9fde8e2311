package com.mentorship.scheduling.dto;

import java.util.List;

public record SessionPageResponse(List<SessionResponse> sessions, long total, int limit, int offset, int pages) {
}
