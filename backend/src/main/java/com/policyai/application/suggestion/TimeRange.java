package com.policyai.application.suggestion;

import java.time.Instant;

public record TimeRange(Instant start, Instant end) {
}
