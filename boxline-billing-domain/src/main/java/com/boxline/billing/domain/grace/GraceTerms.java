package com.boxline.billing.domain.grace;

import com.boxline.billing.domain.model.GraceSeverity;

import java.time.Duration;

public record GraceTerms(Duration duration, GraceSeverity severity) {
}
