package com.gentoro.docgen.contracts;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SampleRecord(UUID orderId, OffsetDateTime createdAt, double totalAmount) {}
