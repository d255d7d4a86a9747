package com.dailybrief.service.store;

import java.time.Instant;
import java.time.LocalDate;

public record DeliveryRecord(LocalDate runDate, String filePath, Instant deliveredAt) {
}
