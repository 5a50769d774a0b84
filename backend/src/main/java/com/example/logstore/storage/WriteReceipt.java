package com.example.logstore.storage;

import java.time.Instant;

public record WriteReceipt(long id, Instant timestamp) {
}
