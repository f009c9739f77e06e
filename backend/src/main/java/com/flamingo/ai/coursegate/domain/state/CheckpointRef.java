package com.flamingo.ai.coursegate.domain.state;

import java.time.Instant;

/** Registry entry pointing at a checkpoint stored as its own record. */
public record CheckpointRef(String name, Instant createdAt) {}
