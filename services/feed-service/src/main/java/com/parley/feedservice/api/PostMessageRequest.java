package com.parley.feedservice.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/v1/groups/{groupId}/messages}. */
public record PostMessageRequest(@NotBlank String text) {}
