package com.parley.feedservice.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PATCH /api/v1/groups/{id}}. */
public record UpdateGroupRequest(@NotBlank String name) {}
