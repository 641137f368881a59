package com.parley.feedservice.api;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Body of {@code POST /api/v1/groups}.
 *
 * @param name display name
 * @param memberIds users to add besides the caller; may be omitted
 */
public record CreateGroupRequest(@NotBlank String name, List<Long> memberIds) {}
