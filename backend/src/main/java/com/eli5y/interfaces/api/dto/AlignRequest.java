package com.eli5y.interfaces.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Alignment of a stored draft. The draft is kept as raw JSON so that older shapes
 * (bare-string symbols) go through the same ingress as live model output.
 */
public record AlignRequest(
        @NotBlank(message = "LaTeX is required")
        String latex,

        @NotNull(message = "Draft is required")
        JsonNode draft
) {}
