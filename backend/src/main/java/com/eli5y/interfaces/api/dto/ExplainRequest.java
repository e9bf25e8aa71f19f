package com.eli5y.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ExplainRequest(
        @NotBlank(message = "LaTeX is required")
        String latex
) {}
