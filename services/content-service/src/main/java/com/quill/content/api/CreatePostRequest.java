package com.quill.content.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePostRequest(
        @NotBlank @Size(max = InputRules.TITLE_MAX) String title,
        @NotBlank @Size(max = InputRules.BODY_MAX) String body) {}
