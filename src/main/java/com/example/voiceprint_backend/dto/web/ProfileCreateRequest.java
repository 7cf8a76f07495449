package com.example.voiceprint_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProfileCreateRequest(@NotBlank @Size(max = 200) String name) {
}
