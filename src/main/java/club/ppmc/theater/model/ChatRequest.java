/**
 * ChatRequest.java
 */
package club.ppmc.theater.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatRequest(@NotBlank @Size(max = 2000) String message) {}
