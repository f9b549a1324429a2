package com.foodgram.backend.domain.dto.tag;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TagRequestDto {

    @NotBlank(message = "Tag name is required.")
    @Size(max = 32, message = "Tag name must be at most 32 characters.")
    private String name;

    @NotBlank(message = "Tag slug is required.")
    @Size(max = 32, message = "Tag slug must be at most 32 characters.")
    @Pattern(regexp = "^[-a-zA-Z0-9_]+$", message = "Slug may contain only letters, digits, '-' and '_'.")
    private String slug;
}
