package com.foodgram.backend.domain.dto.user;

import lombok.*;

/**
 * Avatar as a base64 data URI on the way in, as a URL on the way out.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AvatarDto {
    private String avatar;
}
