package com.celflicks.backend.modules.profile.application;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Picks the avatar shown for a profile: the caller's URL when one is given, otherwise a
 * placeholder image derived only from the username.
 */
@Component
public class AvatarUrlResolver {

    private final String placeholderBaseUrl;

    public AvatarUrlResolver(
            @Value("${celflicks.profile.avatar-placeholder-base-url:https://ui-avatars.com/api/}") String placeholderBaseUrl
    ) {
        this.placeholderBaseUrl = placeholderBaseUrl;
    }

    public String resolve(String requestedAvatarUrl, String username) {
        if (StringUtils.hasText(requestedAvatarUrl)) {
            return requestedAvatarUrl.trim();
        }
        return placeholderFor(username);
    }

    public String placeholderFor(String username) {
        return UriComponentsBuilder.fromUriString(placeholderBaseUrl)
                .queryParam("name", username)
                .queryParam("background", "random")
                .encode()
                .build()
                .toUriString();
    }
}
