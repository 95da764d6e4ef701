package io.meetflow.spi;

import io.meetflow.model.Platform;

import java.util.Optional;

/**
 * Supplies platform API access tokens for a meeting host. Token storage and refresh live
 * outside the pipeline.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    AccessTokenProvider NONE = (platform, hostEmail) -> Optional.empty();

    Optional<String> accessToken(Platform platform, String hostEmail);
}
