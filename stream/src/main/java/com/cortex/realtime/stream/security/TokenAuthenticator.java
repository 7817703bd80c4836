package com.cortex.realtime.stream.security;

import com.cortex.realtime.core.auth.StreamToken;
import com.cortex.realtime.stream.config.StreamConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Resolves the {@code token} query parameter of a stream request to the owner user id.
 */
public class TokenAuthenticator {
    private final String secret;
    private final Duration ttl;
    private final Clock clock;

    public TokenAuthenticator(StreamConfig config, Clock clock) {
        this.secret = config.getTokenSecret();
        this.ttl = config.getTokenTtl();
        this.clock = clock;
    }

    public Optional<String> authenticate(String token) {
        return StreamToken.verify(token, secret, ttl, clock.instant());
    }
}
