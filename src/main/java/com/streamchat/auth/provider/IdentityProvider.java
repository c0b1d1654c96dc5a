package com.streamchat.auth.provider;

import com.streamchat.auth.model.StreamIdentity;

import java.util.Optional;

public interface IdentityProvider {

    /**
     * @return the identity carried by {@code bearerToken}, empty if the token is invalid or expired
     */
    Optional<StreamIdentity> verify(String bearerToken);
}
