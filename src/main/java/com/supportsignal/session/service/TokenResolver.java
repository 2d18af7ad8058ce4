package com.supportsignal.session.service;

import java.util.Optional;

/**
 * One link in the token resolution chain.
 *
 * Implementations are read-only lookups against a single store and report
 * "no match" as an empty result, never as an exception.
 */
@FunctionalInterface
public interface TokenResolver {

    Optional<SessionResolverService.ResolvedIdentity> resolve(String token);
}
