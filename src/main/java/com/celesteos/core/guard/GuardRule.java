package com.celesteos.core.guard;

import java.util.Optional;

/**
 * A cheap rejection check run before any lane pattern. Empty result means pass through.
 */
public interface GuardRule {

    String name();

    Optional<GuardVerdict> check(String query);
}
