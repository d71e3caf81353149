package com.celesteos.core.guard;

import com.celesteos.core.model.Lane;

/**
 * Terminal outcome of a guard: the query stops here with {@code lane}.
 *
 * @param lane       {@link Lane#BLOCKED} or {@link Lane#UNKNOWN}
 * @param reasonCode diagnostic reason, never shown to the end user
 * @param guard      name of the guard that fired
 */
public record GuardVerdict(Lane lane, String reasonCode, String guard) {

    public static GuardVerdict blocked(String reasonCode, String guard) {
        return new GuardVerdict(Lane.BLOCKED, reasonCode, guard);
    }

    public static GuardVerdict unknown(String reasonCode, String guard) {
        return new GuardVerdict(Lane.UNKNOWN, reasonCode, guard);
    }
}
