package com.cartmate.backend.a2a;

import com.cartmate.backend.domain.model.FrontendNotification;

/**
 * Receives {@link FrontendNotification} traffic for display. A subscriber that throws
 * is dropped from the bus.
 */
@FunctionalInterface
public interface FrontendSubscriber {

    void onNotification(FrontendNotification notification);
}
