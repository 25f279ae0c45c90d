package com.cartmate.backend.a2a;

import com.cartmate.backend.domain.model.A2aMessage;

/**
 * Observer of every broadcast on the bus. Invoked synchronously; exceptions are logged
 * and do not affect other listeners.
 */
@FunctionalInterface
public interface GlobalListener {

    void onMessage(A2aMessage message);
}
