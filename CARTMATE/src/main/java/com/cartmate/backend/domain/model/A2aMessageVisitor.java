package com.cartmate.backend.domain.model;

/**
 * Dispatch over the closed set of A2A message kinds.
 *
 * @param <R> result of handling a message
 */
public interface A2aMessageVisitor<R> {

    R visitRequest(A2aRequest request);

    R visitResponse(A2aResponse response);

    R visitAcknowledgment(A2aAcknowledgment acknowledgment);

    R visitFrontendNotification(FrontendNotification notification);

    R visitEvent(A2aEvent event);
}
