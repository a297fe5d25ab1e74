package com.sproutsocial.rmq.format;

import com.sproutsocial.rmq.RetrievedMessage;

/**
 * Renders one message as text. Implementations are stateless and thread safe.
 */
public interface MessageFormatter {

    /**
     * @param compact only show properties that are present
     */
    String format(RetrievedMessage message, boolean compact);

}
