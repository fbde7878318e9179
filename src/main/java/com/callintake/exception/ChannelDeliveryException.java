package com.callintake.exception;

import com.callintake.domain.model.Channel;

/**
 * A provider call failed: rejected credentials, inaccessible calendar, bad
 * request or network error. Converted to a failed outcome by the orchestrator.
 */
public class ChannelDeliveryException extends RuntimeException {

    private final Channel channel;

    public ChannelDeliveryException(Channel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public ChannelDeliveryException(Channel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }
}
