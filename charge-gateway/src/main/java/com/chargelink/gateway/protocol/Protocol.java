package com.chargelink.gateway.protocol;

import io.netty.channel.ChannelHandler;
import lombok.NonNull;

/**
 * Lightweight protocol abstraction used to assemble the device channel pipeline.
 */
public interface Protocol {

    // Unique protocol name, e.g. "DNY"
    @NonNull
    String name();

    // Per-channel frame decoder; must be a new instance on every call
    @NonNull
    ChannelHandler frameDecoder();

    @NonNull
    ChannelHandler protocolDecoder();

    @NonNull
    ChannelHandler protocolEncoder();
}
