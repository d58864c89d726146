package com.chargelink.gateway.protocol.dny;

import com.chargelink.gateway.protocol.Protocol;
import io.netty.channel.ChannelHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * DNY charging-pile protocol: per-channel frame decoder, shared decoder and encoder.
 */
@Component("dnyProtocol")
public final class DnyProtocol implements Protocol {

    public static final String NAME = "DNY";

    private final ObjectProvider<DnyFrameDecoder> frameDecoders;
    private final DnyProtocolDecoder protocolDecoder;
    private final DnyProtocolEncoder protocolEncoder;

    public DnyProtocol(ObjectProvider<DnyFrameDecoder> frameDecoders,
                       DnyProtocolDecoder protocolDecoder,
                       DnyProtocolEncoder protocolEncoder) {
        this.frameDecoders = frameDecoders;
        this.protocolDecoder = protocolDecoder;
        this.protocolEncoder = protocolEncoder;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChannelHandler frameDecoder() {
        // Prototype bean: new instance for each channel
        return frameDecoders.getObject();
    }

    @Override
    public ChannelHandler protocolDecoder() {
        return protocolDecoder;
    }

    @Override
    public ChannelHandler protocolEncoder() {
        return protocolEncoder;
    }

    @Override
    public String toString() {
        return "DnyProtocol{name='" + NAME + "'}";
    }
}
