package com.chargelink.gateway.protocol.dny;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Encodes outbound {@link DnyFrame}s. Pre-built command frames are written as
 * raw {@link ByteBuf}s and pass through untouched.
 */
@Slf4j
@Component
@ChannelHandler.Sharable
@RequiredArgsConstructor
public class DnyProtocolEncoder extends MessageToByteEncoder<DnyFrame> {

    private final DnyCodec codec;

    @Override
    protected void encode(ChannelHandlerContext ctx, DnyFrame frame, ByteBuf out) {
        out.writeBytes(codec.encodeFrame(frame));
        log.debug("📤 Encoded {} for {}", frame, ctx.channel().remoteAddress());
    }
}
