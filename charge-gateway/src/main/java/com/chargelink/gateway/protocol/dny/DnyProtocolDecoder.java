package com.chargelink.gateway.protocol.dny;

import com.chargelink.gateway.exception.ChargeGatewayException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns framed bytes into {@link DnyFrame} messages.
 */
@Slf4j
@Component
@ChannelHandler.Sharable
@RequiredArgsConstructor
public class DnyProtocolDecoder extends MessageToMessageDecoder<ByteBuf> {

    private final DnyCodec codec;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        byte[] bytes = ByteBufUtil.getBytes(frame);
        log.debug("📥 RAW DATA RECEIVED | 🌐 From: {} | 📏 Length: {} bytes | 🗃️ Data: {}",
                ctx.channel().remoteAddress(), bytes.length, ByteBufUtil.hexDump(bytes));
        try {
            DnyFrame decoded = codec.decodeFrame(bytes);
            out.add(decoded);
        } catch (ChargeGatewayException e) {
            log.warn("❌ Dropping malformed DNY frame from {}: {}",
                    ctx.channel().remoteAddress(), e.getFormattedMessage());
        }
    }
}
