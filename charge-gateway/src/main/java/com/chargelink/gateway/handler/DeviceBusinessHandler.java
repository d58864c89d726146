package com.chargelink.gateway.handler;

import com.chargelink.gateway.protocol.dny.DnyCodec;
import com.chargelink.gateway.protocol.dny.DnyFrame;
import com.chargelink.gateway.service.ResponseDispatcher;
import com.chargelink.gateway.transport.ChannelManagerService;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Device Business Handler
 *
 * Runs on the business executor group, off the I/O loop. Heartbeat and
 * registration frames bind the device to its channel; charge-control replies
 * go to the response dispatcher.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ChannelHandler.Sharable
public class DeviceBusinessHandler extends SimpleChannelInboundHandler<DnyFrame> {

    private final ChannelManagerService channelManagerService;
    private final ResponseDispatcher responseDispatcher;
    private final DnyCodec codec;

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DnyFrame frame) {
        log.debug("📨 {} from {}", frame, ctx.channel().remoteAddress());

        if (frame.isHeartbeat()) {
            handleHeartbeat(ctx, frame);
        } else if (frame.isChargeControl()) {
            handleChargeControlReply(ctx, frame);
        } else {
            log.info("❓ Unhandled command 0x{} from device {}", Integer.toHexString(frame.command()), frame.deviceId());
        }
    }

    private void handleHeartbeat(ChannelHandlerContext ctx, DnyFrame frame) {
        channelManagerService.registerChannel(frame.deviceId(), ctx.channel());
        ctx.writeAndFlush(frame.ack()).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("⚠️ Heartbeat ack to device {} failed: {}", frame.deviceId(),
                        future.cause() != null ? future.cause().getMessage() : "unknown");
            }
        });
        log.debug("💓 Heartbeat 0x{} from device {}", Integer.toHexString(frame.command()), frame.deviceId());
    }

    private void handleChargeControlReply(ChannelHandlerContext ctx, DnyFrame frame) {
        // A reply also proves the device is alive on this channel
        channelManagerService.registerChannel(frame.deviceId(), ctx.channel());
        byte[] raw = frame.raw() != null ? frame.raw() : codec.encodeFrame(frame);
        if (!responseDispatcher.dispatch(raw)) {
            log.debug("Charge-control reply from {} matched no pending command", frame.deviceId());
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idle) {
            log.info("⏰ Closing idle connection {} (device {}, {})", ctx.channel().remoteAddress(),
                    ctx.channel().attr(ChannelManagerService.DEVICE_ID_ATTR).get(), idle.state());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        String deviceId = ctx.channel().attr(ChannelManagerService.DEVICE_ID_ATTR).get();
        if (deviceId != null) {
            channelManagerService.unregisterChannel(deviceId, ctx.channel());
        } else {
            log.debug("📵 Unknown device disconnected from {}", ctx.channel().remoteAddress());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        String deviceId = ctx.channel().attr(ChannelManagerService.DEVICE_ID_ATTR).get();
        log.error("❌ Handler exception for {} from {}: {}",
                deviceId != null ? deviceId : "UNKNOWN", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        ctx.close();
    }
}
