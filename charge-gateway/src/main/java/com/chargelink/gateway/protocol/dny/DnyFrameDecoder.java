package com.chargelink.gateway.protocol.dny;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.chargelink.gateway.protocol.dny.DnyConstants.*;

/**
 * DNY Frame Decoder
 *
 * Splits the TCP byte stream into complete DNY frames. Searches for the "DNY"
 * header, waits until the whole frame has arrived, verifies the checksum and
 * resyncs one byte past a bad header.
 */
@Slf4j
@Component
@Scope("prototype")
// ByteToMessageDecoder buffers per channel, so every channel gets its own instance
public class DnyFrameDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.readableBytes() >= MIN_FRAME_LENGTH) {
            if (!findHeader(in)) {
                return;
            }
            if (in.readableBytes() < MIN_FRAME_LENGTH) {
                return;
            }

            final int startIndex = in.readerIndex();
            final int length = in.getUnsignedShortLE(startIndex + HEADER_LENGTH);

            if (length < LENGTH_OVERHEAD || length > LENGTH_OVERHEAD + MAX_DATA_LENGTH) {
                log.debug("Invalid DNY length {} from {}", length, ctx.channel().remoteAddress());
                resync(in, startIndex);
                continue;
            }

            final int frameSize = HEADER_LENGTH + LENGTH_FIELD_LENGTH + length;
            if (in.readableBytes() < frameSize) {
                return; // Wait for more data
            }

            final int bodyStart = startIndex + HEADER_LENGTH + LENGTH_FIELD_LENGTH;
            final int checksumIndex = startIndex + frameSize - 2;
            final int expected = in.getUnsignedShortLE(checksumIndex);
            final int actual = DnyCodec.checksum(in, bodyStart, checksumIndex);
            if (expected != actual) {
                log.warn("⚠️ DNY checksum mismatch from {}: expected 0x{}, got 0x{}",
                        ctx.channel().remoteAddress(), Integer.toHexString(expected), Integer.toHexString(actual));
                resync(in, startIndex);
                continue;
            }

            out.add(in.readRetainedSlice(frameSize));
            log.debug("Decoded DNY frame: length={}, frameSize={} from {}",
                    length, frameSize, ctx.channel().remoteAddress());
        }
    }

    /**
     * Position the reader at the next "DNY" header, discarding bytes before it.
     */
    private boolean findHeader(ByteBuf in) {
        final int searchEnd = in.writerIndex() - HEADER_LENGTH;
        while (in.readerIndex() <= searchEnd) {
            int i = in.readerIndex();
            if (in.getByte(i) == HEADER[0] && in.getByte(i + 1) == HEADER[1] && in.getByte(i + 2) == HEADER[2]) {
                return true;
            }
            in.skipBytes(1);
        }
        return false;
    }

    private void resync(ByteBuf in, int failedStartIndex) {
        in.readerIndex(failedStartIndex + 1);
        log.debug("Resyncing DNY stream from position {}", failedStartIndex + 1);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        log.error("DNY frame decoder error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        super.exceptionCaught(ctx, cause);
    }
}
