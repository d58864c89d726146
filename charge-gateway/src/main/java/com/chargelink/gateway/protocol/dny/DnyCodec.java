package com.chargelink.gateway.protocol.dny;

import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.model.DeviceResponse;
import com.chargelink.gateway.model.DeviceResponseCode;
import com.chargelink.gateway.util.DeviceIds;
import com.chargelink.gateway.util.PortMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

import static com.chargelink.gateway.protocol.dny.DnyConstants.*;

/**
 * DNY wire codec.
 *
 * Builds outbound command frames and parses inbound frames and charge-control
 * replies. Stateless and thread-safe.
 */
@Component
public class DnyCodec {

    // ==================== Frames ====================

    public byte[] encodeFrame(DnyFrame frame) {
        return encodeFrame(frame.physicalId(), frame.messageId(), frame.command(), frame.data());
    }

    public byte[] encodeFrame(long physicalId, int messageId, int command, byte[] data) {
        byte[] payload = data != null ? data : new byte[0];
        if (payload.length > MAX_DATA_LENGTH) {
            throw ChargeGatewayException.protocolError("Data too long: " + payload.length + " bytes");
        }
        ByteBuf buf = Unpooled.buffer(MIN_FRAME_LENGTH + payload.length);
        try {
            buf.writeBytes(HEADER);
            buf.writeShortLE(LENGTH_OVERHEAD + payload.length);
            buf.writeIntLE((int) physicalId);
            buf.writeShortLE(messageId);
            buf.writeByte(command);
            buf.writeBytes(payload);
            int checksumEnd = buf.writerIndex();
            buf.writeShortLE(checksum(buf, HEADER_LENGTH + LENGTH_FIELD_LENGTH, checksumEnd));
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    public DnyFrame decodeFrame(byte[] bytes) {
        if (bytes == null || bytes.length < MIN_FRAME_LENGTH) {
            throw ChargeGatewayException.protocolError(
                    "Frame too short: " + (bytes == null ? 0 : bytes.length) + " bytes");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        for (int i = 0; i < HEADER_LENGTH; i++) {
            if (buf.getByte(i) != HEADER[i]) {
                throw ChargeGatewayException.protocolError("Missing DNY header: " + ByteBufUtil.hexDump(buf, 0, HEADER_LENGTH));
            }
        }
        int length = buf.getUnsignedShortLE(HEADER_LENGTH);
        int frameLength = HEADER_LENGTH + LENGTH_FIELD_LENGTH + length;
        if (length < LENGTH_OVERHEAD || frameLength != bytes.length) {
            throw ChargeGatewayException.protocolError(
                    String.format("Length field %d does not match frame size %d", length, bytes.length));
        }
        int checksumOffset = frameLength - 2;
        int expected = buf.getUnsignedShortLE(checksumOffset);
        int actual = checksum(buf, HEADER_LENGTH + LENGTH_FIELD_LENGTH, checksumOffset);
        if (expected != actual) {
            throw ChargeGatewayException.protocolError(
                    String.format("Checksum mismatch: expected 0x%04X, computed 0x%04X", expected, actual));
        }

        buf.readerIndex(HEADER_LENGTH + LENGTH_FIELD_LENGTH);
        long physicalId = buf.readUnsignedIntLE();
        int messageId = buf.readUnsignedShortLE();
        int command = buf.readUnsignedByte();
        byte[] data = new byte[checksumOffset - buf.readerIndex()];
        buf.readBytes(data);

        return DnyFrame.builder()
                .physicalId(physicalId)
                .messageId(messageId)
                .command(command)
                .data(data)
                .raw(bytes)
                .build();
    }

    // 16-bit sum over [from, to)
    public static int checksum(ByteBuf buf, int from, int to) {
        int sum = 0;
        for (int i = from; i < to; i++) {
            sum += buf.getUnsignedByte(i);
        }
        return sum & 0xFFFF;
    }

    // ==================== Charge control ====================

    public byte[] buildCommandFrame(String deviceId, int messageId, int command, ChargeControlPayload fields) {
        long physicalId = DeviceIds.toPhysicalId(deviceId);
        return encodeFrame(physicalId, messageId, command, encodeChargeControl(fields));
    }

    public byte[] encodeChargeControl(ChargeControlPayload fields) {
        ByteBuf buf = Unpooled.buffer(CHARGE_CONTROL_PAYLOAD_LENGTH);
        try {
            buf.writeByte(fields.getRateMode());
            buf.writeIntLE((int) fields.getBalance());
            buf.writeByte(fields.getPort());
            buf.writeByte(fields.getCommand().getCode());
            buf.writeShortLE(fields.getDuration());
            buf.writeBytes(orderNumberBytes(fields.getOrderNumber()));
            buf.writeShortLE(fields.getMaxChargeDuration());
            buf.writeShortLE(fields.getMaxPower());
            buf.writeByte(fields.getQrCodeLight());
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * Parses a device reply to a charge-control command:
     * responseCode(1) | orderNumber(16) | port(1) | waitingPorts(2 LE) | [portStatus(1)].
     */
    public DeviceResponse parseResponseFrame(byte[] bytes) {
        DnyFrame frame = decodeFrame(bytes);
        if (!frame.isChargeControl()) {
            throw ChargeGatewayException.protocolError(
                    String.format("Not a charge-control reply: command 0x%02X", frame.command()));
        }
        byte[] data = frame.data();
        if (data.length < CHARGE_RESPONSE_MIN_LENGTH) {
            throw ChargeGatewayException.protocolError(
                    "Charge-control reply too short: " + data.length + " bytes");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(data);
        int responseCode = buf.readUnsignedByte();
        byte[] order = new byte[ORDER_NUMBER_LENGTH];
        buf.readBytes(order);
        int port = buf.readUnsignedByte();
        int waitingPorts = buf.readableBytes() >= 2 ? buf.readUnsignedShortLE() : 0;
        Integer portStatus = buf.isReadable() ? (int) buf.readUnsignedByte() : null;

        return DeviceResponse.builder()
                .deviceId(frame.deviceId())
                .messageId(frame.messageId())
                .command(frame.command())
                .responseCode(responseCode)
                .code(DeviceResponseCode.fromCode(responseCode))
                .orderNumber(trimOrderNumber(order))
                .port(PortMapper.toApiPort(port))
                .waitingPorts(waitingPorts)
                .portStatus(portStatus)
                .receivedAt(frame.receivedAt())
                .build();
    }

    static byte[] orderNumberBytes(String orderNumber) {
        byte[] padded = new byte[ORDER_NUMBER_LENGTH];
        if (orderNumber != null) {
            byte[] ascii = orderNumber.getBytes(StandardCharsets.US_ASCII);
            System.arraycopy(ascii, 0, padded, 0, Math.min(ascii.length, ORDER_NUMBER_LENGTH));
        }
        return padded;
    }

    static String trimOrderNumber(byte[] order) {
        int end = 0;
        while (end < order.length && order[end] != 0) {
            end++;
        }
        return new String(order, 0, end, StandardCharsets.US_ASCII);
    }
}
