package com.chargelink.gateway.protocol.dny;

import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.exception.ErrorCode;
import com.chargelink.gateway.model.ChargeCommand;
import com.chargelink.gateway.model.DeviceResponse;
import com.chargelink.gateway.model.DeviceResponseCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DnyCodecTest {

    private final DnyCodec codec = new DnyCodec();

    private static ChargeControlPayload startPayload() {
        return ChargeControlPayload.builder()
                .rateMode(1)
                .balance(10_000)
                .port(0)
                .command(ChargeCommand.START)
                .duration(3600)
                .orderNumber("O1")
                .maxChargeDuration(7200)
                .maxPower(2200)
                .qrCodeLight(0)
                .build();
    }

    // Reply data: code | order(16) | port | waitingPorts(2 LE) [| portStatus]
    private static byte[] replyData(int code, String order, int port, Integer portStatus) {
        ByteBuffer buf = ByteBuffer.allocate(portStatus == null ? 20 : 21).order(ByteOrder.LITTLE_ENDIAN);
        buf.put((byte) code);
        buf.put(Arrays.copyOf(order.getBytes(StandardCharsets.US_ASCII), 16));
        buf.put((byte) port);
        buf.putShort((short) 0);
        if (portStatus != null) {
            buf.put(portStatus.byteValue());
        }
        return buf.array();
    }

    // ========== Command frames ==========

    @Test
    @DisplayName("A start command frame has the DNY layout with little-endian fields")
    void shouldBuildStartCommandFrame() {
        byte[] frame = codec.buildCommandFrame("04CEAA40", 0x1234, DnyConstants.CMD_CHARGE_CONTROL, startPayload());
        ByteBuffer buf = ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(new String(frame, 0, 3, StandardCharsets.US_ASCII)).isEqualTo("DNY");
        assertThat(frame).hasSize(3 + 2 + 9 + DnyConstants.CHARGE_CONTROL_PAYLOAD_LENGTH);
        assertThat(buf.getShort(3)).isEqualTo((short) (9 + 30));
        assertThat(buf.getInt(5)).isEqualTo(0x04CEAA40);
        assertThat(buf.getShort(9)).isEqualTo((short) 0x1234);
        assertThat(frame[11] & 0xFF).isEqualTo(0x82);

        int data = 12;
        assertThat(frame[data]).isEqualTo((byte) 1);
        assertThat(buf.getInt(data + 1)).isEqualTo(10_000);
        assertThat(frame[data + 5]).isEqualTo((byte) 0);
        assertThat(frame[data + 6]).isEqualTo((byte) 0x01);
        assertThat(buf.getShort(data + 7)).isEqualTo((short) 3600);
        assertThat(new String(frame, data + 9, 2, StandardCharsets.US_ASCII)).isEqualTo("O1");
        assertThat(frame[data + 11]).isZero();
        assertThat(buf.getShort(data + 25)).isEqualTo((short) 7200);
        assertThat(buf.getShort(data + 27)).isEqualTo((short) 2200);
    }

    @Test
    @DisplayName("The checksum is the 16-bit sum from the physical id to the end of data")
    void shouldWriteChecksum() {
        byte[] frame = codec.encodeFrame(0x01020304L, 0x0005, 0x01, new byte[]{0x10, 0x20});

        int sum = 0;
        for (int i = 5; i < frame.length - 2; i++) {
            sum += frame[i] & 0xFF;
        }
        int written = (frame[frame.length - 2] & 0xFF) | (frame[frame.length - 1] & 0xFF) << 8;
        assertThat(written).isEqualTo(sum & 0xFFFF);
    }

    @Test
    @DisplayName("A malformed device id is rejected before anything is encoded")
    void shouldRejectInvalidDeviceId() {
        assertThatThrownBy(() -> codec.buildCommandFrame("XYZ", 1, DnyConstants.CMD_CHARGE_CONTROL, startPayload()))
                .isInstanceOf(ChargeGatewayException.class)
                .extracting(e -> ((ChargeGatewayException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_REQUEST);
    }

    // ========== Frame decoding ==========

    @Test
    @DisplayName("Decoding exposes device id, message id and command")
    void shouldDecodeFrame() {
        byte[] bytes = codec.encodeFrame(0x04CEAA40L, 0x00AB, 0x21, new byte[]{1, 2, 3});

        DnyFrame frame = codec.decodeFrame(bytes);

        assertThat(frame.deviceId()).isEqualTo("04CEAA40");
        assertThat(frame.messageId()).isEqualTo(0xAB);
        assertThat(frame.command()).isEqualTo(0x21);
        assertThat(frame.data()).containsExactly(1, 2, 3);
        assertThat(frame.isHeartbeat()).isTrue();
        assertThat(frame.raw()).isSameAs(bytes);
    }

    @Test
    @DisplayName("Corrupted checksum, header or length is a protocol error")
    void shouldRejectCorruptFrames() {
        byte[] good = codec.encodeFrame(0x04CEAA40L, 1, 0x01, new byte[]{9});

        byte[] badChecksum = good.clone();
        badChecksum[badChecksum.length - 1] ^= 0x01;
        byte[] badHeader = good.clone();
        badHeader[0] = 'X';
        byte[] truncated = Arrays.copyOf(good, good.length - 1);

        for (byte[] bytes : new byte[][]{badChecksum, badHeader, truncated, new byte[5]}) {
            assertThatThrownBy(() -> codec.decodeFrame(bytes))
                    .isInstanceOf(ChargeGatewayException.class)
                    .extracting(e -> ((ChargeGatewayException) e).getErrorCode())
                    .isEqualTo(ErrorCode.PROTOCOL_ERROR);
        }
    }

    // ========== Charge-control replies ==========

    @Test
    @DisplayName("A start reply parses code, order and 1-based port")
    void shouldParseStartReply() {
        byte[] bytes = codec.encodeFrame(0x04CEAA40L, 0x0010, 0x82, replyData(0x00, "O1", 0, null));

        DeviceResponse response = codec.parseResponseFrame(bytes);

        assertThat(response.getDeviceId()).isEqualTo("04CEAA40");
        assertThat(response.getMessageId()).isEqualTo(0x10);
        assertThat(response.getCode()).isEqualTo(DeviceResponseCode.SUCCESS);
        assertThat(response.getOrderNumber()).isEqualTo("O1");
        assertThat(response.getPort()).isEqualTo(1);
        assertThat(response.portStatus()).isEmpty();
    }

    @Test
    @DisplayName("A query reply carries the trailing port status byte")
    void shouldParseQueryReplyWithPortStatus() {
        byte[] bytes = codec.encodeFrame(0x04CEAA40L, 0x0011, 0x82, replyData(0x00, "ORDER-2", 3, 3));

        DeviceResponse response = codec.parseResponseFrame(bytes);

        assertThat(response.getPort()).isEqualTo(4);
        assertThat(response.portStatus()).contains(3);
    }

    @Test
    @DisplayName("Fault and unknown codes map onto the response code table")
    void shouldClassifyResponseCodes() {
        DeviceResponse fault = codec.parseResponseFrame(
                codec.encodeFrame(1L, 1, 0x82, replyData(0x0A, "O", 0, null)));
        DeviceResponse offline = codec.parseResponseFrame(
                codec.encodeFrame(1L, 2, 0x82, replyData(0xFF, "O", 0, null)));
        DeviceResponse unknown = codec.parseResponseFrame(
                codec.encodeFrame(1L, 3, 0x82, replyData(0x42, "O", 0, null)));

        assertThat(fault.getCode()).isEqualTo(DeviceResponseCode.SHORT_CIRCUIT);
        assertThat(fault.getCode().isPortFault()).isTrue();
        assertThat(offline.getCode()).isEqualTo(DeviceResponseCode.DEVICE_OFFLINE);
        assertThat(unknown.getCode()).isEqualTo(DeviceResponseCode.UNKNOWN);
        assertThat(unknown.getResponseCode()).isEqualTo(0x42);
    }

    @Test
    @DisplayName("Replies that are too short or not charge-control are protocol errors")
    void shouldRejectInvalidReplies() {
        byte[] shortReply = codec.encodeFrame(1L, 1, 0x82, new byte[10]);
        byte[] heartbeat = codec.encodeFrame(1L, 1, 0x01, replyData(0, "O", 0, null));

        assertThatThrownBy(() -> codec.parseResponseFrame(shortReply)).isInstanceOf(ChargeGatewayException.class);
        assertThatThrownBy(() -> codec.parseResponseFrame(heartbeat)).isInstanceOf(ChargeGatewayException.class);
    }

    @Test
    @DisplayName("Order numbers are zero padded to 16 bytes and trimmed back")
    void shouldPadAndTrimOrderNumbers() {
        byte[] padded = DnyCodec.orderNumberBytes("ABC");

        assertThat(padded).hasSize(16);
        assertThat(DnyCodec.trimOrderNumber(padded)).isEqualTo("ABC");
        assertThat(DnyCodec.trimOrderNumber(DnyCodec.orderNumberBytes(null))).isEmpty();
    }
}
