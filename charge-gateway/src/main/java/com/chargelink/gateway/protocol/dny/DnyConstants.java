package com.chargelink.gateway.protocol.dny;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * DNY protocol constants.
 *
 * <pre>
 * ┌─────────┬────────────┬──────────────┬─────────────┬─────────┬──────────┬─────────────┐
 * │ Header  │ Length     │ Physical ID  │ Message ID  │ Command │ Data     │ Checksum    │
 * │ "DNY"   │ 2 bytes LE │ 4 bytes LE   │ 2 bytes LE  │ 1 byte  │ N bytes  │ 2 bytes LE  │
 * └─────────┴────────────┴──────────────┴─────────────┴─────────┴──────────┴─────────────┘
 * </pre>
 * Length counts everything after itself (physical ID through checksum).
 * The checksum is the 16-bit sum of physical ID, message ID, command and data.
 */
public final class DnyConstants {

    private DnyConstants() {
    }

    public static final byte[] HEADER = "DNY".getBytes(StandardCharsets.US_ASCII);
    public static final int HEADER_LENGTH = 3;
    public static final int LENGTH_FIELD_LENGTH = 2;
    // physicalId(4) + messageId(2) + command(1) + checksum(2)
    public static final int LENGTH_OVERHEAD = 9;
    public static final int MIN_FRAME_LENGTH = HEADER_LENGTH + LENGTH_FIELD_LENGTH + LENGTH_OVERHEAD;
    public static final int MAX_DATA_LENGTH = 1024;

    // Commands
    public static final int CMD_HEARTBEAT = 0x01;
    public static final int CMD_MAIN_HEARTBEAT = 0x11;
    public static final int CMD_REGISTER = 0x20;
    public static final int CMD_DEVICE_HEARTBEAT = 0x21;
    public static final int CMD_POWER_HEARTBEAT = 0x06;
    public static final int CMD_CHARGE_CONTROL = 0x82;

    public static final Set<Integer> HEARTBEAT_COMMANDS = Set.of(
            CMD_HEARTBEAT, CMD_MAIN_HEARTBEAT, CMD_REGISTER, CMD_DEVICE_HEARTBEAT, CMD_POWER_HEARTBEAT);

    // Charge control payloads
    public static final int CHARGE_CONTROL_PAYLOAD_LENGTH = 30;
    public static final int ORDER_NUMBER_LENGTH = 16;
    // responseCode(1) + orderNumber(16) + port(1)
    public static final int CHARGE_RESPONSE_MIN_LENGTH = 18;
}
