package com.chargelink.gateway.util;

import com.chargelink.gateway.exception.ChargeGatewayException;

import java.util.regex.Pattern;

/**
 * Conversion between the external device ID (8 hex digits, e.g. {@code 04CEAA40})
 * and the 32-bit physical ID carried in DNY frames.
 */
public final class DeviceIds {

    private static final Pattern DEVICE_ID = Pattern.compile("^[0-9A-Fa-f]{8}$");

    private DeviceIds() {
    }

    public static long toPhysicalId(String deviceId) {
        if (deviceId == null || !DEVICE_ID.matcher(deviceId.trim()).matches()) {
            throw ChargeGatewayException.invalidRequest(
                    "Invalid device id '" + deviceId + "': expected 8 hexadecimal characters");
        }
        return Long.parseLong(deviceId.trim(), 16);
    }

    public static String format(long physicalId) {
        return String.format("%08X", physicalId & 0xFFFFFFFFL);
    }

    public static boolean isValid(String deviceId) {
        return deviceId != null && DEVICE_ID.matcher(deviceId.trim()).matches();
    }
}
