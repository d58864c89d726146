package com.chargelink.gateway.handler;

import com.chargelink.gateway.protocol.dny.DnyCodec;
import com.chargelink.gateway.protocol.dny.DnyConstants;
import com.chargelink.gateway.protocol.dny.DnyFrame;
import com.chargelink.gateway.service.ResponseDispatcher;
import com.chargelink.gateway.transport.ChannelManagerService;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceBusinessHandlerTest {

    private static final long PHYSICAL_ID = 0x04CEAA40L;
    private static final String DEVICE_ID = "04CEAA40";

    @Mock
    private ResponseDispatcher responseDispatcher;

    private final DnyCodec codec = new DnyCodec();
    private ChannelManagerService channelManager;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channelManager = new ChannelManagerService(1000);
        channel = new EmbeddedChannel(new DeviceBusinessHandler(channelManager, responseDispatcher, codec));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static DnyFrame frame(int command, byte[] data, byte[] raw) {
        return DnyFrame.builder()
                .physicalId(PHYSICAL_ID)
                .messageId(0x0102)
                .command(command)
                .data(data)
                .raw(raw)
                .build();
    }

    // ========== Heartbeats ==========

    @Test
    @DisplayName("A heartbeat binds the device to the channel and is acknowledged")
    void shouldRegisterAndAckHeartbeat() {
        channel.writeInbound(frame(DnyConstants.CMD_DEVICE_HEARTBEAT, new byte[]{1, 2}, null));

        assertThat(channelManager.getActiveChannel(DEVICE_ID)).contains(channel);
        DnyFrame ack = channel.readOutbound();
        assertThat(ack).isNotNull();
        assertThat(ack.command()).isEqualTo(DnyConstants.CMD_DEVICE_HEARTBEAT);
        assertThat(ack.messageId()).isEqualTo(0x0102);
        assertThat(ack.data()).isEmpty();
        verify(responseDispatcher, never()).dispatch(any());
    }

    // ========== Charge-control replies ==========

    @Test
    @DisplayName("Charge-control replies are dispatched with their raw bytes")
    void shouldDispatchChargeControlReply() {
        byte[] data = new byte[20];
        byte[] raw = codec.encodeFrame(PHYSICAL_ID, 0x0102, DnyConstants.CMD_CHARGE_CONTROL, data);
        when(responseDispatcher.dispatch(raw)).thenReturn(true);

        channel.writeInbound(frame(DnyConstants.CMD_CHARGE_CONTROL, data, raw));

        verify(responseDispatcher).dispatch(raw);
        assertThat(channelManager.isOnline(DEVICE_ID)).isTrue();
        assertThat((Object) channel.readOutbound()).isNull();
    }

    @Test
    @DisplayName("A reply without raw bytes is re-encoded before dispatch")
    void shouldReencodeReplyWithoutRawBytes() {
        byte[] data = new byte[20];
        byte[] expected = codec.encodeFrame(PHYSICAL_ID, 0x0102, DnyConstants.CMD_CHARGE_CONTROL, data);
        when(responseDispatcher.dispatch(any())).thenReturn(false);

        channel.writeInbound(frame(DnyConstants.CMD_CHARGE_CONTROL, data, null));

        verify(responseDispatcher).dispatch(expected);
    }

    @Test
    @DisplayName("Other commands are ignored")
    void shouldIgnoreUnknownCommands() {
        channel.writeInbound(frame(0x35, new byte[0], null));

        verify(responseDispatcher, never()).dispatch(any());
        assertThat(channelManager.isOnline(DEVICE_ID)).isFalse();
        assertThat((Object) channel.readOutbound()).isNull();
    }

    // ========== Connection lifecycle ==========

    @Test
    @DisplayName("An idle connection is closed and the device unregistered")
    void shouldCloseIdleConnection() {
        channel.writeInbound(frame(DnyConstants.CMD_HEARTBEAT, new byte[0], null));
        channel.readOutbound();

        channel.pipeline().fireUserEventTriggered(IdleStateEvent.READER_IDLE_STATE_EVENT);

        assertThat(channel.isOpen()).isFalse();
        assertThat(channelManager.isOnline(DEVICE_ID)).isFalse();
        assertThat(channelManager.getActiveChannelCount()).isZero();
    }

    @Test
    @DisplayName("Handler exceptions close the connection")
    void shouldCloseOnException() {
        channel.pipeline().fireExceptionCaught(new IllegalStateException("boom"));

        assertThat(channel.isOpen()).isFalse();
    }
}
