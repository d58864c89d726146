package com.chargelink.gateway.config;

import com.chargelink.gateway.handler.DeviceBusinessHandler;
import com.chargelink.gateway.protocol.Protocol;
import com.chargelink.gateway.protocol.ProtocolFactory;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.concurrent.TimeUnit;

/**
 * Netty TCP server charging piles connect to.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "charge-gateway.tcp", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NettyTcpServer {

    private final NettyConfig config;
    private final ProtocolFactory protocolFactory;
    private final DeviceBusinessHandler businessHandler;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup businessExecutorGroup;
    private volatile boolean serverStarted = false;

    public NettyTcpServer(NettyConfig config, ProtocolFactory protocolFactory, DeviceBusinessHandler businessHandler) {
        this.config = config;
        this.protocolFactory = protocolFactory;
        this.businessHandler = businessHandler;
        log.info("🔧 NettyTcpServer initialized, waiting for application ready event...");
    }

    /**
     * Start server AFTER protocols are registered and application is ready
     */
    @EventListener
    @Order(10)
    public void startServerWhenReady(ApplicationReadyEvent event) {
        if (!serverStarted) {
            try {
                startServer();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while starting the TCP server", e);
            }
        }
    }

    private void startServer() throws InterruptedException {
        log.info("🚀 Starting Netty TCP Server on port {} with protocol {}", config.port(), config.protocol());
        log.info("📊 Server configuration: bossThreads={}, workerThreads={}, businessThreads={}, backlog={}, keepAlive={}, tcpNoDelay={}, idleTimeout={}s",
                config.bossThreads(), config.getEffectiveWorkerThreads(), config.businessThreads(), config.backlog(),
                config.keepAlive(), config.tcpNoDelay(), config.idleTimeoutSeconds());

        if (!protocolFactory.isRegistered(config.protocol())) {
            String errorMsg = String.format("💥 Protocol '%s' is not registered, available: %s",
                    config.protocol(), protocolFactory.getRegisteredProtocols());
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        bossGroup = new NioEventLoopGroup(config.bossThreads());
        workerGroup = new NioEventLoopGroup(config.getEffectiveWorkerThreads());
        businessExecutorGroup = new DefaultEventExecutorGroup(config.businessThreads());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.backlog())
                .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childOption(ChannelOption.SO_KEEPALIVE, config.keepAlive())
                .childOption(ChannelOption.TCP_NODELAY, config.tcpNoDelay())
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .handler(new LoggingHandler(LogLevel.INFO))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        setupPipeline(ch);
                    }
                });

            ChannelFuture future = bootstrap.bind(config.port()).sync();
            serverChannel = future.channel();
            serverStarted = true;
            log.info("🎉 Netty TCP Server listening on port {}", config.port());
        } catch (InterruptedException | RuntimeException e) {
            log.error("💥 Failed to start Netty TCP Server", e);
            shutdown();
            throw e;
        }
    }

    private void setupPipeline(SocketChannel channel) {
        ChannelPipeline pipeline = channel.pipeline();
        Protocol protocol = protocolFactory.get(config.protocol())
                .orElseThrow(() -> new IllegalStateException("Protocol not found: " + config.protocol()));

        int idle = config.idleTimeoutSeconds();
        pipeline.addLast("idleState", new IdleStateHandler(0, 0, idle, TimeUnit.SECONDS));
        pipeline.addLast("frameDecoder", protocol.frameDecoder());
        pipeline.addLast("protocolDecoder", protocol.protocolDecoder());
        pipeline.addLast(businessExecutorGroup, "businessHandler", businessHandler);
        pipeline.addLast("protocolEncoder", protocol.protocolEncoder());

        log.debug("✅ Pipeline configured for {}: {}", channel.remoteAddress(), pipeline.names());
    }

    /**
     * Shutdown the server gracefully
     */
    @PreDestroy
    public void shutdown() {
        log.info("🛑 Shutting down Netty TCP Server...");
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            log.warn("⚠️ Interrupted while closing server channel", e);
            Thread.currentThread().interrupt();
        } finally {
            if (businessExecutorGroup != null) {
                businessExecutorGroup.shutdownGracefully();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
            }
            serverStarted = false;
            log.info("✅ Netty TCP Server shutdown completed");
        }
    }
}
