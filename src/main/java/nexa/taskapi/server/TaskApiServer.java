package nexa.taskapi.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.cors.CorsConfig;
import io.netty.handler.codec.http.cors.CorsConfigBuilder;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.handler.timeout.IdleStateHandler;
import nexa.taskapi.config.TaskApiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server hosting the task API.
 * One instance per process; everything it serves comes in through the router
 * passed to the constructor.
 */
public final class TaskApiServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskApiServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final TaskApiConfig config;
    private final RouterHandler router;
    private final CorsConfig corsConfig;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public TaskApiServer(TaskApiConfig config, RouterHandler router) {
        this.config = config;
        this.router = router;
        this.corsConfig = corsConfig(config.corsOrigins());
    }

    static CorsConfig corsConfig(List<String> origins) {
        CorsConfigBuilder builder = origins.contains("*")
                ? CorsConfigBuilder.forAnyOrigin()
                : CorsConfigBuilder.forOrigins(origins.toArray(new String[0]));
        return builder
                .allowCredentials()
                .allowedRequestMethods(HttpMethod.GET, HttpMethod.POST, HttpMethod.OPTIONS)
                .allowedRequestHeaders("Content-Type")
                .build();
    }

    /** HTTP pipeline */
    private ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(new CorsHandler(corsConfig));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind the server. Blocks until the port is bound.
     *
     * @throws IllegalStateException if already running
     */
    public synchronized void start() throws InterruptedException {
        if (isRunning()) {
            throw new IllegalStateException("Server already running on port " + port());
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.serverHost(), config.serverPort()).sync().channel();
            log.info("Task API listening on {}:{}", config.serverHost(), port());
        } catch (Exception e) {
            log.error("Failed to start server on port {}: {}", config.serverPort(), e.getMessage());
            stop();
            throw e;
        }
    }

    /**
     * Actual bound port (differs from the configured one when that is 0).
     */
    public synchronized int port() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    /** Block until the server channel closes. */
    public void awaitTermination() throws InterruptedException {
        Channel ch;
        synchronized (this) {
            ch = serverChannel;
        }
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            log.info("Task API stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
