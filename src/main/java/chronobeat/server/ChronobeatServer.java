package chronobeat.server;

import chronobeat.config.Dependencies;
import chronobeat.config.SchedulerConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server hosting the admin and worker APIs, plus the beat it
 * serves. One instance per process.
 */
public final class ChronobeatServer {

    private static final Logger log = LoggerFactory.getLogger(ChronobeatServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private ChronobeatServer() {
    }

    static ChannelInitializer<SocketChannel> pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Build the dependencies, bind the port and start the beat.
     *
     * @return true if the server is running afterwards
     */
    public static synchronized boolean start(int port, SchedulerConfig config) {
        if (running) {
            return true;
        }
        try {
            dependencies = Dependencies.create(config);

            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(dependencies.routerHandler()));

            serverChannel = bootstrap.bind(config.serverHost(), port).syncUninterruptibly().channel();
            running = true;
            log.info("Chronobeat listening on {}:{}", config.serverHost(), port);

            dependencies.startBeat();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to start server on port {}", port, e);
            running = true;
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
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
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            running = false;
            log.info("Chronobeat stopped");
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /**
     * Dependencies of the running server, or null when stopped.
     */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
