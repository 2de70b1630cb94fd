package net.spookly.httpgate.proxy;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP/1.x listener in front of the forwarding engine.
 */
@Slf4j
public final class HttpProxyServer {
    private final ProxySettings settings;
    private final ForwardingEngine engine;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup clients = new DefaultChannelGroup("httpgate-clients", GlobalEventExecutor.INSTANCE);
    private Channel channel;

    public HttpProxyServer(ProxySettings settings,
                           ForwardingEngine engine,
                           EventLoopGroup bossGroup,
                           EventLoopGroup workerGroup) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.bossGroup = Objects.requireNonNull(bossGroup, "bossGroup");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
    }

    /**
     * Bind the listener. Fails with {@link IllegalStateException} when the address cannot be bound.
     */
    public synchronized void start() {
        if (channel != null) {
            return;
        }
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 1024)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ProxyChannelInitializer(engine, settings, clients));
        InetSocketAddress address = settings.listen().toSocketAddress();
        try {
            channel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Proxy bind interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to bind proxy listener on " + settings.listen(), e);
        }
        log.info("Proxy listening on {}", boundAddress());
    }

    public synchronized InetSocketAddress boundAddress() {
        return channel == null ? null : (InetSocketAddress) channel.localAddress();
    }

    public int openClientConnections() {
        return clients.size();
    }

    /**
     * Stop accepting, let in-flight requests finish for up to {@code grace}, then close every client connection.
     */
    public void stop(Duration grace) {
        Channel listener;
        synchronized (this) {
            listener = channel;
            channel = null;
        }
        if (listener == null) {
            return;
        }
        listener.close().awaitUninterruptibly();
        engine.beginDraining();
        long deadline = System.nanoTime() + (grace == null ? 0L : grace.toNanos());
        while (engine.activeRequests() > 0 && System.nanoTime() - deadline < 0) {
            try {
                Thread.sleep(25L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        int abandoned = engine.activeRequests();
        if (abandoned > 0) {
            log.warn("Shutdown grace elapsed with {} requests in flight; closing connections", abandoned);
        }
        clients.close().awaitUninterruptibly();
        log.info("Proxy listener stopped");
    }
}
