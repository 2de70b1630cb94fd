package net.spookly.httpgate.proxy;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;
import io.netty.handler.timeout.IdleStateHandler;

/**
 * Pipeline of an accepted client connection.
 */
public final class ProxyChannelInitializer extends ChannelInitializer<SocketChannel> {
    private final ForwardingEngine engine;
    private final ProxySettings settings;
    private final ChannelGroup clients;

    public ProxyChannelInitializer(ForwardingEngine engine, ProxySettings settings, ChannelGroup clients) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clients = Objects.requireNonNull(clients, "clients");
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        clients.add(ch);
        ChannelPipeline pipeline = ch.pipeline();
        pipeline.addLast("http-codec", new HttpServerCodec(settings.maxInitialLineLength(), settings.maxHeaderSize(), 8192));
        pipeline.addLast("expect-continue", new HttpServerExpectContinueHandler());
        pipeline.addLast("idle", new IdleStateHandler(0, 0, settings.idleClientTimeout().toMillis(), TimeUnit.MILLISECONDS));
        pipeline.addLast("frontend", new ProxyFrontendHandler(engine));
    }
}
