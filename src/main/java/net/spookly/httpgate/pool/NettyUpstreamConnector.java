package net.spookly.httpgate.pool;

import java.time.Duration;
import java.util.Objects;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import net.spookly.httpgate.routing.UpstreamTarget;

/**
 * Opens plain TCP connections carrying HTTP/1.1 to upstream targets.
 */
public final class NettyUpstreamConnector implements UpstreamConnector {
    public static final String HTTP_CODEC = "http-codec";
    public static final String IDLE_GUARD = "idle-guard";

    private final EventLoopGroup workerGroup;

    public NettyUpstreamConnector(EventLoopGroup workerGroup) {
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
    }

    @Override
    public Future<Channel> connect(UpstreamTarget target, Duration connectTimeout) {
        Objects.requireNonNull(target, "target");
        int timeoutMillis = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
        Promise<Channel> promise = workerGroup.next().newPromise();
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ch.pipeline().addLast(HTTP_CODEC, new HttpClientCodec());
                        ch.pipeline().addLast(IDLE_GUARD, IdleConnectionGuard.INSTANCE);
                    }
                });
        ChannelFuture connectFuture = bootstrap.connect(target.host(), target.port());
        connectFuture.addListener(future -> {
            if (future.isSuccess()) {
                promise.setSuccess(connectFuture.channel());
            } else {
                promise.setFailure(future.cause());
            }
        });
        return promise;
    }
}
