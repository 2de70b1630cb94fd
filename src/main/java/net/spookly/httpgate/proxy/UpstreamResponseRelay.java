package net.spookly.httpgate.proxy;

import java.nio.channels.ClosedChannelException;
import java.util.Objects;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoop;
import io.netty.handler.codec.http.HttpObject;
import io.netty.util.ReferenceCountUtil;

/**
 * Per-attempt handler on an upstream connection. Hands every upstream event to the owning request on the
 * client's event loop. Once detached it passes traffic through to the rest of the pipeline.
 */
final class UpstreamResponseRelay extends ChannelInboundHandlerAdapter {
    static final String NAME = "response-relay";

    private final InFlightRequest request;
    private final int attempt;
    private final EventLoop clientLoop;
    private volatile boolean detached;

    UpstreamResponseRelay(InFlightRequest request, int attempt, EventLoop clientLoop) {
        this.request = Objects.requireNonNull(request, "request");
        this.attempt = attempt;
        this.clientLoop = Objects.requireNonNull(clientLoop, "clientLoop");
    }

    void detach() {
        detached = true;
    }

    /**
     * Reports failed upstream writes of this attempt.
     */
    ChannelFutureListener writeListener() {
        return future -> {
            if (!future.isSuccess()) {
                hop(() -> request.onUpstreamFailure(attempt, future.cause()));
            }
        };
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (detached) {
            ctx.fireChannelRead(msg);
            return;
        }
        if (!(msg instanceof HttpObject)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        HttpObject object = (HttpObject) msg;
        if (!hop(() -> request.onUpstreamMessage(attempt, object))) {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (!detached) {
            boolean writable = ctx.channel().isWritable();
            hop(() -> request.onUpstreamWritabilityChanged(attempt, writable));
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!detached) {
            hop(() -> request.onUpstreamFailure(attempt, new ClosedChannelException()));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (detached) {
            ctx.fireExceptionCaught(cause);
            return;
        }
        hop(() -> request.onUpstreamFailure(attempt, cause));
        ctx.close();
    }

    private boolean hop(Runnable task) {
        if (clientLoop.inEventLoop()) {
            task.run();
            return true;
        }
        if (clientLoop.isShuttingDown()) {
            return false;
        }
        clientLoop.execute(task);
        return true;
    }
}
