package net.spookly.httpgate.pool;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * Tail handler of every upstream connection. Traffic reaching it arrived while no request owned the
 * connection, so the connection is no longer safe to reuse and is closed.
 */
@Slf4j
@ChannelHandler.Sharable
public final class IdleConnectionGuard extends ChannelInboundHandlerAdapter {
    public static final IdleConnectionGuard INSTANCE = new IdleConnectionGuard();

    private IdleConnectionGuard() {
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        ReferenceCountUtil.release(msg);
        log.debug("Unsolicited upstream data on {}; closing", ctx.channel().remoteAddress());
        ctx.close();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Idle upstream connection {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
