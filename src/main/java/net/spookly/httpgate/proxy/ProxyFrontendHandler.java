package net.spookly.httpgate.proxy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.GatewayFailure;

/**
 * Client connection handler. Serves one request at a time; pipelined requests wait in arrival order
 * until the current one is answered.
 */
@Slf4j
public final class ProxyFrontendHandler extends ChannelInboundHandlerAdapter {
    private final ForwardingEngine engine;
    private final Deque<HttpObject> pipelined = new ArrayDeque<>();
    private ChannelHandlerContext ctx;
    private InFlightRequest current;
    private boolean currentBodyComplete;
    private boolean currentFinished;
    private boolean dispatching;
    private boolean closing;

    public ProxyFrontendHandler(ForwardingEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (closing || !(msg instanceof HttpObject)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        HttpObject object = (HttpObject) msg;
        if (!pipelined.isEmpty() || (current != null && currentBodyComplete)) {
            pipelined.addLast(object);
            updateAutoRead();
            return;
        }
        dispatch(object);
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (current != null) {
            current.onClientWritabilityChanged();
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        closing = true;
        InFlightRequest request = current;
        current = null;
        if (request != null) {
            request.onClientClosed();
        }
        releasePipelined();
        super.channelInactive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            if (current == null && pipelined.isEmpty()) {
                log.debug("Closing idle client connection {}", ctx.channel().remoteAddress());
                ctx.close();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Client connection {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }

    /**
     * Called by the current request once its response is finished.
     */
    void requestFinished(InFlightRequest request, boolean keepAlive) {
        if (request != current) {
            return;
        }
        if (!keepAlive) {
            closing = true;
            current = null;
            releasePipelined();
            ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        currentFinished = true;
        if (currentBodyComplete) {
            advance();
        }
    }

    /**
     * Pause client reads while requests are queued behind the current one or the current one needs it.
     */
    void updateAutoRead() {
        if (closing || ctx == null) {
            return;
        }
        boolean pause = !pipelined.isEmpty() || (current != null && current.wantsClientPause());
        ctx.channel().config().setAutoRead(!pause);
    }

    private void dispatch(HttpObject msg) {
        if (msg instanceof HttpRequest) {
            HttpRequest request = (HttpRequest) msg;
            if (request.decoderResult().isFailure()) {
                ReferenceCountUtil.release(msg);
                rejectMalformed(request);
                return;
            }
            current = engine.begin(this, ctx.channel(), request);
            currentBodyComplete = false;
            currentFinished = false;
            current.start();
            return;
        }
        if (msg instanceof HttpContent) {
            HttpContent content = (HttpContent) msg;
            if (content.decoderResult().isFailure()) {
                ReferenceCountUtil.release(content);
                log.debug("Malformed request body from {}", ctx.channel().remoteAddress());
                ctx.close();
                return;
            }
            InFlightRequest request = current;
            if (request == null) {
                ReferenceCountUtil.release(content);
                return;
            }
            boolean last = content instanceof LastHttpContent;
            if (last) {
                currentBodyComplete = true;
            }
            request.onClientContent(content);
            if (last && currentFinished && request == current) {
                advance();
            }
            return;
        }
        ReferenceCountUtil.release(msg);
    }

    private void advance() {
        current = null;
        currentBodyComplete = false;
        currentFinished = false;
        if (dispatching) {
            return;
        }
        dispatching = true;
        try {
            while (!closing && !pipelined.isEmpty() && (current == null || !currentBodyComplete)) {
                dispatch(pipelined.pollFirst());
            }
        } finally {
            dispatching = false;
        }
        updateAutoRead();
    }

    private void rejectMalformed(HttpRequest request) {
        closing = true;
        releasePipelined();
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.BAD_REQUEST,
                Unpooled.copiedBuffer(HttpResponseStatus.BAD_REQUEST.reasonPhrase() + "\n", StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN + "; charset=UTF-8");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set("X-Httpgate-Failure", GatewayFailure.BAD_REQUEST.reason());
        HttpUtil.setKeepAlive(response, false);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        engine.publish(new RequestOutcome(
                request.method().name(),
                request.uri(),
                null,
                null,
                HttpResponseStatus.BAD_REQUEST.code(),
                Duration.ZERO,
                0,
                false,
                GatewayFailure.BAD_REQUEST
        ));
    }

    private void releasePipelined() {
        while (!pipelined.isEmpty()) {
            ReferenceCountUtil.release(pipelined.pollFirst());
        }
    }
}
