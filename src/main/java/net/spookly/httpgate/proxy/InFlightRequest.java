package net.spookly.httpgate.proxy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import net.spookly.httpgate.GatewayException;
import net.spookly.httpgate.GatewayFailure;
import net.spookly.httpgate.admission.AdmissionScope;
import net.spookly.httpgate.admission.AdmissionSlot;
import net.spookly.httpgate.health.HealthPermit;
import net.spookly.httpgate.health.UpstreamHealthTracker;
import net.spookly.httpgate.pool.NettyUpstreamConnector;
import net.spookly.httpgate.pool.PooledConnection;
import net.spookly.httpgate.pool.ReleaseOutcome;
import net.spookly.httpgate.routing.Route;
import net.spookly.httpgate.routing.RouteResolution;
import net.spookly.httpgate.routing.UpstreamTarget;
import net.spookly.httpgate.util.Deadline;

/**
 * One client request from head to final byte. Every field is touched only on the client channel's event
 * loop; completions arriving on other threads are moved onto it first. Whatever the exit path, the
 * request releases its admission slots, health permit and upstream connection exactly once.
 */
@Slf4j
final class InFlightRequest {
    private enum Phase {
        ADMISSION,
        CONNECTING,
        AWAITING_RESPONSE,
        RELAYING,
        DONE
    }

    private final ForwardingEngine engine;
    private final ProxyFrontendHandler frontend;
    private final Channel client;
    private final EventLoop loop;
    private final HttpRequest request;
    private final RequestBodyBuffer body;
    private final long startNanos = System.nanoTime();
    private final List<AdmissionSlot> slots = new ArrayList<>(2);

    private Phase phase = Phase.ADMISSION;
    private RouteResolution resolution;
    private Route route;
    private Deadline deadline;
    private ScheduledFuture<?> deadlineTimer;
    private ScheduledFuture<?> attemptTimer;
    private Future<AdmissionSlot> pendingAdmission;
    private Future<PooledConnection> pendingConnection;

    private int attempt = -1;
    private int cursor;
    private UpstreamTarget target;
    private HealthPermit permit;
    private boolean permitSettled = true;
    private PooledConnection connection;
    private UpstreamResponseRelay relay;
    private ChannelFutureListener upstreamWriteListener;
    private boolean upstreamWritable = true;

    private boolean responseStarted;
    private boolean skipInformationalTail;
    private boolean upstreamKeepAlive;
    private boolean clientKeepAlive;
    private int status;
    private boolean finished;

    InFlightRequest(ForwardingEngine engine, ProxyFrontendHandler frontend, Channel client, HttpRequest request) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.frontend = Objects.requireNonNull(frontend, "frontend");
        this.client = Objects.requireNonNull(client, "client");
        this.loop = client.eventLoop();
        this.request = Objects.requireNonNull(request, "request");
        this.body = new RequestBodyBuffer(engine.settings().maxReplayBytes());
    }

    boolean isFinished() {
        return finished;
    }

    /**
     * True while the client should stop sending: body bytes are piling up without an upstream able to take them.
     */
    boolean wantsClientPause() {
        if (finished) {
            return false;
        }
        if (body.hasPendingOverflow()) {
            return true;
        }
        return connection != null && !upstreamWritable;
    }

    void start() {
        engine.requestStarted();
        try {
            resolveAndAdmit();
        } catch (RuntimeException e) {
            log.warn("Request {} {} failed before forwarding", request.method(), request.uri(), e);
            fail(GatewayException.failureOf(e, GatewayFailure.UPSTREAM_UNREACHABLE), e);
        }
    }

    private void resolveAndAdmit() {
        String path = ProxyHeaders.requestPath(request.uri());
        if (path == null) {
            fail(GatewayFailure.BAD_REQUEST, null);
            return;
        }
        resolution = engine.routing().resolve(request.headers().get(HttpHeaderNames.HOST), path);
        if (!resolution.found()) {
            fail(GatewayFailure.NO_ROUTE, null);
            return;
        }
        route = resolution.route();
        deadline = Deadline.after(route.policy().timeout());
        deadlineTimer = loop.schedule(this::onDeadline, deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        acquireSlot(AdmissionScope.of(route), () -> acquireSlot(AdmissionScope.global(), this::nextAttempt));
    }

    void onClientContent(HttpContent content) {
        if (finished) {
            ReferenceCountUtil.release(content);
            return;
        }
        body.append(content);
        flushBody();
        frontend.updateAutoRead();
    }

    void onClientWritabilityChanged() {
        if (phase == Phase.RELAYING && connection != null) {
            connection.channel().config().setAutoRead(client.isWritable());
        }
    }

    void onClientClosed() {
        if (finished) {
            return;
        }
        finished = true;
        phase = Phase.DONE;
        cancelWaits();
        settlePermit(null);
        releaseConnection(ReleaseOutcome.BROKEN);
        releaseSlots();
        body.release();
        engine.requestFinished(outcome(GatewayFailure.CLIENT_DISCONNECTED));
    }

    void onUpstreamMessage(int attemptId, HttpObject msg) {
        if (finished || attemptId != attempt || connection == null) {
            ReferenceCountUtil.release(msg);
            return;
        }
        if (msg.decoderResult().isFailure()) {
            Throwable cause = msg.decoderResult().cause();
            ReferenceCountUtil.release(msg);
            onUpstreamFailure(attemptId, cause);
            return;
        }
        if (msg instanceof HttpResponse) {
            HttpResponse response = (HttpResponse) msg;
            if (ProxyHeaders.isInformational(response.status())) {
                skipInformationalTail = true;
                ReferenceCountUtil.release(msg);
                return;
            }
            relayResponseHead(response);
        }
        if (msg instanceof HttpContent) {
            HttpContent content = (HttpContent) msg;
            if (skipInformationalTail) {
                skipInformationalTail = !(content instanceof LastHttpContent);
                ReferenceCountUtil.release(content);
                return;
            }
            if (!responseStarted) {
                ReferenceCountUtil.release(content);
                return;
            }
            client.write(content).addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
            if (content instanceof LastHttpContent) {
                client.flush();
                complete();
                return;
            }
        }
        client.flush();
        if (!client.isWritable() && connection != null) {
            connection.channel().config().setAutoRead(false);
        }
    }

    void onUpstreamWritabilityChanged(int attemptId, boolean writable) {
        if (finished || attemptId != attempt || connection == null) {
            return;
        }
        upstreamWritable = writable;
        if (writable) {
            flushBody();
        }
        frontend.updateAutoRead();
    }

    void onUpstreamFailure(int attemptId, Throwable cause) {
        if (finished || attemptId != attempt || connection == null) {
            return;
        }
        settlePermit(Boolean.FALSE);
        releaseConnection(ReleaseOutcome.BROKEN);
        if (responseStarted) {
            log.debug("Upstream {} failed mid-response: {}", target, describe(cause));
            fail(GatewayFailure.PARTIAL_RESPONSE_FAILURE, cause);
            return;
        }
        retryOrFail(GatewayFailure.UPSTREAM_UNREACHABLE, cause);
    }

    private void acquireSlot(AdmissionScope scope, Runnable next) {
        phase = Phase.ADMISSION;
        Future<AdmissionSlot> future = engine.admission().acquire(scope, deadline);
        pendingAdmission = future;
        future.addListener((Future<AdmissionSlot> f) -> onLoop(() -> {
            if (pendingAdmission == f) {
                pendingAdmission = null;
            }
            if (!f.isSuccess()) {
                if (!finished && !f.isCancelled()) {
                    fail(GatewayException.failureOf(f.cause(), GatewayFailure.REJECTED), f.cause());
                }
                return;
            }
            AdmissionSlot slot = f.getNow();
            if (finished) {
                slot.release();
                return;
            }
            slots.add(slot);
            next.run();
        }));
    }

    private void nextAttempt() {
        if (finished) {
            return;
        }
        if (deadline.isExpired()) {
            fail(GatewayFailure.UPSTREAM_TIMEOUT, null);
            return;
        }
        attempt++;
        body.rewind();
        skipInformationalTail = false;
        upstreamWritable = true;
        selectTarget();
        phase = Phase.CONNECTING;

        int attemptId = attempt;
        Duration attemptTimeout = route.policy().attemptTimeout();
        if (attemptTimeout != null) {
            attemptTimer = loop.schedule(() -> onAttemptTimeout(attemptId), attemptTimeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        Future<PooledConnection> future = engine.pools().acquire(target, deadline);
        pendingConnection = future;
        future.addListener((Future<PooledConnection> f) -> onLoop(() -> onConnection(attemptId, f)));
    }

    private void selectTarget() {
        UpstreamHealthTracker health = engine.health();
        List<UpstreamTarget> candidates = resolution.candidates();
        int size = candidates.size();
        for (int i = 0; i < size; i++) {
            UpstreamTarget candidate = candidates.get((cursor + i) % size);
            HealthPermit granted = health.tryAcquire(candidate);
            if (granted != null) {
                target = candidate;
                permit = granted;
                permitSettled = false;
                cursor += i + 1;
                return;
            }
        }
        // Every circuit refuses traffic: try anyway without letting the outcome move circuit state.
        target = candidates.get(cursor % size);
        permit = health.bypass(target);
        permitSettled = false;
        cursor++;
    }

    private void onConnection(int attemptId, Future<PooledConnection> f) {
        if (pendingConnection == f) {
            pendingConnection = null;
        }
        if (!f.isSuccess()) {
            if (finished || attemptId != attempt || f.isCancelled()) {
                return;
            }
            GatewayFailure failure = GatewayException.failureOf(f.cause(), GatewayFailure.UPSTREAM_UNREACHABLE);
            if (failure == GatewayFailure.UPSTREAM_UNREACHABLE) {
                settlePermit(Boolean.FALSE);
                log.debug("Connect to {} failed on attempt {}: {}", target, attemptId + 1, describe(f.cause()));
                retryOrFail(failure, f.cause());
            } else {
                settlePermit(null);
                fail(failure, f.cause());
            }
            return;
        }
        PooledConnection acquired = f.getNow();
        if (finished || attemptId != attempt) {
            acquired.release(ReleaseOutcome.REUSABLE);
            return;
        }
        connection = acquired;
        phase = Phase.AWAITING_RESPONSE;
        Channel upstream = acquired.channel();
        relay = new UpstreamResponseRelay(this, attemptId, loop);
        upstreamWriteListener = relay.writeListener();
        ChannelPipeline pipeline = upstream.pipeline();
        if (pipeline.get(NettyUpstreamConnector.IDLE_GUARD) != null) {
            pipeline.addBefore(NettyUpstreamConnector.IDLE_GUARD, UpstreamResponseRelay.NAME, relay);
        } else {
            pipeline.addLast(UpstreamResponseRelay.NAME, relay);
        }
        upstreamWritable = upstream.isWritable();
        HttpRequest head = ProxyHeaders.upstreamRequest(request, client.remoteAddress(), target,
                engine.settings().forwardedHeaders());
        upstream.write(head).addListener(upstreamWriteListener);
        flushBody();
        frontend.updateAutoRead();
    }

    private void flushBody() {
        if (connection == null || (phase != Phase.AWAITING_RESPONSE && phase != Phase.RELAYING)) {
            return;
        }
        if (!upstreamWritable) {
            return;
        }
        Channel upstream = connection.channel();
        body.writeTo(upstream, upstreamWriteListener);
        upstream.flush();
    }

    private void relayResponseHead(HttpResponse response) {
        cancelAttemptTimer();
        upstreamKeepAlive = HttpUtil.isKeepAlive(response);

        HttpVersion clientVersion = request.protocolVersion();
        boolean http11 = clientVersion.minorVersion() >= 1;
        HttpResponse out = ProxyHeaders.clientResponse(response, http11 ? HttpVersion.HTTP_1_1 : HttpVersion.HTTP_1_0);
        boolean keepAlive = HttpUtil.isKeepAlive(request) && !engine.isDraining();
        boolean bodyless = ProxyHeaders.isBodyless(request.method(), response.status());
        boolean chunked = HttpUtil.isTransferEncodingChunked(out);
        if (!bodyless && !chunked && !HttpUtil.isContentLengthSet(out)) {
            if (http11) {
                HttpUtil.setTransferEncodingChunked(out, true);
            } else {
                keepAlive = false;
            }
        } else if (chunked && !http11) {
            HttpUtil.setTransferEncodingChunked(out, false);
            keepAlive = false;
        }
        HttpUtil.setKeepAlive(out, keepAlive);
        clientKeepAlive = keepAlive;
        status = response.status().code();
        responseStarted = true;
        phase = Phase.RELAYING;
        client.write(out).addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }

    private void onAttemptTimeout(int attemptId) {
        if (finished || attemptId != attempt || responseStarted) {
            return;
        }
        attemptTimer = null;
        if (pendingConnection != null) {
            pendingConnection.cancel(false);
            pendingConnection = null;
            settlePermit(null);
        } else {
            settlePermit(Boolean.FALSE);
            releaseConnection(ReleaseOutcome.BROKEN);
        }
        log.debug("Attempt {} to {} timed out", attemptId + 1, target);
        retryOrFail(GatewayFailure.UPSTREAM_TIMEOUT, null);
    }

    private void onDeadline() {
        deadlineTimer = null;
        if (finished) {
            return;
        }
        if (phase == Phase.ADMISSION) {
            fail(GatewayFailure.REJECTED, null);
            return;
        }
        if (phase == Phase.AWAITING_RESPONSE) {
            settlePermit(Boolean.FALSE);
        }
        fail(GatewayFailure.UPSTREAM_TIMEOUT, null);
    }

    private void retryOrFail(GatewayFailure failure, Throwable cause) {
        cancelAttemptTimer();
        if (deadline.isExpired()) {
            fail(GatewayFailure.UPSTREAM_TIMEOUT, cause);
            return;
        }
        if (!responseStarted
                && attempt < route.policy().retries()
                && body.canReplay()) {
            nextAttempt();
            return;
        }
        fail(failure, cause);
    }

    private void complete() {
        if (finished) {
            return;
        }
        finished = true;
        phase = Phase.DONE;
        cancelWaits();
        settlePermit(Boolean.TRUE);
        boolean reusable = upstreamKeepAlive && body.isFullySent();
        releaseConnection(reusable ? ReleaseOutcome.REUSABLE : ReleaseOutcome.BROKEN);
        releaseSlots();
        body.release();
        engine.requestFinished(outcome(null));
        frontend.requestFinished(this, clientKeepAlive);
    }

    private void fail(GatewayFailure failure, Throwable cause) {
        if (finished) {
            return;
        }
        finished = true;
        phase = Phase.DONE;
        cancelWaits();
        settlePermit(null);
        releaseConnection(ReleaseOutcome.BROKEN);
        releaseSlots();
        body.release();

        boolean keepAlive = false;
        if (responseStarted || !failure.respondsToClient()) {
            client.close();
        } else if (client.isActive()) {
            keepAlive = HttpUtil.isKeepAlive(request) && !engine.isDraining();
            status = failure.status();
            writeError(failure, keepAlive);
        }
        if (cause != null && log.isDebugEnabled()) {
            log.debug("Request {} {} failed with {}: {}", request.method(), request.uri(), failure.reason(), describe(cause));
        }
        engine.requestFinished(outcome(failure));
        frontend.requestFinished(this, keepAlive);
    }

    private void writeError(GatewayFailure failure, boolean keepAlive) {
        HttpVersion version = request.protocolVersion().minorVersion() >= 1 ? HttpVersion.HTTP_1_1 : HttpVersion.HTTP_1_0;
        HttpResponseStatus responseStatus = HttpResponseStatus.valueOf(failure.status());
        FullHttpResponse response = new DefaultFullHttpResponse(version, responseStatus,
                Unpooled.copiedBuffer(responseStatus.reasonPhrase() + "\n", StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN + "; charset=UTF-8");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set("X-Httpgate-Failure", failure.reason());
        HttpUtil.setKeepAlive(response, keepAlive);
        client.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }

    /**
     * Report the attempt's outcome to the health tracker once; {@code null} returns the permit unused.
     */
    private void settlePermit(Boolean success) {
        if (permitSettled || permit == null) {
            return;
        }
        permitSettled = true;
        UpstreamHealthTracker health = engine.health();
        if (success == null) {
            health.release(permit);
        } else if (success) {
            health.recordSuccess(permit);
        } else {
            health.recordFailure(permit);
        }
    }

    private void releaseConnection(ReleaseOutcome outcome) {
        PooledConnection held = connection;
        UpstreamResponseRelay attached = relay;
        connection = null;
        relay = null;
        upstreamWriteListener = null;
        if (held == null) {
            return;
        }
        if (attached != null) {
            attached.detach();
        }
        Channel upstream = held.channel();
        Runnable release = () -> {
            if (attached != null && upstream.pipeline().context(attached) != null) {
                upstream.pipeline().remove(attached);
            }
            upstream.config().setAutoRead(true);
            held.release(outcome);
        };
        try {
            upstream.eventLoop().execute(release);
        } catch (RejectedExecutionException e) {
            held.release(ReleaseOutcome.BROKEN);
        }
    }

    private void releaseSlots() {
        for (AdmissionSlot slot : slots) {
            slot.release();
        }
        slots.clear();
    }

    private void cancelWaits() {
        if (deadlineTimer != null) {
            deadlineTimer.cancel(false);
            deadlineTimer = null;
        }
        cancelAttemptTimer();
        if (pendingAdmission != null) {
            pendingAdmission.cancel(false);
            pendingAdmission = null;
        }
        if (pendingConnection != null) {
            pendingConnection.cancel(false);
            pendingConnection = null;
        }
    }

    private void cancelAttemptTimer() {
        if (attemptTimer != null) {
            attemptTimer.cancel(false);
            attemptTimer = null;
        }
    }

    private RequestOutcome outcome(GatewayFailure failure) {
        return new RequestOutcome(
                request.method().name(),
                request.uri(),
                route == null ? null : route.id(),
                target == null ? null : target.key(),
                failure == GatewayFailure.CLIENT_DISCONNECTED ? 0 : status,
                Duration.ofNanos(System.nanoTime() - startNanos),
                Math.max(0, attempt),
                resolution != null && resolution.degraded(),
                failure
        );
    }

    private void onLoop(Runnable task) {
        if (loop.inEventLoop()) {
            task.run();
        } else {
            loop.execute(task);
        }
    }

    private static String describe(Throwable cause) {
        return cause == null ? "none" : cause.toString();
    }
}
