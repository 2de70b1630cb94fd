package net.spookly.httpgate.proxy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.ReferenceCountUtil;

/**
 * Request body chunks of one request. Chunks are retained for replay while the body fits within
 * {@code maxReplayBytes}; later chunks are streamed once and, after the first of them has been written,
 * the request can no longer be retried.
 */
final class RequestBodyBuffer {
    private final long maxReplayBytes;
    private final List<HttpContent> retained = new ArrayList<>();
    private final Deque<HttpContent> overflow = new ArrayDeque<>();
    private long retainedBytes;
    private boolean overflowed;
    private boolean streamed;
    private boolean complete;
    private int cursor;
    private boolean released;

    RequestBodyBuffer(long maxReplayBytes) {
        this.maxReplayBytes = maxReplayBytes;
    }

    /**
     * Take ownership of the next chunk.
     */
    void append(HttpContent content) {
        if (released || complete) {
            ReferenceCountUtil.release(content);
            return;
        }
        if (content instanceof LastHttpContent) {
            complete = true;
        }
        int size = content.content().readableBytes();
        if (!overflowed && retainedBytes + size <= maxReplayBytes) {
            retained.add(content);
            retainedBytes += size;
        } else {
            overflowed = true;
            overflow.addLast(content);
        }
    }

    boolean isComplete() {
        return complete;
    }

    /**
     * True while no chunk that could not be kept has been sent upstream.
     */
    boolean canReplay() {
        return !streamed;
    }

    /**
     * Chunks are waiting that could not be retained and have not been sent.
     */
    boolean hasPendingOverflow() {
        return !overflow.isEmpty();
    }

    /**
     * Every chunk received so far has been written to the current attempt and the body is complete.
     */
    boolean isFullySent() {
        return complete && cursor == retained.size() && overflow.isEmpty();
    }

    long retainedBytes() {
        return retainedBytes;
    }

    /**
     * Start writing from the first chunk again, for a new attempt.
     */
    void rewind() {
        cursor = 0;
    }

    /**
     * Write every unsent chunk to {@code upstream} without flushing.
     */
    void writeTo(Channel upstream, ChannelFutureListener listener) {
        while (cursor < retained.size()) {
            HttpContent chunk = retained.get(cursor++);
            upstream.write(chunk.retainedDuplicate()).addListener(listener);
        }
        while (!overflow.isEmpty()) {
            streamed = true;
            upstream.write(overflow.pollFirst()).addListener(listener);
        }
    }

    void release() {
        if (released) {
            return;
        }
        released = true;
        for (HttpContent content : retained) {
            ReferenceCountUtil.release(content);
        }
        retained.clear();
        while (!overflow.isEmpty()) {
            ReferenceCountUtil.release(overflow.pollFirst());
        }
    }
}
