package net.spookly.httpgate.pool;

import java.time.Duration;

import io.netty.channel.Channel;
import io.netty.util.concurrent.Future;
import net.spookly.httpgate.routing.UpstreamTarget;

/**
 * Opens new transport connections to upstream targets.
 */
public interface UpstreamConnector {
    Future<Channel> connect(UpstreamTarget target, Duration connectTimeout);
}
