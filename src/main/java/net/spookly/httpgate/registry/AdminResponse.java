package net.spookly.httpgate.registry;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON response envelope for admin APIs.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AdminResponse {
    public final boolean ok;
    public final String message;
    public final Object data;

    public static AdminResponse ok(String message, Object data) {
        return new AdminResponse(true, message, data);
    }

    public static AdminResponse error(String message) {
        return new AdminResponse(false, message, null);
    }
}
