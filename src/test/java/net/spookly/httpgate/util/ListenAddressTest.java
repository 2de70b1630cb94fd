package net.spookly.httpgate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ListenAddressTest {
    @Test
    void parsesHostAndPort() {
        ListenAddress address = ListenAddress.parse("127.0.0.1:9000");
        assertEquals("127.0.0.1", address.host());
        assertEquals(9000, address.port());
    }

    @Test
    void parsesBracketedIpv6() {
        ListenAddress address = ListenAddress.parse("[::1]:8081");
        assertEquals("::1", address.host());
        assertEquals(8081, address.port());
        assertEquals("[::1]:8081", address.toString());
    }

    @Test
    void rejectsInvalidFormat() {
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("bad"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("host:http"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("host:70000"));
    }

    @Test
    void ephemeralUsesPortZero() {
        assertEquals(0, ListenAddress.ephemeral("127.0.0.1").port());
    }
}
