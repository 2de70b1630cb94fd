package net.spookly.httpgate.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;

import org.junit.jupiter.api.Test;

class RouteTableTest {
    @Test
    void longestPathPrefixWins() {
        RouteTable table = new RouteTable(List.of(
                route("root", null, "/"),
                route("api", null, "/api"),
                route("api-v2", null, "/api/v2")
        ));

        assertEquals("api-v2", table.match("example.com", "/api/v2/users").id());
        assertEquals("api", table.match("example.com", "/api/v1").id());
        assertEquals("root", table.match("example.com", "/index.html").id());
    }

    @Test
    void prefixMatchRespectsSegments() {
        RouteTable table = new RouteTable(List.of(route("api", null, "/api")));

        assertEquals("api", table.match("example.com", "/api").id());
        assertNull(table.match("example.com", "/apis"));
    }

    @Test
    void exactHostBeatsWildcardAndAnyHost() {
        RouteTable table = new RouteTable(List.of(
                route("any", null, "/"),
                route("wildcard", "*.example.com", "/"),
                route("exact", "api.example.com", "/")
        ));

        assertEquals("exact", table.match("api.example.com", "/").id());
        assertEquals("wildcard", table.match("www.example.com", "/").id());
        assertEquals("any", table.match("other.org", "/").id());
    }

    @Test
    void wildcardDoesNotMatchBareDomain() {
        RouteTable table = new RouteTable(List.of(route("wildcard", "*.example.com", "/")));

        assertNull(table.match("example.com", "/"));
    }

    @Test
    void equalSpecificityKeepsRegistrationOrder() {
        RouteTable table = new RouteTable(List.of(
                route("first", null, "/api"),
                route("second", null, "/api/")
        ));

        assertEquals("first", table.match("example.com", "/api/x").id());
    }

    @Test
    void pathSpecificityOutranksHostSpecificity() {
        RouteTable table = new RouteTable(List.of(
                route("host", "api.example.com", "/"),
                route("path", null, "/v1")
        ));

        assertEquals("path", table.match("api.example.com", "/v1/items").id());
    }

    @Test
    void everyTableHasItsOwnVersion() {
        RouteTable first = RouteTable.empty();
        RouteTable second = RouteTable.empty();

        assertNotEquals(first.version(), second.version());
    }

    static Route route(String id, String host, String prefix) {
        return new Route(id, new RouteMatch(host, prefix), List.of(UpstreamTarget.of("10.0.0.1", 8080)),
                RoutePolicy.defaults());
    }
}
