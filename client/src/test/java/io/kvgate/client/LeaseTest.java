// file: client/src/test/java/io/kvgate/client/LeaseTest.java
package io.kvgate.client;

import io.kvgate.core.Bytes;
import io.kvgate.core.Header;
import io.kvgate.core.LeaseExpiredException;
import io.kvgate.core.ProtocolException;
import io.kvgate.testkit.InMemoryGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Focus: lease lifecycle (grant, keepalive, expiry, revoke) as seen by the client.
 */
class LeaseTest {

    private InMemoryGateway gateway;
    private KvClient client;

    @BeforeEach
    void start() {
        gateway = new InMemoryGateway().start();
        client = new KvClient(ClientConfig.of(gateway.baseUrl()));
    }

    @AfterEach
    void stop() {
        client.close();
        gateway.close();
    }

    @Test
    void grant_returns_id_and_ttl_and_remaining_is_positive() {
        Lease lease = client.lease(30);
        assertNotEquals(0, lease.leaseId());
        assertEquals(30, lease.timeToLive());
        long remaining = lease.remaining();
        assertTrue(remaining > 0 && remaining <= 30, "remaining=" + remaining);
        assertFalse(lease.isExpired());
    }

    @Test
    void requested_id_is_honoured() {
        Lease lease = client.lease(10, 777L);
        assertEquals(777L, lease.leaseId());
    }

    @Test
    void refresh_reports_a_header_no_older_than_the_grant() {
        Lease lease = client.lease(10);
        Header refreshed = lease.refresh();
        assertTrue(refreshed.revision() >= lease.header().revision());
        assertEquals(10, lease.timeToLive());
    }

    @Test
    void keys_lists_attached_keys() {
        Lease lease = client.lease(30);
        client.set(Bytes.utf8("session/a"), Bytes.utf8("1"), lease);
        client.set(Bytes.utf8("session/b"), Bytes.utf8("2"), lease);
        client.set(Bytes.utf8("plain"), Bytes.utf8("3"));

        List<byte[]> keys = lease.keys();
        assertEquals(2, keys.size());
        assertArrayEquals(Bytes.utf8("session/a"), keys.get(0));
    }

    @Test
    void revoke_deletes_attached_keys_and_expires_the_lease() {
        Lease lease = client.lease(30);
        client.set(Bytes.utf8("session/a"), Bytes.utf8("1"), lease);

        lease.revoke();

        assertTrue(lease.isExpired());
        assertNull(client.getValue(Bytes.utf8("session/a")));
        long before = client.stats().totalPosts();
        assertThrows(LeaseExpiredException.class, lease::refresh);
        assertThrows(LeaseExpiredException.class, lease::remaining);
        assertEquals(before, client.stats().totalPosts(), "an expired lease fails without a round trip");
    }

    @Test
    void lease_left_alone_past_its_ttl_expires_and_takes_its_keys() throws Exception {
        Lease lease = client.lease(1);
        client.set(Bytes.utf8("ephemeral"), Bytes.utf8("x"), lease);

        Thread.sleep(1_600);

        LeaseExpiredException e = assertThrows(LeaseExpiredException.class, lease::remaining);
        assertEquals(lease.leaseId(), e.leaseId());
        assertTrue(lease.isExpired());
        assertNull(client.getValue(Bytes.utf8("ephemeral")));
    }

    @Test
    void undecodable_key_in_lease_listing_is_a_protocol_error() {
        try (ScriptedGateway scripted = new ScriptedGateway()
                .respond(Endpoints.LEASE_TIME_TO_LIVE, "{\"ID\":\"7\",\"TTL\":\"5\",\"keys\":[\"not base64!\"]}")
                .start();
             KvClient other = new KvClient(ClientConfig.of(scripted.baseUrl()))) {
            Lease lease = new Lease(other, 7, 10, Header.EMPTY);
            ProtocolException e = assertThrows(ProtocolException.class, lease::keys);
            assertTrue(e.getMessage().contains("keys"), e.getMessage());
        }
    }

    @Test
    void expiry_message_prints_lease_id_unsigned() {
        LeaseExpiredException e = new LeaseExpiredException(-1L);
        assertEquals("lease 18446744073709551615 expired", e.getMessage());
        assertEquals(-1L, e.leaseId());
    }
}
