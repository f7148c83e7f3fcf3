// file: client/src/test/java/io/kvgate/client/CliTest.java
package io.kvgate.client;

import io.kvgate.core.Bytes;
import io.kvgate.testkit.InMemoryGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Focus: CLI commands print what the gateway holds.
 */
class CliTest {

    private InMemoryGateway gateway;
    private KvClient client;
    private ByteArrayOutputStream buf;
    private Cli cli;

    @BeforeEach
    void start() {
        gateway = new InMemoryGateway().start();
        client = new KvClient(ClientConfig.of(gateway.baseUrl()));
        buf = new ByteArrayOutputStream();
        cli = new Cli(client, new PrintStream(buf, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void stop() {
        client.close();
        gateway.close();
    }

    private String run(String... args) {
        buf.reset();
        cli.run(args);
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void put_get_and_del_round_trip() {
        assertTrue(run("put", "greeting", "hello").startsWith("OK (revision 2)"));
        assertEquals("hello", run("get", "greeting").trim());
        assertEquals("deleted 1", run("del", "greeting").trim());
        assertEquals("(not found)", run("get", "greeting").trim());
    }

    @Test
    void prefix_get_and_dump_list_keys_with_values() {
        client.set(Bytes.utf8("app/a"), Bytes.utf8("1"));
        client.set(Bytes.utf8("app/b"), Bytes.utf8("2"));
        client.set(Bytes.utf8("zzz"), Bytes.utf8("3"));

        String prefixed = run("get", "app/", "--prefix");
        assertTrue(prefixed.contains("app/a = 1"));
        assertTrue(prefixed.contains("app/b = 2"));
        assertFalse(prefixed.contains("zzz"));

        assertEquals(3, run("dump").trim().split("\n").length);
    }

    @Test
    void status_prints_revision() {
        assertTrue(run("status").contains("revision: 1"));
    }

    @Test
    void bad_usage_is_reported_as_cli_exception() {
        assertThrows(Cli.CliException.class, () -> run("frobnicate"));
        assertThrows(Cli.CliException.class, () -> run("put", "only-key"));
        assertEquals(0, gateway.requestCount("/kv/put"));
    }
}
