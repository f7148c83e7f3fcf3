// file: client/src/test/java/io/kvgate/client/ClientConfigTest.java
package io.kvgate.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Focus: ClientConfig parsing from flags and JSON, and its normalisation.
 */
class ClientConfigTest {

    @Test
    void defaults_point_at_local_gateway() {
        ClientConfig c = ClientConfig.defaults();
        assertEquals("http://localhost:2379", c.baseUrl());
        assertEquals("/v3alpha", c.apiPrefix());
        assertNull(c.requestTimeout());
        assertEquals("http://localhost:2379/v3alpha/kv/put", c.endpoint(Endpoints.PUT).toString());
    }

    @Test
    void trailing_slashes_are_trimmed_and_prefix_gets_a_leading_slash() {
        ClientConfig c = new ClientConfig("http://h:1/", "v3/", Duration.ofSeconds(1), null);
        assertEquals("http://h:1", c.baseUrl());
        assertEquals("/v3", c.apiPrefix());
    }

    @Test
    void fromArgs_reads_every_flag() {
        ClientConfig c = ClientConfig.fromArgs(new String[] {
                "-u", "http://10.0.0.1:2379",
                "--api-prefix", "/v3",
                "--connect-timeout-ms", "1500",
                "--request-timeout-ms", "250"
        });
        assertEquals("http://10.0.0.1:2379", c.baseUrl());
        assertEquals("/v3", c.apiPrefix());
        assertEquals(Duration.ofMillis(1500), c.connectTimeout());
        assertEquals(Duration.ofMillis(250), c.requestTimeout());
    }

    @Test
    void fromArgs_rejects_bad_input() {
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromArgs(new String[] {"--nope"}));
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromArgs(new String[] {"--base-url"}));
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromArgs(new String[] {"--request-timeout-ms", "soon"}));
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromArgs(new String[] {"--base-url", "ftp://x"}));
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.fromArgs(new String[] {"--connect-timeout-ms", "0"}));
    }

    @Test
    void fromJsonFile_fills_missing_fields_with_defaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("client.json");
        Files.writeString(file, "{\"baseUrl\":\"http://127.0.0.1:2379\",\"requestTimeoutMs\":2000}");

        ClientConfig c = ClientConfig.fromJsonFile(file);
        assertEquals("http://127.0.0.1:2379", c.baseUrl());
        assertEquals("/v3alpha", c.apiPrefix());
        assertEquals(ClientConfig.DEFAULT_CONNECT_TIMEOUT, c.connectTimeout());
        assertEquals(Duration.ofSeconds(2), c.requestTimeout());
    }

    @Test
    void fromJsonFile_missing_file_fails(@TempDir Path dir) {
        assertThrows(RuntimeException.class, () -> ClientConfig.fromJsonFile(dir.resolve("absent.json")));
    }
}
