// file: client/src/main/java/io/kvgate/client/Cli.java
package io.kvgate.client;

import io.kvgate.core.Bytes;
import io.kvgate.core.Deleted;
import io.kvgate.core.KeyRange;
import io.kvgate.core.KeyValue;
import io.kvgate.core.KvGateException;
import io.kvgate.core.Range;
import io.kvgate.core.Revision;
import io.kvgate.core.Status;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line access to a gateway.
 *
 * Usage:
 *   kvgate-cli [options] status
 *   kvgate-cli [options] get <key> [--prefix]
 *   kvgate-cli [options] put <key> <value>
 *   kvgate-cli [options] del <key> [--prefix]
 *   kvgate-cli [options] dump
 *
 * Options are those of {@link ClientConfig#fromArgs(String[])} and must come
 * before the command. Keys and values are taken as UTF-8 text.
 */
public final class Cli {

    private final KvClient client;
    private final PrintStream out;

    Cli(KvClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        int split = 0;
        while (split < args.length && args[split].startsWith("-")) {
            split += 2;
        }
        split = Math.min(split, args.length);
        String[] flags = Arrays.copyOfRange(args, 0, split);
        String[] rest = Arrays.copyOfRange(args, split, args.length);

        if (rest.length == 0) {
            usageAndExit("missing command");
        }

        ClientConfig config = null;
        try {
            config = ClientConfig.fromArgs(flags);
        } catch (IllegalArgumentException e) {
            usageAndExit(e.getMessage());
        }

        try (KvClient client = new KvClient(config)) {
            new Cli(client, System.out).run(rest);
        } catch (CliException e) {
            usageAndExit(e.getMessage());
        } catch (KvGateException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Execute one command. Throws {@link CliException} on bad usage. */
    void run(String[] rest) {
        String cmd = rest[0];
        List<String> argv = new ArrayList<>(Arrays.asList(rest).subList(1, rest.length));
        boolean prefix = argv.remove("--prefix");

        switch (cmd) {
            case "status" -> {
                requireArgs(argv, 0, "status takes no arguments");
                status();
            }
            case "get" -> {
                requireArgs(argv, 1, "get requires <key>");
                get(range(argv.get(0), prefix));
            }
            case "put" -> {
                requireArgs(argv, 2, "put requires <key> <value>");
                put(argv.get(0), argv.get(1));
            }
            case "del" -> {
                requireArgs(argv, 1, "del requires <key>");
                del(range(argv.get(0), prefix));
            }
            case "dump" -> {
                requireArgs(argv, 0, "dump takes no arguments");
                get(KeyRange.all());
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private void status() {
        Status s = client.status();
        out.println("version:  " + s.version());
        out.println("leader:   " + Long.toUnsignedString(s.leader()));
        out.println("dbSize:   " + s.dbSize());
        out.println("revision: " + s.header().revision());
        out.println("raftTerm: " + s.raftTerm());
    }

    private void get(KeyRange range) {
        Range r = client.get(range);
        if (r.isEmpty()) {
            out.println("(not found)");
            return;
        }
        boolean single = range.mode() == KeyRange.Mode.SINGLE;
        for (KeyValue kv : r.kvs()) {
            String value = new String(kv.value(), StandardCharsets.UTF_8);
            out.println(single ? value : Bytes.display(kv.key()) + " = " + value);
        }
    }

    private void put(String key, String value) {
        Revision rev = client.set(Bytes.utf8(key), Bytes.utf8(value));
        out.println("OK (revision " + rev.header().revision() + ")");
    }

    private void del(KeyRange range) {
        Deleted d = client.delete(range);
        out.println("deleted " + d.deleted());
    }

    private static KeyRange range(String key, boolean prefix) {
        return prefix ? KeyRange.prefix(Bytes.utf8(key)) : KeyRange.single(Bytes.utf8(key));
    }

    private static void requireArgs(List<String> argv, int n, String msg) {
        if (argv.size() != n) {
            throw new CliException(msg);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  kvgate-cli [options] status
                  kvgate-cli [options] get <key> [--prefix]
                  kvgate-cli [options] put <key> <value>
                  kvgate-cli [options] del <key> [--prefix]
                  kvgate-cli [options] dump

                Options:
                  --base-url, -u        Gateway URL (default: http://localhost:2379)
                  --api-prefix          API prefix (default: /v3alpha)
                  --connect-timeout-ms  Connect timeout (default: 10000)
                  --request-timeout-ms  Per-call timeout (default: none)
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
