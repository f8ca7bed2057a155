package respkv;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import respkv.command.Echo;
import respkv.command.LRange;
import respkv.command.Ping;
import respkv.command.Set;
import respkv.exception.InvalidArgumentException;
import respkv.exception.UnknownCommandException;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandDispatcherTest {

    private KeyValueStore store;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        store = new KeyValueStore();
        dispatcher = new CommandDispatcher(store);
    }

    private static List<byte[]> tokens(String... tokens) {
        return Arrays.stream(tokens).map(t -> t.getBytes(StandardCharsets.UTF_8)).toList();
    }

    static Stream<List<String>> wrongArity() {
        return Stream.of(
                List.of("PING", "extra"),
                List.of("ECHO"),
                List.of("ECHO", "a", "b"),
                List.of("SET", "k"),
                List.of("GET"),
                List.of("GET", "a", "b"),
                List.of("RPUSH", "k"),
                List.of("LPUSH", "k"),
                List.of("LRANGE", "k", "0"),
                List.of("LLEN"),
                List.of("LPOP", "k", "2")
        );
    }

    private String reply(String... command) {
        RespValue value = dispatcher.dispatch(tokens(command)).orElseThrow();
        return new String(value.serialize(), StandardCharsets.UTF_8);
    }

    @Nested
    class Building {

        @Test
        void testEmptyCommandGetsNoReply() {
            assertThat(dispatcher.dispatch(List.of())).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"PING", "ping", "PiNg"})
        void testCommandNamesAreCaseInsensitive(String name) {
            assertThat(dispatcher.build(tokens(name))).isEqualTo(new Ping(tokens("PING")));
        }

        @Test
        void testCreatesEchoCommand() {
            assertThat(dispatcher.build(tokens("ECHO", "Hello World!")))
                    .isEqualTo(new Echo(tokens("ECHO", "Hello World!")));
        }

        @Test
        void testThrowsExceptionOnUnknownCommand() {
            assertThatThrownBy(() -> dispatcher.build(tokens("FLUSHALL")))
                    .isInstanceOf(UnknownCommandException.class)
                    .hasMessage("unknown command 'FLUSHALL'");
        }

        @Test
        void testThrowsExceptionOnEchoWithNoArguments() {
            assertThatThrownBy(() -> dispatcher.build(tokens("ECHO")))
                    .isInstanceOf(UnknownCommandException.class)
                    .hasMessage("wrong number of arguments for 'echo' command");
        }

        @Test
        void testCreatesSetCommandWithExpiration() {
            Set set = (Set) dispatcher.build(tokens("set", "key", "value", "px", "100"));
            assertThat(set.ttl()).isEqualTo(Duration.ofMillis(100));
        }

        @Test
        void testSetIgnoresIncompleteOption() {
            Set set = (Set) dispatcher.build(tokens("SET", "key", "value", "PX"));
            assertThat(set.ttl()).isNull();
        }

        @Test
        void testSetIgnoresUnrelatedOption() {
            Set set = (Set) dispatcher.build(tokens("SET", "key", "value", "EX", "10"));
            assertThat(set.ttl()).isNull();
        }

        @Test
        void testThrowsExceptionWhenPxIsNotANumber() {
            assertThatThrownBy(() -> dispatcher.build(tokens("SET", "key", "value", "PX", "soon")))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("value is not an integer or out of range");
        }

        @Test
        void testThrowsExceptionWhenPxIsNotPositive() {
            assertThatThrownBy(() -> dispatcher.build(tokens("SET", "key", "value", "PX", "0")))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("invalid expire time in 'set' command");
        }

        @Test
        void testThrowsExceptionWhenPxDeadlineWouldOverflow() {
            assertThatThrownBy(() -> dispatcher.build(tokens("SET", "key", "value", "PX", "9223372036854775807")))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("invalid expire time in 'set' command");
        }

        @Test
        void testAcceptsLargestRepresentablePx() {
            assertThat(((Set) dispatcher.build(tokens("SET", "key", "value", "PX", "9223372036854"))).ttl())
                    .isEqualTo(Duration.ofMillis(9_223_372_036_854L));
        }

        @Test
        void testCreatesLRangeWithSignedBounds() {
            assertThat(dispatcher.build(tokens("LRANGE", "k", "-3", "+2")))
                    .isEqualTo(new LRange(tokens("LRANGE", "k", "-3", "2"), store));
        }

        @ParameterizedTest
        @MethodSource("respkv.CommandDispatcherTest#wrongArity")
        void testWrongArityIsRejectedBeforeStore(List<String> command) {
            String name = command.get(0).toLowerCase();
            assertThat(reply(command.toArray(String[]::new)))
                    .isEqualTo("-ERR wrong number of arguments for '" + name + "' command\r\n");
            assertThat(store.size()).isZero();
        }
    }

    @Nested
    class Replies {

        @Test
        void testPing() {
            assertThat(reply("PING")).isEqualTo("+PONG\r\n");
        }

        @Test
        void testEcho() {
            assertThat(reply("ECHO", "hi")).isEqualTo("$2\r\nhi\r\n");
        }

        @Test
        void testUnknownCommand() {
            assertThat(reply("HELLO")).isEqualTo("-ERR unknown command 'HELLO'\r\n");
        }

        @Test
        void testSetAndGet() {
            assertThat(reply("SET", "k", "v")).isEqualTo("+OK\r\n");
            assertThat(reply("GET", "k")).isEqualTo("$1\r\nv\r\n");
        }

        @Test
        void testGetMissing() {
            assertThat(reply("GET", "missing")).isEqualTo("$-1\r\n");
        }

        @Test
        void testGetOnListIsTypeMismatch() {
            reply("RPUSH", "k", "a");
            assertThat(reply("GET", "k"))
                    .isEqualTo("-ERR Operation against a key holding the wrong kind of value\r\n");
        }

        @Test
        void testTypeIsolation() {
            reply("SET", "k", "v");
            assertThat(reply("RPUSH", "k", "x"))
                    .isEqualTo("-ERR Operation against a key holding the wrong kind of value\r\n");
            assertThat(reply("GET", "k")).isEqualTo("$1\r\nv\r\n");
        }

        @Test
        void testListCommands() {
            assertThat(reply("RPUSH", "k", "a", "b")).isEqualTo(":2\r\n");
            assertThat(reply("LPUSH", "k", "y", "z")).isEqualTo(":4\r\n");
            assertThat(reply("LRANGE", "k", "0", "-1"))
                    .isEqualTo("*4\r\n$1\r\nz\r\n$1\r\ny\r\n$1\r\na\r\n$1\r\nb\r\n");
            assertThat(reply("LLEN", "k")).isEqualTo(":4\r\n");
            assertThat(reply("LPOP", "k")).isEqualTo("$1\r\nz\r\n");
        }

        @Test
        void testListEmptiness() {
            reply("RPUSH", "k", "a");
            assertThat(reply("LPOP", "k")).isEqualTo("$1\r\na\r\n");
            assertThat(reply("LPOP", "k")).isEqualTo("$-1\r\n");
            assertThat(reply("LLEN", "k")).isEqualTo(":0\r\n");
            assertThat(store.exists("k".getBytes(StandardCharsets.UTF_8))).isFalse();
        }

        @Test
        void testHugePxIsAnErrorReply() {
            assertThat(reply("SET", "k", "v", "PX", "9223372036854775807"))
                    .isEqualTo("-ERR invalid expire time in 'set' command\r\n");
            assertThat(reply("GET", "k")).isEqualTo("$-1\r\n");
        }

        @Test
        void testLrangeOnMissingKeyIsEmptyArray() {
            assertThat(reply("LRANGE", "missing", "0", "-1")).isEqualTo("*0\r\n");
        }

        @Test
        void testLrangeWithNonIntegerBound() {
            reply("RPUSH", "k", "a");
            assertThat(reply("LRANGE", "k", "zero", "-1"))
                    .isEqualTo("-ERR value is not an integer or out of range\r\n");
        }

        @Test
        void testBinaryValuesSurvive() {
            byte[] value = {0, '\r', '\n', (byte) 0xff};
            dispatcher.dispatch(List.of("SET".getBytes(), "bin".getBytes(), value));
            byte[] wire = dispatcher.dispatch(tokens("GET", "bin")).orElseThrow().serialize();
            assertThat(wire).containsExactly('$', '4', '\r', '\n', 0, '\r', '\n', 0xff, '\r', '\n');
        }
    }
}
