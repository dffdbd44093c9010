package io.github.respkv.kv;

import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespSimpleString;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyValueCommandTest {

    @Test
    void parse() throws MalformedCommandException {
        KeyValueCommand cmd = KeyValueCommand.parse(
                RespArray.with(RespBulkString.withUTF8("mGeT"), RespBulkString.withUTF8("a"), RespBulkString.withUTF8("b")));

        assertEquals(Command.MGET, cmd.getCommand());
        assertEquals("mGeT", cmd.getName());
        assertEquals(2, cmd.argc());
        assertEquals(RespBulkString.withUTF8("b"), cmd.arg(1));
    }

    @Test
    void unknownName() throws MalformedCommandException {
        KeyValueCommand cmd = KeyValueCommand.parse(RespArray.with(RespBulkString.withUTF8("hello")));
        assertEquals(Command.UNKNOWN, cmd.getCommand());
        assertEquals(0, cmd.argc());
    }

    @Test
    void commandOf() {
        assertEquals(Command.QUIT, Command.of("quit"));
        assertEquals(Command.EXPIRE, Command.of("Expire"));
        assertEquals(Command.UNKNOWN, Command.of("unknown"));
        assertEquals(Command.UNKNOWN, Command.of(""));
    }

    @Test
    void notAnArray() {
        assertThrows(MalformedCommandException.class, () -> KeyValueCommand.parse(RespBulkString.withUTF8("PING")));
    }

    @Test
    void emptyArray() {
        assertThrows(MalformedCommandException.class, () -> KeyValueCommand.parse(RespArray.empty()));
    }

    @Test
    void nameIsNotBulkString() {
        assertThrows(MalformedCommandException.class,
                () -> KeyValueCommand.parse(RespArray.with(RespSimpleString.withUTF8("PING"))));
    }

    @Test
    void keyMustBeBulkString() throws MalformedCommandException {
        KeyValueCommand cmd = KeyValueCommand.parse(
                RespArray.with(RespBulkString.withUTF8("GET"), RespSimpleString.withUTF8("k")));
        StoreException e = assertThrows(StoreException.class, () -> cmd.key(0));
        assertEquals(StoreException.Reason.WRONG_TYPE, e.getReason());
        assertEquals("Invalid key type", e.getMessage());
    }
}
