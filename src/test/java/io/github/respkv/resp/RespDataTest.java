package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespDataTest {

    @Test
    void simpleStringToBytes() {
        assertArrayEquals("+OK\r\n".getBytes(), RespSimpleString.withUTF8("OK").toBytes());
    }

    @Test
    void errorToBytes() {
        assertArrayEquals("-Error message\r\n".getBytes(), RespError.withUTF8("Error message").toBytes());
    }

    @Test
    void bulkStringToBytes() {
        assertArrayEquals("$6\r\nfoobar\r\n".getBytes(), RespBulkString.withUTF8("foobar").toBytes());
        assertArrayEquals("$0\r\n\r\n".getBytes(), RespBulkString.withUTF8("").toBytes());
    }

    @Test
    void bulkStringLengthInBytes() {
        RespBulkString bs = RespBulkString.withUTF8("héllo");
        assertEquals(6, bs.getLength());
        assertArrayEquals("$6\r\nhéllo\r\n".getBytes(StandardCharsets.UTF_8), bs.toBytes());
    }

    @Test
    void arrayToBytes() {
        RespArray a = RespArray.with(RespBulkString.withUTF8("a"), RespError.withUTF8("no associated value"));
        assertArrayEquals("*2\r\n$1\r\na\r\n-no associated value\r\n".getBytes(), a.toBytes());
        assertArrayEquals("*0\r\n".getBytes(), RespArray.empty().toBytes());
    }

    @Test
    void simpleStringRejectsLineBreaks() {
        assertThrows(IllegalArgumentException.class, () -> RespSimpleString.withUTF8("a\r\nb"));
        assertThrows(IllegalArgumentException.class, () -> RespError.withUTF8("a\nb"));
    }

    @Test
    void simpleStringAndErrorAreDifferentValues() {
        assertNotEquals(RespSimpleString.withUTF8("x"), RespError.withUTF8("x"));
        assertEquals(RespError.withUTF8("x"), RespError.withUTF8("x"));
        assertEquals(RespError.withUTF8("x").hashCode(), RespError.withUTF8("x").hashCode());
    }

    @Test
    void arrayIsImmutableCopy() {
        List<RespData> datas = new ArrayList<>();
        datas.add(RespBulkString.withUTF8("a"));
        RespArray a = RespArray.with(datas);
        datas.add(RespBulkString.withUTF8("b"));

        assertEquals(1, a.size());
        assertThrows(UnsupportedOperationException.class, () -> a.getDatas().add(RespArray.empty()));
    }

    @Test
    void roundTrip() throws RespProtocolException {
        List<RespData> values = Arrays.asList(
                RespSimpleString.withUTF8("PONG"),
                RespError.withUTF8("Invalid command"),
                RespBulkString.withUTF8("多字节 value"),
                RespArray.with(RespBulkString.withUTF8("MGET"), RespArray.with(RespSimpleString.withUTF8("")), RespArray.empty()));

        RespDecoder decoder = RespDecoder.create();
        for (RespData v : values) {
            byte[] bytes = v.toBytes();
            RespDecoder.Decoded d = decoder.decode(bytes).get();
            assertEquals(v, d.getData());
            assertEquals(bytes.length, d.getLength());
        }
    }
}
