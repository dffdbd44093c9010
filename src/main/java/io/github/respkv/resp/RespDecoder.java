package io.github.respkv.resp;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * RESP协议解码器，使用{@link ByteBuf}作为输入。
 * <p>
 * 解码从读位置开始，只按绝对索引查看数据，不改变buf。数据不完整时返回{@link Optional#empty()}，
 * 调用方向同一个buf追加数据后重试，解码器从上次停下的位置继续，已经解析完的元素不会重新解析；
 * 数据格式错误时抛出{@link RespProtocolException}。
 * 解码成功时返回值和它占用的字节数，调用方据此跳过已解析的部分，剩余数据留给下一次解码。
 * <p>
 * 解码器保存未完成的解码状态，不是线程安全的，每个连接使用自己的实例。
 * 传入另一个buf或读位置发生变化时，解码从头开始。
 */
public class RespDecoder {
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_DEPTH       = 128;
    // 简单字符串、错误和长度行的最大字节数，不含\r\n
    static final int MAX_LINE_LENGTH = 64 * 1024;

    private enum Type {
        SIMPLE_STRING,
        ERROR,
        BULK_STRING,
        ARRAY;

        static Type of(byte c) throws UnknownRespTypeException {
            switch ((char) c) {
                case RespSimpleString.firstChar:
                    return SIMPLE_STRING;
                case RespError.firstChar:
                    return ERROR;
                case RespBulkString.firstChar:
                    return BULK_STRING;
                case RespArray.firstChar:
                    return ARRAY;
                default:
                    throw new UnknownRespTypeException(c);
            }
        }
    }

    private enum State {
        DECODE_TYPE,
        DECODE_INLINE, // SIMPLE_STRING, ERROR
        DECODE_LENGTH, // BULK_STRING, ARRAY_HEADER
        DECODE_BULK_STRING_CONTENT,
    }

    private static class ArrayAggregator {
        private final int            len;
        private final List<RespData> children;

        ArrayAggregator(int len) {
            this.len = len;
            this.children = new ArrayList<>(Math.min(len, 16));
        }

        void addData(RespData child) {
            Preconditions.checkState(children.size() < len);
            children.add(child);
        }

        boolean isFinished() {
            return children.size() == len;
        }

        RespArray getArray() {
            Preconditions.checkState(isFinished());
            return RespArray.with(children);
        }
    }

    /**
     * 一次成功解码的结果。
     */
    @Value
    public static class Decoded {
        RespData data;
        // 从读位置开始，该值占用的字节数
        int      length;
    }

    private final Deque<ArrayAggregator> aggregators = new ArrayDeque<>();
    private       ByteBuf                byteBuf;
    private       State                  state       = State.DECODE_TYPE;
    private       Type                   type;
    // 当前值开始解码时buf的读位置
    private       int                    start;
    // 下一个待解析字节的绝对索引
    private       int                    index;
    // 当前行中已经检查过的位置，之前没有\r\n
    private       int                    scanned;
    private       int                    bulkLength;

    public static RespDecoder create() {
        return new RespDecoder();
    }

    /**
     * 从buf的读位置解码一个完整的值。
     * @param buf 数据
     * @return 解码结果，数据不完整时为空
     * @throws RespProtocolException 数据格式错误
     */
    public Optional<Decoded> decode(ByteBuf buf) throws RespProtocolException {
        Preconditions.checkNotNull(buf);
        if (buf != byteBuf || buf.getReaderIndex() != start || buf.getWriterIndex() < index) {
            reset(buf);
        }
        try {
            RespData data = decode0();
            if (data == null) {
                return Optional.empty();
            }
            Decoded decoded = new Decoded(data, index - start);
            reset(null);
            return Optional.of(decoded);
        } catch (RespProtocolException e) {
            reset(null);
            throw e;
        }
    }

    /**
     * 解码一段完整的字节，多余的字节被忽略。
     * @param bytes 数据
     * @return 解码结果，数据不完整时为空
     * @throws RespProtocolException 数据格式错误
     */
    public Optional<Decoded> decode(byte[] bytes) throws RespProtocolException {
        return decode(ByteBuf.allocate(Math.max(bytes.length, 1)).writeBytes(bytes));
    }

    private void reset(ByteBuf buf) {
        byteBuf = buf;
        state = State.DECODE_TYPE;
        type = null;
        aggregators.clear();
        start = buf == null ? 0 : buf.getReaderIndex();
        index = start;
        scanned = start;
        bulkLength = 0;
    }

    /**
     * @return 解码完成的顶层值，数据不完整时返回null
     */
    private RespData decode0() throws RespProtocolException {
        for (; ; ) {
            switch (state) {
                case DECODE_TYPE:
                    if (index >= byteBuf.getWriterIndex()) {
                        return null;
                    }
                    type = Type.of(byteBuf.getByte(index));
                    index++;
                    scanned = index;
                    state = type == Type.BULK_STRING || type == Type.ARRAY ? State.DECODE_LENGTH : State.DECODE_INLINE;
                    break;
                case DECODE_INLINE: {
                    int cr = findLineEnd();
                    if (cr == -1) {
                        return null;
                    }
                    String s = utf8(index, cr - index);
                    index = cr + 2;
                    RespData done = addData(type == Type.SIMPLE_STRING ? RespSimpleString.withUTF8(s) : RespError.withUTF8(s));
                    if (done != null) {
                        return done;
                    }
                    break;
                }
                case DECODE_LENGTH: {
                    int cr = findLineEnd();
                    if (cr == -1) {
                        return null;
                    }
                    if (type == Type.ARRAY && aggregators.size() >= MAX_DEPTH) {
                        throw new RespProtocolException("array nested deeper than " + MAX_DEPTH);
                    }
                    long len = parseLength(index, cr);
                    index = cr + 2;
                    if (type == Type.BULK_STRING) {
                        if (len > MAX_BULK_LENGTH) {
                            throw new RespProtocolException("bulk string length " + len + " exceeds " + MAX_BULK_LENGTH);
                        }
                        bulkLength = (int) len;
                        state = State.DECODE_BULK_STRING_CONTENT;
                        break;
                    }
                    if (len > Integer.MAX_VALUE) {
                        throw new RespProtocolException("array length " + len + " is too large");
                    }
                    if (len == 0) {
                        RespData done = addData(RespArray.empty());
                        if (done != null) {
                            return done;
                        }
                        break;
                    }
                    aggregators.push(new ArrayAggregator((int) len));
                    state = State.DECODE_TYPE;
                    break;
                }
                case DECODE_BULK_STRING_CONTENT: {
                    if (byteBuf.getWriterIndex() - index < bulkLength + 2L) {
                        return null;
                    }
                    int end = index + bulkLength;
                    if (byteBuf.getByte(end) != '\r' || byteBuf.getByte(end + 1) != '\n') {
                        throw new RespProtocolException("bulk string is not terminated by \\r\\n");
                    }
                    RespBulkString bulkString = RespBulkString.withUTF8(utf8(index, bulkLength));
                    index = end + 2;
                    RespData done = addData(bulkString);
                    if (done != null) {
                        return done;
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("unhandled decode state " + state);
            }
        }
    }

    /**
     * 把一个完整的值交给外层数组，外层数组随之完成时继续向上。
     * @return 完整的顶层值，还有数组没有完成时返回null
     */
    private RespData addData(RespData data) {
        state = State.DECODE_TYPE;
        RespData current = data;
        while (!aggregators.isEmpty()) {
            ArrayAggregator aggregator = aggregators.peek();
            aggregator.addData(current);
            if (!aggregator.isFinished()) {
                return null;
            }
            aggregators.pop();
            current = aggregator.getArray();
        }
        return current;
    }

    /**
     * 从上次检查到的位置继续查找行尾。\r必须紧跟\n，单独出现的\n也是错误，
     * 长度行只能包含数字和开头的负号。
     * @return \r的索引，数据不完整时返回-1
     */
    private int findLineEnd() throws RespProtocolException {
        int writerIndex = byteBuf.getWriterIndex();
        for (int i = scanned; i < writerIndex; i++) {
            byte b = byteBuf.getByte(i);
            if (b == '\r') {
                if (i + 1 == writerIndex) {
                    scanned = i;
                    return -1;
                }
                if (byteBuf.getByte(i + 1) != '\n') {
                    throw new RespProtocolException("\\r is not followed by \\n");
                }
                checkLineLength(i - index);
                return i;
            }
            if (b == '\n') {
                throw new RespProtocolException("line feed without carriage return");
            }
            if (state == State.DECODE_LENGTH && !((b >= '0' && b <= '9') || (b == '-' && i == index))) {
                throw new RespProtocolException("invalid character in length: " + (char) b);
            }
        }
        scanned = writerIndex;
        checkLineLength(writerIndex - index);
        return -1;
    }

    private void checkLineLength(int length) throws RespProtocolException {
        if (length > MAX_LINE_LENGTH) {
            throw new RespProtocolException("line longer than " + MAX_LINE_LENGTH + " bytes");
        }
    }

    private long parseLength(int from, int to) throws RespProtocolException {
        String s = utf8(from, to - from);
        long len;
        try {
            len = Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("invalid length: " + s, e);
        }
        if (len < 0) {
            throw new RespProtocolException("negative length: " + len);
        }
        return len;
    }

    private String utf8(int from, int length) throws RespProtocolException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(byteBuf.getBytes(from, length)))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RespProtocolException("content is not valid utf-8", e);
        }
    }
}
