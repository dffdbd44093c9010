package io.github.respkv.resp;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * 会话读缓冲区。jdk自带的{@link ByteBuffer}读写共用一个position，解析协议时需要反复flip，
 * 这里读写位置是独立的，容量不足时自动扩容。
 * <p>
 * 解码器只按绝对索引查看数据，不移动读位置；会话确认一个完整的值以后调用
 * {@link #skipBytes(int)}跳过它，再用{@link #discardReadBytes()}回收已读部分。
 */
public class ByteBuf {
    // 底层字节数组
    private byte[] buf;
    // 当前读位置
    @Getter
    private int    readerIndex;
    // 当前写位置
    @Getter
    private int    writerIndex;

    private ByteBuf(int i) {
        Preconditions.checkArgument(i > 0, "capacity must be positive: %s", i);
        buf = new byte[i];
        readerIndex = 0;
        writerIndex = 0;
    }

    public static ByteBuf allocate(int i) {
        return new ByteBuf(i);
    }

    /**
     * @return 当前还可以写入的大小
     */
    public int writableBytes() {
        return buf.length - writerIndex;
    }

    /**
     * 向buf写入数据
     * @param bb 数据源，写入其全部剩余字节
     * @return 本对象
     */
    public ByteBuf writeBytes(ByteBuffer bb) {
        int n = bb.remaining();
        ensureWritable(n);
        bb.get(buf, writerIndex, n);
        writerIndex += n;
        return this;
    }

    /**
     * 向buf写入数据
     * @param bytes 数据源
     * @return 本对象
     */
    public ByteBuf writeBytes(byte[] bytes) {
        ensureWritable(bytes.length);
        System.arraycopy(bytes, 0, buf, writerIndex, bytes.length);
        writerIndex += bytes.length;
        return this;
    }

    /**
     * 是否有数据未消费，可读取
     * @return true 有，false 没有
     */
    public boolean isReadable() {
        return readerIndex < writerIndex;
    }

    /**
     * 读一个字节
     * @return 字节
     * @throws IllegalStateException 没有可读数据
     */
    public byte readByte() {
        Preconditions.checkState(readerIndex < writerIndex, "no readable bytes");
        return buf[readerIndex++];
    }

    /**
     * 查询多少数据可读
     * @return 可读取数据的大小
     */
    public int readableBytes() {
        return writerIndex - readerIndex;
    }

    /**
     * 跳过已经处理完的数据
     * @param n 跳过的字节数
     * @return 本对象
     * @throws IndexOutOfBoundsException 可读数据不足
     */
    public ByteBuf skipBytes(int n) {
        if (n < 0 || n > readableBytes()) {
            throw new IndexOutOfBoundsException("skip " + n + ", readable " + readableBytes());
        }
        readerIndex += n;
        return this;
    }

    /**
     * 丢弃已读数据，未读数据移动到数组头部。
     * @return 本对象
     */
    public ByteBuf discardReadBytes() {
        if (readerIndex == 0) {
            return this;
        }
        int readable = readableBytes();
        System.arraycopy(buf, readerIndex, buf, 0, readable);
        readerIndex = 0;
        writerIndex = readable;
        return this;
    }

    /**
     * 使用绝对索引读取字节，不改变读位置
     * @param index 索引
     * @return 字节值
     * @throws IndexOutOfBoundsException 索引不在已写入范围内
     */
    public byte getByte(int index) {
        checkIndex(index, 1);
        return buf[index];
    }

    /**
     * 使用绝对索引复制一段数据，不改变读位置
     * @param index 起始索引
     * @param length 长度
     * @return 数据副本
     */
    public byte[] getBytes(int index, int length) {
        checkIndex(index, length);
        return Arrays.copyOfRange(buf, index, index + length);
    }

    /**
     * 查找某字节值的索引
     * @param fromIndex 从该索引开始
     * @param toIndex 到该索引结束
     * @param value 查找的字节值
     * @return 该值的第一个索引值，没有找到返回-1
     */
    public int indexOf(int fromIndex, int toIndex, byte value) {
        for (int i = fromIndex; i < Math.min(toIndex, writerIndex); i++) {
            if (buf[i] == value) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 缓存最大容量
     * @return 容量
     */
    public int capacity() {
        return buf.length;
    }

    private void checkIndex(int index, int length) {
        if (index < 0 || length < 0 || index + length > writerIndex) {
            throw new IndexOutOfBoundsException("index " + index + ", length " + length + ", writerIndex " + writerIndex);
        }
    }

    private void ensureWritable(int remaining) {
        if (writableBytes() < remaining) {
            capacity(buf.length * 2 + remaining);
        }
    }

    private void capacity(int i) {
        Preconditions.checkState(i > buf.length);
        buf = Arrays.copyOf(buf, i);
    }
}
