package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public class RespArray implements RespData {
    static final char           firstChar = '*';
    private final List<RespData> datas;

    public static RespArray empty() {
        return new RespArray(Collections.emptyList());
    }

    public static RespArray with(@NonNull List<? extends RespData> datas) {
        return new RespArray(Collections.unmodifiableList(new ArrayList<>(datas)));
    }

    public static RespArray with(RespData... datas) {
        return with(Arrays.asList(datas));
    }

    private RespArray(List<RespData> datas) {
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public <T extends RespData> T get(int i) {
        return (T) datas.get(i);
    }

    public List<RespData> getDatas() {
        return datas;
    }

    @Override
    public byte[] toBytes() {
        byte[][] parts = new byte[datas.size() + 1][];
        parts[0] = (firstChar + String.valueOf(datas.size()) + "\r\n").getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < datas.size(); i++) {
            parts[i + 1] = datas.get(i).toBytes();
        }
        return Bytes.concat(parts);
    }
}
