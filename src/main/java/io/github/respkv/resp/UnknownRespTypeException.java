package io.github.respkv.resp;

public class UnknownRespTypeException extends RespProtocolException {
    private static final long serialVersionUID = -4921385079324153096L;

    UnknownRespTypeException(byte type) {
        super("unknown resp type: 0x" + Integer.toHexString(type & 0xff));
    }
}
