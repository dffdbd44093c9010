package io.github.respkv.kv;

import lombok.Getter;

public class StoreException extends CommandException {
    private static final long serialVersionUID = 8843104526785212336L;

    public enum Reason {
        KEY_NOT_FOUND,
        WRONG_TYPE
    }

    @Getter
    private final Reason reason;

    StoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
