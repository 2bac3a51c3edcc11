package org.cbj.peerlink.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

@Getter
public class PeerLinkException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public PeerLinkException(ErrorCode code) {
        this(code, code.getDefaultMessage(), Map.of(), null);
    }

    public PeerLinkException(ErrorCode code, Map<String, ?> details) {
        this(code, code.getDefaultMessage(), details, null);
    }

    public PeerLinkException(ErrorCode code, Map<String, ?> details, Throwable cause) {
        this(code, code.getDefaultMessage(), details, cause);
    }

    public PeerLinkException(ErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean is(ErrorCode expected) {
        return code == expected;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers added by
     * {@code CompletableFuture} and returns the first {@link PeerLinkException} found in the chain,
     * or {@code null} if there is none.
     */
    public static PeerLinkException unwrap(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof PeerLinkException) {
                return (PeerLinkException) current;
            }
            if (!(current instanceof CompletionException) && !(current instanceof ExecutionException)) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    public static Throwable stripCompletion(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        return "PeerLinkException{code=" + code + ", message='" + getMessage() + "', details=" + details + '}';
    }
}
