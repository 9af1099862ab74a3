package io.uabridge.protocol.milo;

import io.uabridge.protocol.ProtocolException;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;

import java.util.concurrent.TimeoutException;

final class MiloErrors {
    private MiloErrors() {
    }

    static ProtocolException translate(String operation, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new ProtocolException(ProtocolException.Kind.TIMEOUT, operation + " timed out", cause);
        }
        if (cause instanceof UaException ua) {
            return fromStatus(operation, ua.getStatusCode(), cause);
        }
        String detail = cause == null ? "unknown error" : cause.getMessage();
        return new ProtocolException(ProtocolException.Kind.FAILURE, operation + " failed: " + detail, cause);
    }

    static ProtocolException fromStatus(String operation, StatusCode status, Throwable cause) {
        long code = status == null ? StatusCodes.Bad_UnexpectedError : status.getValue();
        ProtocolException.Kind kind;
        if (code == StatusCodes.Bad_TypeMismatch) {
            kind = ProtocolException.Kind.TYPE_MISMATCH;
        } else if (code == StatusCodes.Bad_Timeout || code == StatusCodes.Bad_RequestTimeout) {
            kind = ProtocolException.Kind.TIMEOUT;
        } else if (code == StatusCodes.Bad_SessionClosed || code == StatusCodes.Bad_ConnectionClosed
                || code == StatusCodes.Bad_SessionIdInvalid) {
            kind = ProtocolException.Kind.NOT_CONNECTED;
        } else {
            kind = ProtocolException.Kind.FAILURE;
        }
        return new ProtocolException(kind, operation + " failed: " + status, cause);
    }
}
