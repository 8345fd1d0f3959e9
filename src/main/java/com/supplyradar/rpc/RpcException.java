package com.supplyradar.rpc;

/**
 * Thrown when one physical RPC attempt fails (connection, timeout, HTTP status, unreadable body).
 * Never escapes {@link RpcTransport}; the transport turns it into {@link RpcOutcome#unavailable(String)}.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
