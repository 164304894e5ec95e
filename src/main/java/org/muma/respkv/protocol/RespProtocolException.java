package org.muma.respkv.protocol;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * The inbound byte stream is not valid RESP framing. The connection cannot resynchronize
 * after this, so the caller closes it without replying.
 */
public class RespProtocolException extends CorruptedFrameException {

    public RespProtocolException(String message) {
        super("Protocol error: " + message);
    }
}
