package org.muma.respkv.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * 帧格式非法 (未知类型字节、长度不是整数、缺少 CRLF 等)。
 * 属于连接级错误：没有重新同步机制，连接会被关闭。
 */
public class RespProtocolException extends DecoderException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
