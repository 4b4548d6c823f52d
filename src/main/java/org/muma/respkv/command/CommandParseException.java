package org.muma.respkv.command;

/**
 * 帧可以解码，但不是一个合法的命令 (未知命令、参数个数或类型不对)。
 * 由 {@link CommandDispatcher} 转成 "-ERR ..." 响应，连接不受影响。
 */
public class CommandParseException extends IllegalArgumentException {

    public CommandParseException(String message) {
        super(message);
    }
}
