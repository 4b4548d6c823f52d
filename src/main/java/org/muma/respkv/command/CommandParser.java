package org.muma.respkv.command;

import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 把解码出的 RedisMessage 转成 {@link RedisCommand}。
 * 所有校验 (类型、参数个数) 都在这里完成。
 */
public class CommandParser {

    @FunctionalInterface
    private interface ArgumentParser {
        RedisCommand parse(RedisMessage[] args);
    }

    private final Map<String, ArgumentParser> commandMap = new HashMap<>();

    public CommandParser() {
        commandMap.put("PING", args -> new PingCommand());
        commandMap.put("GET", CommandParser::parseGet);
        commandMap.put("SET", CommandParser::parseSet);
    }

    public Set<String> commandNames() {
        return commandMap.keySet();
    }

    public RedisCommand parse(RedisMessage frame) {
        if (!(frame instanceof RedisArray array) || array.elements() == null || array.elements().length == 0) {
            throw new CommandParseException("expected array frame for command");
        }

        RedisMessage[] elements = array.elements();
        if (!(elements[0] instanceof BulkString cmdNameBulk) || cmdNameBulk.isNull()) {
            throw new CommandParseException("first array element must be bulk string command name");
        }

        String commandName = toAsciiUpperCase(cmdNameBulk.asString());
        ArgumentParser parser = commandMap.get(commandName);
        if (parser == null) {
            // 命令名来自客户端，CR/LF 替换成空格，保证错误响应仍是单行
            throw new CommandParseException("unknown command '" + commandName.replace('\r', ' ').replace('\n', ' ') + "'");
        }
        return parser.parse(Arrays.copyOfRange(elements, 1, elements.length));
    }

    // 只转换 a-z，其他字符 (包括非 ASCII) 原样保留
    static String toAsciiUpperCase(String s) {
        char[] chars = s.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            if (chars[i] >= 'a' && chars[i] <= 'z') {
                chars[i] = (char) (chars[i] - ('a' - 'A'));
            }
        }
        return new String(chars);
    }

    // GET key (多余参数忽略)
    private static RedisCommand parseGet(RedisMessage[] args) {
        if (args.length < 1) {
            throw wrongArity("GET");
        }
        String key = requireBulk(args[0], "invalid key type for 'GET' (expected bulk string)");
        return new GetCommand(key);
    }

    // SET key value (多余参数忽略)
    private static RedisCommand parseSet(RedisMessage[] args) {
        if (args.length < 2) {
            throw wrongArity("SET");
        }
        String key = requireBulk(args[0], "invalid key type for 'SET' (expected bulk string)");
        String value = requireBulk(args[1], "invalid value type for 'SET' (expected bulk string)");
        return new SetCommand(key, value);
    }

    private static String requireBulk(RedisMessage arg, String error) {
        if (arg instanceof BulkString bulk && !bulk.isNull()) {
            return bulk.asString();
        }
        throw new CommandParseException(error);
    }

    private static CommandParseException wrongArity(String cmd) {
        return new CommandParseException("wrong number of arguments for '" + cmd + "'");
    }
}
