package com.mcpforge.wikiagent.exception;

import java.io.IOException;

/**
 * 读取 /lookup 请求体时发生 I/O 错误（例如客户端中途断开）。
 */
public class TopicReadException extends RuntimeException {

    public TopicReadException(IOException cause) {
        super("cannot read body", cause);
    }
}
