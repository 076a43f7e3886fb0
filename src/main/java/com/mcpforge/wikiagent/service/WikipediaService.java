package com.mcpforge.wikiagent.service;

/**
 * 根据主题查询 Wikipedia 词条的导言摘要（第一段）。
 */
public interface WikipediaService {

    /**
     * 主题原样交给百科提供方，不做校验或裁剪；每次调用都会真实请求一次，不缓存。
     *
     * @param topic 请求体中的主题字符串，可以为空串
     * @return 词条导言摘要纯文本
     * @throws com.mcpforge.wikiagent.exception.LookupException 词条不存在、无摘要或网络失败
     */
    String fetchSummary(String topic);
}
