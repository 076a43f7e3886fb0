package com.mcpforge.wikiagent.provider;

import com.mcpforge.wikiagent.exception.LookupException;

/**
 * 百科内容提供方：按标题解析词条页，再取其导言摘要。
 * 所有失败均以 {@link LookupException} 抛出。
 */
public interface EncyclopediaProvider {

    /**
     * @param title    词条标题，原样使用，不做校验
     * @param language 内容语言代码（如 "en"）
     * @throws LookupException 词条不存在、为消歧义页或网络失败
     */
    WikiPage resolvePage(String title, String language);

    /**
     * @throws LookupException 无可用摘要或网络失败
     */
    String getSummary(WikiPage page);
}
