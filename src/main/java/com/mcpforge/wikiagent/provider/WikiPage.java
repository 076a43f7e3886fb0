package com.mcpforge.wikiagent.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已解析的词条页：由 {@link EncyclopediaProvider#resolvePage} 返回，再交给 getSummary 取导言摘要。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WikiPage {

    private long pageId;
    /** 规范化（及重定向）后的词条名 */
    private String title;
    /** 内容语言，如 en、de */
    private String language;
    private String url;
}
