package com.mcpforge.wikiagent;

import com.mcpforge.wikiagent.config.CommandLineFlags;
import com.mcpforge.wikiagent.config.DotenvLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WikipediaAgentApplication {

    private static final Logger log = LoggerFactory.getLogger(WikipediaAgentApplication.class);

    public static void main(String[] args) {
        DotenvLoader.load(); // 加载 .env 到系统属性，供 application.yaml 中的 ${VAR} 使用
        try {
            SpringApplication.run(WikipediaAgentApplication.class, CommandLineFlags.translate(args));
        } catch (Exception e) {
            // 监听端口绑定失败等启动错误：直接退出进程
            log.error("Wikipedia Agent failed to start: {}", e.getMessage());
            System.exit(1);
        }
    }
}
