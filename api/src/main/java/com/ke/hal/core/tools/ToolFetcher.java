package com.ke.hal.core.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 工具搜索器
 * 负责发现和管理所有ToolHandler实现类
 */
@Component
public class ToolFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ToolFetcher.class);

    private final ApplicationContext applicationContext;
    private final Map<String, ToolHandler> toolHandlerMap = new ConcurrentHashMap<>();

    public ToolFetcher(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void initialize() {
        Map<String, ToolHandler> handlerBeans = applicationContext.getBeansOfType(ToolHandler.class);
        for (Map.Entry<String, ToolHandler> entry : handlerBeans.entrySet()) {
            ToolHandler handler = entry.getValue();
            String toolType = handler.getToolType();
            if(toolType == null || toolType.trim().isEmpty()) {
                logger.warn("工具处理器 {} 返回了空的工具类型，跳过注册", handler.getClass().getSimpleName());
                continue;
            }
            ToolHandler previous = toolHandlerMap.putIfAbsent(toolType, handler);
            if(previous != null) {
                throw new IllegalStateException("duplicate tool handler for type " + toolType + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
            logger.info("注册工具: {} -> {} (Bean: {})", toolType, handler.getClass().getSimpleName(), entry.getKey());
        }
        logger.info("工具搜索完成，共注册 {} 个工具", toolHandlerMap.size());
    }

    /**
     * 根据工具类型获取工具处理器
     *
     * @return 工具处理器，如果不存在则返回null
     */
    public ToolHandler getToolHandler(String toolType) {
        return toolHandlerMap.get(toolType);
    }
}
