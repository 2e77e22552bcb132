package com.deepknow.abis.interview.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.ServletContextInitializer;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.annotation.Configuration;

import javax.servlet.ServletContext;
import javax.websocket.DeploymentException;
import javax.websocket.server.ServerContainer;

/**
 * 把 {@link InterviewStreamWebSocketHandler} 注册到 Servlet 容器的 javax.websocket 容器上，
 * 并保留应用上下文，供容器创建的端点实例在注入器生效前按类型取 Bean。
 */
@Configuration
public class InterviewStreamEndpointConfig implements ServletContextInitializer, ApplicationContextAware {
    private static final Logger log = LoggerFactory.getLogger(InterviewStreamEndpointConfig.class);

    private static volatile ApplicationContext context;

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) {
        context = applicationContext;
    }

    static <T> T lookup(Class<T> type) {
        ApplicationContext ctx = context;
        return ctx == null ? null : ctx.getBean(type);
    }

    @Override
    public void onStartup(ServletContext servletContext) {
        Object attr = servletContext.getAttribute(ServerContainer.class.getName());
        if (!(attr instanceof ServerContainer)) {
            log.warn("No javax.websocket ServerContainer, interview stream endpoint not registered");
            return;
        }
        try {
            ((ServerContainer) attr).addEndpoint(InterviewStreamWebSocketHandler.class);
            log.info("Interview stream endpoint registered: /interview/stream");
        } catch (DeploymentException e) {
            // 端点注册失败不阻断启动，RPC 与批量评估仍可用
            log.error("Register interview stream endpoint failed: {}", e.getMessage(), e);
        }
    }
}
