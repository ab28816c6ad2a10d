package com.ai.salescaller.config;

import com.ai.salescaller.conversation.ConversationScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The call script is built and validated once at startup; every call shares the same instance.
 */
@Configuration
public class ScriptConfig {

    private static final Logger log = LoggerFactory.getLogger(ScriptConfig.class);

    @Bean
    public ConversationScript conversationScript(CallerProperties properties) {
        ConversationScript script = ConversationScript.standard(properties.getBotName());
        log.info("Conversation script loaded (bot={}, dealership={})", properties.getBotName(), properties.getDealershipName());
        return script;
    }
}
