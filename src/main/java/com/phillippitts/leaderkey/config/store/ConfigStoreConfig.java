package com.phillippitts.leaderkey.config.store;

import com.phillippitts.leaderkey.service.config.CancellingConflictPrompt;
import com.phillippitts.leaderkey.service.config.ConflictPrompt;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborators of the config store that an embedding UI may replace.
 */
@Configuration
public class ConfigStoreConfig {

    /**
     * Headless default: a save conflict is cancelled and reported; a client then calls
     * reload or an overwriting save. A UI registers its own {@link ConflictPrompt} bean.
     */
    @Bean
    @ConditionalOnMissingBean(ConflictPrompt.class)
    public ConflictPrompt conflictPrompt() {
        return new CancellingConflictPrompt();
    }
}
