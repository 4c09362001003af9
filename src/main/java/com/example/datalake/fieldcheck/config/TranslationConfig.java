package com.example.datalake.fieldcheck.config;

import com.example.datalake.fieldcheck.validation.MessageTranslator;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TranslationConfig {

    /**
     * Looks validator messages up in the application {@link MessageSource}, using the message text
     * itself as the code. Untranslated messages come back unchanged.
     */
    @Bean
    public MessageTranslator messageTranslator(MessageSource messageSource) {
        return new MessageSourceTranslator(messageSource);
    }
}
