package com.example.datalake.fieldcheck.config;

import com.example.datalake.fieldcheck.validation.MessageTranslator;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;

import java.util.Objects;

/** {@link MessageTranslator} backed by a Spring {@link MessageSource} and the current locale. */
public class MessageSourceTranslator implements MessageTranslator {

    private final MessageSource messageSource;

    public MessageSourceTranslator(MessageSource messageSource) {
        this.messageSource = Objects.requireNonNull(messageSource, "messageSource");
    }

    @Override
    public String translate(String message) {
        if (message == null || message.isBlank()) {
            return message;
        }
        return messageSource.getMessage(message, null, message, LocaleContextHolder.getLocale());
    }
}
