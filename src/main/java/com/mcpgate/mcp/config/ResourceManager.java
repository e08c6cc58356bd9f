package com.mcpgate.mcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Access to the externalised message catalogue ({@code messages.properties}).
 * Messages use {@link MessageFormat} placeholders ({0}, {1}, ...).
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String BUNDLE_NAME = "messages";

    private static volatile ResourceBundle messageBundle;

    private ResourceManager() {
    }

    /**
     * Looks up a message by key and formats it with the given arguments.
     * Falls back to the key itself (plus arguments) when the key is missing, so a
     * gap in the catalogue never hides the original error.
     *
     * @param messageKey key in the catalogue
     * @param messageArgs values for the {n} placeholders
     * @return the formatted message
     */
    public static String getErrorMessage(String messageKey, Object... messageArgs) {
        String messagePattern;
        try {
            messagePattern = getBundle().getString(messageKey);
        } catch (MissingResourceException e) {
            logger.warn("Missing message key: {}", messageKey);
            if (messageArgs.length == 0) {
                return messageKey;
            }
            StringBuilder fallback = new StringBuilder(messageKey);
            for (Object messageArg : messageArgs) {
                fallback.append(' ').append(messageArg);
            }
            return fallback.toString();
        }
        if (messageArgs.length == 0) {
            return messagePattern;
        }
        return MessageFormat.format(messagePattern, messageArgs);
    }

    private static ResourceBundle getBundle() {
        ResourceBundle bundle = messageBundle;
        if (bundle == null) {
            bundle = ResourceBundle.getBundle(BUNDLE_NAME);
            messageBundle = bundle;
        }
        return bundle;
    }
}
