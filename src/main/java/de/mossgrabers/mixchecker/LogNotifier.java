// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.MissingResourceException;
import java.util.ResourceBundle;


/**
 * Resolves the message IDs from the string resources and forwards the texts to the logger.
 *
 * @author Jürgen Moßgraber
 */
public class LogNotifier implements INotifier
{
    private static final String  BUNDLE_NAME = "de.mossgrabers.mixchecker.Strings";

    private final Logger         logger;
    private final ResourceBundle strings;


    /**
     * Constructor.
     */
    public LogNotifier ()
    {
        this (LoggerFactory.getLogger (MixChecker.class));
    }


    /**
     * Constructor.
     *
     * @param logger The logger to forward to
     */
    public LogNotifier (final Logger logger)
    {
        this.logger = logger;
        this.strings = ResourceBundle.getBundle (BUNDLE_NAME);
    }


    /** {@inheritDoc} */
    @Override
    public void log (final String messageID, final String... replaceStrings)
    {
        this.logger.info (this.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final String... replaceStrings)
    {
        this.logger.error (this.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final Throwable throwable)
    {
        this.logger.error (this.getMessage (messageID, getText (throwable)), throwable);
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final Throwable throwable)
    {
        this.logger.error (getText (throwable), throwable);
    }


    /**
     * Get the text for a message ID. The place holders %1..%n are replaced with the given
     * strings.
     *
     * @param messageID The ID of the message
     * @param replaceStrings The replacements
     * @return The text, the ID itself if there is no text for it
     */
    public String getMessage (final String messageID, final String... replaceStrings)
    {
        String message;
        try
        {
            message = this.strings.getString (messageID);
        }
        catch (final MissingResourceException ex)
        {
            this.logger.debug ("No text for message ID {}", messageID, ex);
            message = messageID;
        }

        // Replace from the highest index down, %1 is a prefix of %10
        for (int i = replaceStrings.length; i >= 1; i--)
            message = message.replace ("%" + i, replaceStrings[i - 1] == null ? "" : replaceStrings[i - 1]);
        return message;
    }


    private static String getText (final Throwable throwable)
    {
        final String message = throwable.getMessage ();
        return message == null ? throwable.getClass ().getName () : message;
    }
}
