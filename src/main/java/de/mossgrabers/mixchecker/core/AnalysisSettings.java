// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;


/**
 * The options of one analysis run. The defaults are read from the bundled
 * mixchecker.properties, command line options override them.
 *
 * @author Jürgen Moßgraber
 */
public class AnalysisSettings
{
    private static final String DEFAULTS_RESOURCE          = "/de/mossgrabers/mixchecker/mixchecker.properties";

    private static final String KEY_MAX_PARAMS_PER_DEVICE  = "maxParamsPerDevice";
    private static final String KEY_MIX_SETTINGS           = "mixSettings";
    private static final String KEY_FULL_DEDUPE            = "fullDedupe";
    private static final String KEY_STRIP_NULL_KEYS        = "stripNullKeys";
    private static final String KEY_MINIFY                 = "minify";

    /** The default for the maximum number of parameters captured per device. */
    public static final int     DEFAULT_MAX_PARAMS         = 120;

    private int                 maxParamsPerDevice         = DEFAULT_MAX_PARAMS;
    private boolean             mixSettings                = false;
    private boolean             fullDedupe                 = true;
    private boolean             stripNullKeys              = true;
    private boolean             minify                     = false;


    /**
     * Create settings from the bundled defaults.
     *
     * @return The settings
     * @throws IOException Could not read the defaults
     */
    public static AnalysisSettings loadDefaults () throws IOException
    {
        final Properties properties = new Properties ();
        try (final InputStream in = AnalysisSettings.class.getResourceAsStream (DEFAULTS_RESOURCE))
        {
            if (in != null)
                properties.load (in);
        }
        return fromProperties (properties);
    }


    /**
     * Create settings from properties. Missing keys keep their built-in default.
     *
     * @param properties The properties
     * @return The settings
     */
    public static AnalysisSettings fromProperties (final Properties properties)
    {
        final AnalysisSettings settings = new AnalysisSettings ();
        final String maxParams = properties.getProperty (KEY_MAX_PARAMS_PER_DEVICE);
        if (maxParams != null)
            settings.setMaxParamsPerDevice (Integer.parseInt (maxParams.trim ()));
        settings.setMixSettings (getBoolean (properties, KEY_MIX_SETTINGS, settings.mixSettings));
        settings.setFullDedupe (getBoolean (properties, KEY_FULL_DEDUPE, settings.fullDedupe));
        settings.setStripNullKeys (getBoolean (properties, KEY_STRIP_NULL_KEYS, settings.stripNullKeys));
        settings.setMinify (getBoolean (properties, KEY_MINIFY, settings.minify));
        return settings;
    }


    /**
     * Get the maximum number of parameter nodes captured per device before pruning.
     *
     * @return The maximum, 0 disables the parameter capture
     */
    public int getMaxParamsPerDevice ()
    {
        return this.maxParamsPerDevice;
    }


    /**
     * Set the maximum number of parameter nodes captured per device before pruning.
     *
     * @param maxParamsPerDevice The maximum, negative values are treated as 0
     */
    public void setMaxParamsPerDevice (final int maxParamsPerDevice)
    {
        this.maxParamsPerDevice = Math.max (0, maxParamsPerDevice);
    }


    /**
     * Should the key settings of stock devices and decoded plug-in states be included?
     *
     * @return True to include them
     */
    public boolean isMixSettings ()
    {
        return this.mixSettings;
    }


    /**
     * Set if the key settings of stock devices and decoded plug-in states should be included.
     *
     * @param mixSettings True to include them
     */
    public void setMixSettings (final boolean mixSettings)
    {
        this.mixSettings = mixSettings;
    }


    /**
     * Should repeated settings be pooled in the full report?
     *
     * @return True to pool them
     */
    public boolean isFullDedupe ()
    {
        return this.fullDedupe;
    }


    /**
     * Set if repeated settings should be pooled in the full report.
     *
     * @param fullDedupe True to pool them
     */
    public void setFullDedupe (final boolean fullDedupe)
    {
        this.fullDedupe = fullDedupe;
    }


    /**
     * Should keys with null values be removed from the full report?
     *
     * @return True to remove them
     */
    public boolean isStripNullKeys ()
    {
        return this.stripNullKeys;
    }


    /**
     * Set if keys with null values should be removed from the full report.
     *
     * @param stripNullKeys True to remove them
     */
    public void setStripNullKeys (final boolean stripNullKeys)
    {
        this.stripNullKeys = stripNullKeys;
    }


    /**
     * Should the reports be written without whitespace?
     *
     * @return True to minify
     */
    public boolean isMinify ()
    {
        return this.minify;
    }


    /**
     * Set if the reports should be written without whitespace.
     *
     * @param minify True to minify
     */
    public void setMinify (final boolean minify)
    {
        this.minify = minify;
    }


    private static boolean getBoolean (final Properties properties, final String key, final boolean defaultValue)
    {
        final String value = properties.getProperty (key);
        return value == null ? defaultValue : Boolean.parseBoolean (value.trim ());
    }
}
