// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Locale;


/**
 * The format of a device, guessed from its tag.
 *
 * @author Jürgen Moßgraber
 */
public enum DeviceFormat
{
    /** A VST3 plug-in. */
    VST3,
    /** A VST 2 plug-in. */
    VST,
    /** An Audio Unit plug-in. */
    AU,
    /** Some other plug-in. */
    PLUGIN,
    /** A stock device. */
    DEVICE;


    /**
     * Classify the format of a device by its tag.
     *
     * @param tag The tag of the device, e.g. "PluginDevice" or "AutoPan2"
     * @return The format
     */
    public static DeviceFormat classify (final String tag)
    {
        final String lowerTag = tag == null ? "" : tag.toLowerCase (Locale.ROOT);
        if (lowerTag.contains ("vst3"))
            return VST3;
        if (lowerTag.contains ("vst"))
            return VST;
        // "AutoPan" starts with "au" as well
        if (lowerTag.startsWith ("au") && lowerTag.contains ("plug"))
            return AU;
        if (lowerTag.contains ("plug"))
            return PLUGIN;
        return DEVICE;
    }


    /**
     * Is this a third party format?
     *
     * @return True if not a stock device
     */
    public boolean isThirdParty ()
    {
        return this != DEVICE;
    }


    /**
     * Get the name used in the reports.
     *
     * @return The name, e.g. "VST3" or "Plugin"
     */
    public String getLabel ()
    {
        switch (this)
        {
            case PLUGIN:
                return "Plugin";
            case DEVICE:
                return "Device";
            default:
                return this.name ();
        }
    }
}
