// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

/**
 * The mix checker module.
 *
 * @author Jürgen Moßgraber
 */
module de.mossgrabers.mixchecker
{
    requires transitive java.xml;
    requires transitive com.fasterxml.jackson.databind;
    requires org.slf4j;


    exports de.mossgrabers.mixchecker;
    exports de.mossgrabers.mixchecker.analysis;
    exports de.mossgrabers.mixchecker.core;
    exports de.mossgrabers.mixchecker.format;
    exports de.mossgrabers.mixchecker.format.ableton;
    exports de.mossgrabers.mixchecker.format.ableton.model;
    exports de.mossgrabers.mixchecker.format.json;
    exports de.mossgrabers.mixchecker.model;
    exports de.mossgrabers.mixchecker.plugin;
    exports de.mossgrabers.mixchecker.report;
    exports de.mossgrabers.mixchecker.utils;
}
