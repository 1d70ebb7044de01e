// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.core;

import java.io.File;
import java.io.IOException;


/**
 * The interface to a report destination.
 *
 * @author Jürgen Moßgraber
 */
public interface IDestinationFormat extends ICoreTask
{
    /**
     * Write the report file.
     *
     * @param analysis The analysis to store
     * @param settings The analysis settings
     * @param outputFile The file to write
     * @throws IOException Could not write the file
     */
    void write (ProjectAnalysis analysis, AnalysisSettings settings, File outputFile) throws IOException;


    /**
     * Get the ending of the files written by this format, e.g. "full.json".
     *
     * @return The file ending without the leading dot
     */
    String getFileEnding ();
}
