// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.core;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;


/**
 * The interface to a project source.
 *
 * @author Jürgen Moßgraber
 */
public interface ISourceFormat extends ICoreTask
{
    /**
     * Read the source project and build the track model with the initial quality checks.
     *
     * @param sourceFile The source project to load
     * @param settings The analysis settings
     * @return The read and parsed project
     * @throws IOException Could not read the file
     * @throws ParseException Could not parse the project file
     */
    ProjectAnalysis read (File sourceFile, AnalysisSettings settings) throws IOException, ParseException;


    /**
     * Get the file endings which are supported by the format, e.g. "als".
     *
     * @return The file endings without the dot
     */
    String [] getFileEndings ();
}
