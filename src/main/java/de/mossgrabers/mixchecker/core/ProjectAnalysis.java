// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.core;

import de.mossgrabers.mixchecker.model.TrackAnalysis;

import java.io.File;
import java.util.Collections;
import java.util.List;


/**
 * The result of analysing one project: the tracks with their quality checks.
 *
 * @author Jürgen Moßgraber
 */
public class ProjectAnalysis
{
    private final File                sourceFile;
    private final String              rootTag;
    private final List<TrackAnalysis> tracks;


    /**
     * Constructor.
     *
     * @param sourceFile The analysed project file
     * @param rootTag The tag of the root element of the project document
     * @param tracks The analysed tracks in document order
     */
    public ProjectAnalysis (final File sourceFile, final String rootTag, final List<TrackAnalysis> tracks)
    {
        this.sourceFile = sourceFile;
        this.rootTag = rootTag;
        this.tracks = Collections.unmodifiableList (tracks);
    }


    /**
     * Create a copy of this analysis with other track results.
     *
     * @param newTracks The new track results
     * @return The new analysis
     */
    public ProjectAnalysis withTracks (final List<TrackAnalysis> newTracks)
    {
        return new ProjectAnalysis (this.sourceFile, this.rootTag, newTracks);
    }


    /**
     * Get the analysed project file.
     *
     * @return The file
     */
    public File getSourceFile ()
    {
        return this.sourceFile;
    }


    /**
     * Get the tag of the root element, e.g. "LiveSet".
     *
     * @return The tag
     */
    public String getRootTag ()
    {
        return this.rootTag;
    }


    /**
     * Get the analysed tracks.
     *
     * @return The tracks in document order
     */
    public List<TrackAnalysis> getTracks ()
    {
        return this.tracks;
    }
}
