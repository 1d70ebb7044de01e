// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.analysis.QcFlagSynthesizer;
import de.mossgrabers.mixchecker.core.AbstractCoreTask;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.ISourceFormat;
import de.mossgrabers.mixchecker.core.ProjectAnalysis;
import de.mossgrabers.mixchecker.format.ableton.model.AbletonProject;
import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackAnalysis;
import de.mossgrabers.mixchecker.plugin.PluginStateInspector;
import de.mossgrabers.mixchecker.utils.StreamHelper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;


/**
 * Loads an Ableton Live set (gzip compressed or plain XML) and creates the track model with the
 * initial quality checks.
 *
 * @author Jürgen Moßgraber
 */
public class AbletonSourceFormat extends AbstractCoreTask implements ISourceFormat
{
    private static final String [] FILE_ENDINGS =
    {
        "als",
        "xml"
    };


    /**
     * Constructor.
     *
     * @param notifier The notifier
     */
    public AbletonSourceFormat (final INotifier notifier)
    {
        super ("Ableton Live", notifier);
    }


    /** {@inheritDoc} */
    @Override
    public String [] getFileEndings ()
    {
        return FILE_ENDINGS.clone ();
    }


    /** {@inheritDoc} */
    @Override
    public ProjectAnalysis read (final File sourceFile, final AnalysisSettings settings) throws IOException, ParseException
    {
        final Node documentRoot;
        try (final InputStream in = StreamHelper.openDecompressed (sourceFile))
        {
            documentRoot = AbletonProject.parse (in);
        }
        final Node root = AbletonProject.findLiveSetRoot (documentRoot);

        final TrackBuilder trackBuilder = new TrackBuilder (new DeviceBuilder (settings, new PluginStateInspector (this.notifier)));
        final List<Track> tracks = trackBuilder.buildTracks (root);
        this.notifier.log ("IDS_NOTIFY_FOUND_TRACKS", Integer.toString (tracks.size ()));

        final List<TrackAnalysis> analyses = new ArrayList<> (tracks.size ());
        for (final Track track: tracks)
            analyses.add (new TrackAnalysis (track, QcFlagSynthesizer.synthesize (track), null));
        return new ProjectAnalysis (sourceFile, root.getName (), analyses);
    }
}
