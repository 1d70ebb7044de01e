// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.analysis.DeactivationPropagator;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.ProjectAnalysis;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.text.ParseException;


/**
 * Access to the test projects.
 *
 * @author Jürgen Moßgraber
 */
public class TestProjects
{
    /**
     * Private due to helper class.
     */
    private TestProjects ()
    {
        // Intentionally empty
    }


    /**
     * Get the drum group project. It contains a deactivated kick in a drum group, a track which
     * resamples the kick, a return track without sends, a plug-in with a Serum state and a master
     * track without an ID.
     *
     * @return The file
     */
    public static File getDrumGroup ()
    {
        try
        {
            return Path.of (TestProjects.class.getResource ("DrumGroup.xml").toURI ()).toFile ();
        }
        catch (final URISyntaxException ex)
        {
            throw new IllegalStateException (ex);
        }
    }


    /**
     * Read and analyse the drum group project.
     *
     * @param settings The settings
     * @param notifier The notifier
     * @return The analysis including the routing impact
     * @throws IOException Could not read the file
     * @throws ParseException Could not parse the file
     */
    public static ProjectAnalysis analyseDrumGroup (final AnalysisSettings settings, final INotifier notifier) throws IOException, ParseException
    {
        final ProjectAnalysis analysis = new AbletonSourceFormat (notifier).read (getDrumGroup (), settings);
        return analysis.withTracks (DeactivationPropagator.repropagate (analysis.getTracks ()));
    }
}
