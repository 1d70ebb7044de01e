// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker;

import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.AnalysisTask;
import de.mossgrabers.mixchecker.core.IDestinationFormat;
import de.mossgrabers.mixchecker.format.ableton.AbletonSourceFormat;
import de.mossgrabers.mixchecker.format.json.CompactReportFormat;
import de.mossgrabers.mixchecker.format.json.FullReportFormat;

import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;


/**
 * The main class for checking an Ableton Live set from the command line. Writes the full and the
 * compact report and logs a summary of the problems.
 *
 * @author Jürgen Moßgraber
 */
public final class MixChecker
{
    /** The input file does not exist or the arguments are wrong. */
    public static final int EXIT_USAGE  = 2;
    /** The project could not be loaded or the reports could not be written. */
    public static final int EXIT_FAILED = 1;
    /** Everything went fine. */
    public static final int EXIT_OK     = 0;


    /**
     * Constructor.
     */
    private MixChecker ()
    {
        // Intentionally empty
    }


    /**
     * The main function.
     *
     * @param args The project file followed by the options
     */
    public static void main (final String [] args)
    {
        System.exit (run (args, new LogNotifier ()));
    }


    /**
     * Parses the arguments and runs the analysis.
     *
     * @param args The project file followed by the options
     * @param notifier Where to log to
     * @return The exit code
     */
    public static int run (final String [] args, final INotifier notifier)
    {
        final AnalysisSettings settings;
        try
        {
            settings = AnalysisSettings.loadDefaults ();
        }
        catch (final IOException ex)
        {
            notifier.logError ("IDS_NOTIFY_COULD_NOT_LOAD_SETTINGS", ex);
            return EXIT_FAILED;
        }

        String input = null;
        String outDir = null;
        String baseName = null;
        for (int i = 0; i < args.length; i++)
        {
            final String arg = args[i];
            switch (arg)
            {
                case "--out-dir":
                    outDir = getValue (args, ++i);
                    if (outDir == null)
                        return reportInvalidArgument (notifier, arg, "");
                    break;
                case "--base-name":
                    baseName = getValue (args, ++i);
                    if (baseName == null)
                        return reportInvalidArgument (notifier, arg, "");
                    break;
                case "--max-params-per-device":
                    final String maxParams = getValue (args, ++i);
                    try
                    {
                        settings.setMaxParamsPerDevice (Integer.parseInt (maxParams));
                    }
                    catch (final NumberFormatException ex)
                    {
                        return reportInvalidArgument (notifier, arg, String.valueOf (maxParams));
                    }
                    break;
                case "--mix-settings":
                    settings.setMixSettings (true);
                    break;
                case "--no-full-dedupe":
                    settings.setFullDedupe (false);
                    break;
                case "--keep-null-keys":
                    settings.setStripNullKeys (false);
                    break;
                case "--minify":
                    settings.setMinify (true);
                    break;
                default:
                    if (arg.startsWith ("--") || input != null)
                        return reportInvalidArgument (notifier, arg, "");
                    input = arg;
                    break;
            }
        }

        if (input == null)
        {
            notifier.logError ("IDS_NOTIFY_USAGE");
            return EXIT_USAGE;
        }

        final File inputFile = new File (input).getAbsoluteFile ();
        if (!inputFile.exists ())
        {
            notifier.logError ("IDS_NOTIFY_INPUT_NOT_FOUND", inputFile.getPath ());
            return EXIT_USAGE;
        }

        final File outputPath = outDir == null ? inputFile.getParentFile () : new File (outDir);
        if (baseName == null)
            baseName = getNameWithoutType (inputFile);

        final List<IDestinationFormat> reports = List.of (new FullReportFormat (notifier), new CompactReportFormat (notifier));
        final AnalysisTask task = new AnalysisTask (inputFile, outputPath, baseName, new AbletonSourceFormat (notifier), reports, settings, notifier, LocalDateTime.now ());
        return task.call ().isPresent () ? EXIT_OK : EXIT_FAILED;
    }


    /**
     * Get the name of a file without the ending.
     *
     * @param file The file
     * @return The name, e.g. "MySong" for "MySong.als"
     */
    static String getNameWithoutType (final File file)
    {
        final String fileName = file.getName ();
        final int pos = fileName.lastIndexOf ('.');
        return pos > 0 ? fileName.substring (0, pos) : fileName;
    }


    private static int reportInvalidArgument (final INotifier notifier, final String argument, final String value)
    {
        notifier.logError ("IDS_NOTIFY_INVALID_ARGUMENT", argument, value);
        notifier.logError ("IDS_NOTIFY_USAGE");
        return EXIT_USAGE;
    }


    private static String getValue (final String [] args, final int index)
    {
        return index < args.length ? args[index] : null;
    }
}
