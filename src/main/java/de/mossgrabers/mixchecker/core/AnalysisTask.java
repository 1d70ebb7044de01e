// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.core;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.analysis.DeactivationPropagator;
import de.mossgrabers.mixchecker.report.ProblemSummaryPrinter;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.text.ParseException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;


/**
 * The task to run one analysis: load the project, propagate the routing impact of deactivated
 * tracks, write the reports and log a summary.
 *
 * @author Jürgen Moßgraber
 */
public class AnalysisTask implements Callable<Optional<ProjectAnalysis>>
{
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern ("yyyy-MM-dd-HH-mm-ss");

    private final File                     sourceFile;
    private final File                     outputPath;
    private final String                   baseName;
    private final ISourceFormat            sourceFormat;
    private final List<IDestinationFormat> destinationFormats;
    private final AnalysisSettings         settings;
    private final INotifier                notifier;
    private final LocalDateTime            timestamp;


    /**
     * Constructor.
     *
     * @param sourceFile The project file to analyse
     * @param outputPath The folder in which to write the reports
     * @param baseName The first part of the names of the report files
     * @param sourceFormat The format of the source file
     * @param destinationFormats The reports to write
     * @param settings The analysis settings
     * @param notifier Where to log to
     * @param timestamp The time which is added to the names of the report files
     */
    public AnalysisTask (final File sourceFile, final File outputPath, final String baseName, final ISourceFormat sourceFormat, final List<IDestinationFormat> destinationFormats, final AnalysisSettings settings, final INotifier notifier, final LocalDateTime timestamp)
    {
        this.sourceFile = sourceFile;
        this.outputPath = outputPath;
        this.baseName = baseName;
        this.sourceFormat = sourceFormat;
        this.destinationFormats = destinationFormats;
        this.settings = settings;
        this.notifier = notifier;
        this.timestamp = timestamp;
    }


    /**
     * Runs the analysis.
     *
     * @return The analysis, empty if the project could not be read or a report could not be
     *         written
     */
    @Override
    public Optional<ProjectAnalysis> call ()
    {
        // Parse the project file
        this.notifier.log ("IDS_NOTIFY_PARSING_FILE", this.sourceFile.getAbsolutePath ());

        ProjectAnalysis analysis;
        try
        {
            analysis = this.sourceFormat.read (this.sourceFile, this.settings);
        }
        catch (final IOException | ParseException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_READ", ex);
            return Optional.empty ();
        }

        this.notifier.log ("IDS_NOTIFY_ANALYZING_ROUTING");
        analysis = analysis.withTracks (DeactivationPropagator.repropagate (analysis.getTracks ()));

        // Write output file(s)
        try
        {
            Files.createDirectories (this.outputPath.toPath ());
            for (final IDestinationFormat destinationFormat: this.destinationFormats)
            {
                final File outputFile = this.getOutputFile (destinationFormat);
                this.notifier.log ("IDS_NOTIFY_WRITING_FILE", destinationFormat.getName (), outputFile.getAbsolutePath ());
                destinationFormat.write (analysis, this.settings, outputFile);
            }
        }
        catch (final IOException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_WRITE_FILE", ex);
            return Optional.empty ();
        }

        new ProblemSummaryPrinter (this.notifier).print (analysis.getTracks ());
        this.notifier.log ("IDS_NOTIFY_ANALYSIS_FINISHED");
        return Optional.of (analysis);
    }


    /**
     * Get the file to which a report is written: base name, timestamp and the ending of the
     * format, e.g. "MySong.2024-05-01-12-00-00.full.json".
     *
     * @param destinationFormat The format of the report
     * @return The file
     */
    public File getOutputFile (final IDestinationFormat destinationFormat)
    {
        return new File (this.outputPath, this.baseName + "." + TIMESTAMP_FORMAT.format (this.timestamp) + "." + destinationFormat.getFileEnding ());
    }
}
