// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.report;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.analysis.QcSummary;
import de.mossgrabers.mixchecker.model.QcReason;
import de.mossgrabers.mixchecker.model.QcWarning;
import de.mossgrabers.mixchecker.model.RoutingImpact;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackAnalysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;


/**
 * Logs a human readable overview of the problems of a project.
 *
 * @author Jürgen Moßgraber
 */
public class ProblemSummaryPrinter
{
    private static final int MAX_IMPACT_LINES   = 25;
    private static final int MAX_LISTED_SOURCES = 5;

    private final INotifier  notifier;


    /**
     * Constructor.
     *
     * @param notifier Where to log to
     */
    public ProblemSummaryPrinter (final INotifier notifier)
    {
        this.notifier = notifier;
    }


    /**
     * Log the summary.
     *
     * @param analyses The analysed tracks
     */
    public void print (final List<TrackAnalysis> analyses)
    {
        final QcSummary summary = new QcSummary (analyses);

        this.notifier.log ("IDS_NOTIFY_SUMMARY_HEADER");
        this.notifier.log ("IDS_NOTIFY_SUMMARY_TRACKS", Integer.toString (summary.getFailTrackCount ()), Integer.toString (summary.getWarnTrackCount ()));
        this.notifier.log ("IDS_NOTIFY_SUMMARY_DEACTIVATED", Integer.toString (summary.getDeactivatedTrackCount ()));
        this.notifier.log ("IDS_NOTIFY_SUMMARY_ROUTING", Integer.toString (summary.getRoutingBreakTrackCount ()), Integer.toString (summary.getDeadBusTrackCount ()), Integer.toString (summary.getOrphanBusTrackCount ()));
        this.notifier.log ("IDS_NOTIFY_SUMMARY_DEVICES", Integer.toString (summary.getDevicesOffCount ()), Integer.toString (summary.getDevicesOffNoAutomationCount ()), Integer.toString (summary.getDevicesOnAutomationCount ()));

        final Map<String, String> reasonCodes = new LinkedHashMap<> ();
        for (final QcReason reason: QcReason.values ())
            reasonCodes.put (reason.getCode (), reason.getDescription ());
        this.notifier.log ("IDS_NOTIFY_SUMMARY_REASON_CODES", formatCodes (reasonCodes));
        final Map<String, String> warningCodes = new LinkedHashMap<> ();
        for (final QcWarning warning: QcWarning.values ())
            warningCodes.put (warning.getCode (), warning.getDescription ());
        this.notifier.log ("IDS_NOTIFY_SUMMARY_WARNING_CODES", formatCodes (warningCodes));

        final List<TrackAnalysis> failing = summary.getFailTracksPreview ();
        if (!failing.isEmpty ())
        {
            this.notifier.log ("IDS_NOTIFY_SUMMARY_FAILING");
            for (final TrackAnalysis analysis: failing)
            {
                final Track track = analysis.getTrack ();
                this.notifier.log ("IDS_NOTIFY_SUMMARY_FAILING_TRACK", String.format ("%-9s", track.getType ().getTag ()), String.format ("%-8s", analysis.getQc ().getReasonCodes ()), track.getName ().orElse (""));
            }
        }

        if (summary.getRoutingBreakTrackCount () > 0)
            this.printRoutingImpact (analyses);
    }


    private void printRoutingImpact (final List<TrackAnalysis> analyses)
    {
        this.notifier.log ("IDS_NOTIFY_SUMMARY_IMPACT");

        int shown = 0;
        for (final TrackAnalysis analysis: analyses)
        {
            if (!analysis.isRoutingBreak ())
                continue;
            if (shown >= MAX_IMPACT_LINES)
            {
                this.notifier.log ("IDS_NOTIFY_SUMMARY_MORE");
                break;
            }

            final RoutingImpact impact = analysis.getImpact ().get ();
            final String name = analysis.getTrack ().getName ().orElse ("");
            String marker = "";
            if (impact.isDeadBus ())
                marker = "[DEAD BUS]";
            else if (impact.isOrphanBus ())
                marker = "[ORPHAN BUS]";

            final List<String> sourceNames = getSourceNames (analyses, impact.getSources ());
            final OptionalInt depth = impact.getDepth ();
            if (depth.isPresent () && !sourceNames.isEmpty ())
                this.notifier.log ("IDS_NOTIFY_SUMMARY_IMPACT_TRACK", Integer.toString (depth.getAsInt ()), String.join (",", sourceNames), marker.isEmpty () ? "" : " " + marker, name);
            else if (!marker.isEmpty ())
                this.notifier.log ("IDS_NOTIFY_SUMMARY_IMPACT_MARKED", marker, name);
            else
                this.notifier.log ("IDS_NOTIFY_SUMMARY_IMPACT_PLAIN", name);
            shown++;
        }
    }


    private static List<String> getSourceNames (final List<TrackAnalysis> analyses, final List<String> sourceIds)
    {
        final List<String> names = new ArrayList<> ();
        for (final String sourceId: sourceIds)
        {
            if (names.size () >= MAX_LISTED_SOURCES)
                break;
            for (final TrackAnalysis analysis: analyses)
            {
                final Track track = analysis.getTrack ();
                if (track.getId ().isPresent () && track.getId ().get ().equals (sourceId))
                {
                    track.getName ().ifPresent (names::add);
                    break;
                }
            }
        }
        return names;
    }


    private static String formatCodes (final Map<String, String> codes)
    {
        return codes.entrySet ().stream ().map (entry -> entry.getKey () + "=" + entry.getValue ()).collect (Collectors.joining (", "));
    }
}
