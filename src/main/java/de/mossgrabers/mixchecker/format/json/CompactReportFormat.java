// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.json;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.ProjectAnalysis;
import de.mossgrabers.mixchecker.model.Device;
import de.mossgrabers.mixchecker.model.Mixer;
import de.mossgrabers.mixchecker.model.QcReason;
import de.mossgrabers.mixchecker.model.QcResult;
import de.mossgrabers.mixchecker.model.RoutingEndpoint;
import de.mossgrabers.mixchecker.model.RoutingImpact;
import de.mossgrabers.mixchecker.model.RoutingKind;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackAnalysis;
import de.mossgrabers.mixchecker.model.TriState;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/**
 * The token minimized report. Uses short keys which are explained in the contained legend.
 *
 * @author Jürgen Moßgraber
 */
public class CompactReportFormat extends AbstractReportFormat
{
    private static final int HASH_LENGTH = 12;


    /**
     * Constructor.
     *
     * @param notifier The notifier
     */
    public CompactReportFormat (final INotifier notifier)
    {
        super ("Compact JSON report", "compact.json", notifier);
    }


    /** {@inheritDoc} */
    @Override
    public ObjectNode createReport (final ProjectAnalysis analysis, final AnalysisSettings settings)
    {
        final ArrayNode tracks = JsonHelper.FACTORY.arrayNode ();
        int totalDevices = 0;
        for (final TrackAnalysis trackAnalysis: analysis.getTracks ())
        {
            tracks.add (createTrack (trackAnalysis));
            totalDevices += trackAnalysis.getTrack ().getDevices ().size ();
        }

        final ObjectNode report = JsonHelper.FACTORY.objectNode ();
        report.put ("version", VERSION);
        report.put ("input_file", analysis.getSourceFile ().getAbsolutePath ());
        report.put ("root_tag", analysis.getRootTag ());
        report.put ("track_count", tracks.size ());
        report.put ("total_devices", totalDevices);
        report.put ("schema", "compact");
        report.set ("legend", createLegend ());
        report.set ("tracks", tracks);
        return report;
    }


    /**
     * Create the compact form of a track.
     *
     * @param trackAnalysis The analysed track
     * @return The compact track
     */
    static ObjectNode createTrack (final TrackAnalysis trackAnalysis)
    {
        final Track track = trackAnalysis.getTrack ();
        final QcResult qc = trackAnalysis.getQc ();
        final Optional<RoutingEndpoint> audioIn = track.getRouting ().getAudioIn ();
        final Optional<RoutingEndpoint> audioOut = track.getRouting ().getAudioOut ();
        final RoutingKind audioInKind = track.getRouting ().getAudioInKind ();
        final RoutingKind audioOutKind = track.getRouting ().getAudioOutKind ();
        final Optional<RoutingImpact> impact = trackAnalysis.getImpact ();

        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        node.put ("tt", track.getType ().getTag ());
        node.put ("id", track.getId ().orElse (null));
        node.put ("n", track.getName ().orElse (null));
        node.put ("pg", track.getParentGroupId ().orElse (null));
        putTriState (node, "mu", track.getFlags ().getMuted ());
        putTriState (node, "so", track.getFlags ().getSolo ());
        putTriState (node, "ar", track.getFlags ().getArmed ());
        node.put ("F", qc.isFail ());
        putPacked (node, "R", qc.getReasonCodes ());
        putPacked (node, "W", qc.getWarningCodes ());
        node.put ("ai", audioIn.flatMap (RoutingEndpoint::getTarget).orElse (null));
        node.put ("ao", audioOut.flatMap (RoutingEndpoint::getTarget).orElse (null));
        node.put ("aik", audioInKind.getCode ());
        node.put ("aok", audioOutKind.getCode ());
        node.put ("air", audioIn.flatMap (RoutingEndpoint::getReferencedTrackId).orElse (null));
        node.put ("aor", audioOut.flatMap (RoutingEndpoint::getReferencedTrackId).orElse (null));
        String resolvedGroupId = null;
        if (audioOutKind == RoutingKind.GROUP && impact.isPresent ())
            resolvedGroupId = impact.get ().getResolvedGroupId ().orElse (null);
        node.put ("aog", resolvedGroupId);

        final Mixer mixer = track.getMixer ();
        final ObjectNode mixerNode = node.putObject ("mx");
        putDouble (mixerNode, "v", mixer.getVolume ());
        putDouble (mixerNode, "p", mixer.getPan ());
        putTriState (mixerNode, "vs", mixer.getVolumeSilent ());

        final List<Device> devices = track.getDevices ();
        node.put ("dc", devices.size ());
        final ArrayNode deviceNodes = node.putArray ("dv");
        for (final Device device: devices)
            deviceNodes.add (createDevice (device));

        if (impact.isPresent () && impact.get ().isRoutingBreak () && impact.get ().getDepth ().isPresent ())
        {
            final ObjectNode routingBreak = node.putObject ("rb");
            routingBreak.put ("d", impact.get ().getDepth ().getAsInt ());
            if (impact.get ().getSources ().isEmpty ())
                routingBreak.putNull ("s");
            else
                impact.get ().getSources ().forEach (routingBreak.putArray ("s")::add);
        }

        final ArrayNode issues = node.putArray ("is");
        detectIssues (trackAnalysis).forEach (issues::add);
        return node;
    }


    /**
     * Create the compact form of a device.
     *
     * @param device The device
     * @return The compact device
     */
    static ObjectNode createDevice (final Device device)
    {
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        node.put ("t", device.getTag ());
        node.put ("n", device.getName ());
        putTriState (node, "e", device.getEnabled ());
        node.put ("a", device.hasOnAutomation ());
        node.put ("f", device.getFormat ().getLabel ());
        node.put ("i", device.getIdentity ().getIdentifier ().orElse (null));
        node.put ("h", getStateHash (device));
        putTriState (node, "z", device.getNoop ());
        return node;
    }


    /**
     * Get a short hash which identifies the state of a device. Plug-ins use the hash of their
     * state, all other devices a hash of their identity and parameters.
     *
     * @param device The device
     * @return The first 12 hex characters of the hash
     */
    static String getStateHash (final Device device)
    {
        if (device.getPluginState ().isPresent ())
            return device.getPluginState ().get ().getSha ().substring (0, HASH_LENGTH);

        final ObjectNode payload = JsonHelper.FACTORY.objectNode ();
        payload.put ("id", device.getIdentity ().getIdentifier ().orElse (null));
        payload.put ("name", device.getName ());
        payload.put ("fmt", device.getFormat ().getLabel ());
        final ObjectNode named = createNamedParameters (device);
        final ObjectNode params = createParameters (device);
        payload.set ("named", named == null ? JsonHelper.FACTORY.objectNode () : named);
        payload.set ("params", params == null ? JsonHelper.FACTORY.objectNode () : params);
        return JsonHelper.hash ("SHA-256", JsonHelper.toCanonicalJson (payload).getBytes (StandardCharsets.UTF_8)).substring (0, HASH_LENGTH);
    }


    /**
     * Get the short issue labels of a track.
     *
     * @param trackAnalysis The analysed track
     * @return The labels
     */
    static List<String> detectIssues (final TrackAnalysis trackAnalysis)
    {
        final Track track = trackAnalysis.getTrack ();
        final List<String> issues = new ArrayList<> ();
        if (track.getFlags ().getMuted ().isTrue ())
            issues.add ("mut");
        if (track.getFlags ().getSolo ().isTrue ())
            issues.add ("sol");
        if (trackAnalysis.getQc ().isFail ())
            issues.add ("qc");
        if (trackAnalysis.getQc ().getReasons ().contains (QcReason.ROUTING_BROKEN))
            issues.add ("rbrk");

        final String audioIn = track.getRouting ().getAudioIn ().flatMap (RoutingEndpoint::getTarget).orElse (null);
        final String audioOut = track.getRouting ().getAudioOut ().flatMap (RoutingEndpoint::getTarget).orElse (null);
        if (audioIn != null && (audioIn.endsWith ("/None") || audioIn.contains ("AudioIn/None")))
            issues.add ("ain0");
        if (audioOut != null && (audioOut.endsWith ("/None") || audioOut.contains ("AudioOut/None")))
            issues.add ("aout0");

        if (track.getMixer ().getVolumeSilent ().isTrue ())
            issues.add ("sil");

        final List<Device> devices = track.getDevices ();
        if (devices.isEmpty ())
            issues.add ("ndev");
        else if (devices.stream ().allMatch (device -> device.getEnabled ().isFalse ()))
            issues.add ("alldis");
        else if (devices.stream ().anyMatch (device -> device.getEnabled () == TriState.UNKNOWN))
            issues.add ("en?");

        final RoutingKind audioOutKind = track.getRouting ().getAudioOutKind ();
        if (track.getRouting ().getAudioInKind () == RoutingKind.TRACK && (audioOutKind == RoutingKind.GROUP || audioOutKind == RoutingKind.MASTER))
            issues.add ("fxrcv");

        final Optional<RoutingImpact> impact = trackAnalysis.getImpact ();
        if (impact.isPresent () && impact.get ().isDeadBus ())
            issues.add ("dbus");
        if (impact.isPresent () && impact.get ().isOrphanBus ())
            issues.add ("obus");
        return issues;
    }


    private static ObjectNode createLegend ()
    {
        final ObjectNode legend = JsonHelper.FACTORY.objectNode ();
        legend.put ("tt", "track_type");
        legend.put ("id", "track_id");
        legend.put ("n", "name");
        legend.put ("pg", "parent_group_id");
        legend.put ("mu", "muted");
        legend.put ("so", "solo");
        legend.put ("ar", "arm");
        legend.put ("F", "final_qc fail (bool)");
        legend.put ("R", "final_qc reasons packed (m d s x o r)");
        legend.put ("W", "final_qc warnings packed (a)");
        legend.put ("ai", "audio_in");
        legend.put ("ao", "audio_out");
        legend.put ("aik", "audio_in_kind (n none, m missing, T trackref, G group-ish, M master, E external, u unknown)");
        legend.put ("aok", "audio_out_kind");
        legend.put ("air", "audio_in_ref_id (Track.X or GroupTrack.X)");
        legend.put ("aor", "audio_out_ref_id");
        legend.put ("aog", "resolved audio_out group id when ao is AudioOut/GroupTrack");
        legend.put ("mx", "mixer {v volume, p pan, vs volume_silent_guess}");
        legend.put ("dc", "device_count");
        legend.put ("dv", "devices");
        legend.put ("dv.t", "device_tag");
        legend.put ("dv.n", "device_name");
        legend.put ("dv.e", "device_enabled (true/false/null)");
        legend.put ("dv.a", "device_on_automation (On/Off automated?)");
        legend.put ("dv.f", "plugin_format");
        legend.put ("dv.i", "plugin_identifier");
        legend.put ("dv.h", "state_hash");
        legend.put ("dv.z", "noop_guess");
        legend.put ("rb", "routing_break trace {d depth, s source_ids}");
        legend.put ("is", "issues (mut, sol, qc, rbrk, dbus, obus, ain0, aout0, sil, ndev, alldis, en?, fxrcv)");
        legend.set ("R_codes", createReasonLegend ());
        legend.set ("W_codes", createWarningLegend ());
        return legend;
    }


    private static void putPacked (final ObjectNode node, final String key, final String codes)
    {
        if (codes.isEmpty ())
            node.putNull (key);
        else
            node.put (key, codes);
    }
}
