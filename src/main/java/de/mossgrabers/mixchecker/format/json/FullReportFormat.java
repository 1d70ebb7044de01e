// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.json;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.analysis.QcSummary;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.ProjectAnalysis;
import de.mossgrabers.mixchecker.format.Conversions;
import de.mossgrabers.mixchecker.model.Device;
import de.mossgrabers.mixchecker.model.DeviceIdentity;
import de.mossgrabers.mixchecker.model.Mixer;
import de.mossgrabers.mixchecker.model.PluginState;
import de.mossgrabers.mixchecker.model.QcReason;
import de.mossgrabers.mixchecker.model.QcResult;
import de.mossgrabers.mixchecker.model.QcWarning;
import de.mossgrabers.mixchecker.model.Routing;
import de.mossgrabers.mixchecker.model.RoutingEndpoint;
import de.mossgrabers.mixchecker.model.RoutingImpact;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackAnalysis;
import de.mossgrabers.mixchecker.model.TrackFlags;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;


/**
 * The verbose report which contains everything that was extracted. Large repeated blocks can be
 * pooled and null values removed.
 *
 * @author Jürgen Moßgraber
 */
public class FullReportFormat extends AbstractReportFormat
{
    /**
     * Constructor.
     *
     * @param notifier The notifier
     */
    public FullReportFormat (final INotifier notifier)
    {
        super ("Full JSON report", "full.json", notifier);
    }


    /** {@inheritDoc} */
    @Override
    public ObjectNode createReport (final ProjectAnalysis analysis, final AnalysisSettings settings)
    {
        final List<TrackAnalysis> tracks = analysis.getTracks ();
        final Map<String, Track> byId = new HashMap<> ();
        for (final TrackAnalysis trackAnalysis: tracks)
            trackAnalysis.getTrack ().getId ().ifPresent (id -> byId.put (id, trackAnalysis.getTrack ()));

        final ObjectNode report = JsonHelper.FACTORY.objectNode ();
        report.put ("version", VERSION);
        report.put ("input_file", analysis.getSourceFile ().getAbsolutePath ());
        report.put ("root_tag", analysis.getRootTag ());
        report.put ("track_count", tracks.size ());
        report.set ("qc_reason_legend", createReasonLegend ());
        report.set ("qc_warning_legend", createWarningLegend ());
        report.set ("qc_summary", createSummary (new QcSummary (tracks)));

        final ArrayNode trackNodes = report.putArray ("tracks");
        for (final TrackAnalysis trackAnalysis: tracks)
            trackNodes.add (createTrack (trackAnalysis, byId, settings));

        if (settings.isFullDedupe ())
            report.set ("pools", pool (trackNodes));

        return settings.isStripNullKeys () ? (ObjectNode) JsonHelper.stripNullKeys (report) : report;
    }


    /**
     * Move the device settings and decoded plug-in states into pools. Equal blocks are stored
     * only once and referenced by their hash.
     *
     * @param trackNodes The tracks
     * @return The pools
     */
    static ObjectNode pool (final ArrayNode trackNodes)
    {
        final ObjectNode pools = JsonHelper.FACTORY.objectNode ();
        final ObjectNode settingsPool = pools.putObject ("device_settings_pool");
        final ObjectNode decodedPool = pools.putObject ("plugin_decoded_pool");

        for (final JsonNode trackNode: trackNodes)
        {
            final JsonNode devices = trackNode.get ("devices");
            if (devices == null)
                continue;
            for (final JsonNode deviceNode: devices)
            {
                final ObjectNode device = (ObjectNode) deviceNode;
                poolBlock (device, "settings", "settings_ref", settingsPool);
                poolBlock (device, "plugin_decoded", "plugin_decoded_ref", decodedPool);
            }
        }
        return pools;
    }


    private static void poolBlock (final ObjectNode device, final String key, final String referenceKey, final ObjectNode poolNode)
    {
        final JsonNode block = device.get (key);
        if (block == null || !block.isObject () || block.isEmpty ())
            return;
        final String hash = JsonHelper.hash12 (block);
        if (!poolNode.has (hash))
            poolNode.set (hash, block);
        device.put (referenceKey, hash);
        device.putNull (key);
    }


    private static ObjectNode createSummary (final QcSummary summary)
    {
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        node.put ("fail_track_count", summary.getFailTrackCount ());
        node.put ("warn_track_count", summary.getWarnTrackCount ());
        final ArrayNode preview = node.putArray ("fail_tracks_preview");
        for (final TrackAnalysis trackAnalysis: summary.getFailTracksPreview ())
        {
            final Track track = trackAnalysis.getTrack ();
            final ObjectNode brief = preview.addObject ();
            brief.put ("id", track.getId ().orElse (null));
            brief.put ("name", track.getName ().orElse (null));
            brief.put ("type", track.getType ().getTag ());
            brief.set ("reasons", createReasons (trackAnalysis.getQc ()));
        }
        node.put ("deactivated_track_count", summary.getDeactivatedTrackCount ());
        node.put ("muted_track_count", summary.getMutedTrackCount ());
        node.put ("silent_track_count", summary.getSilentTrackCount ());
        node.put ("routing_break_track_count", summary.getRoutingBreakTrackCount ());
        node.put ("dead_bus_track_count", summary.getDeadBusTrackCount ());
        node.put ("orphan_bus_track_count", summary.getOrphanBusTrackCount ());
        node.put ("device_count", summary.getDeviceCount ());
        node.put ("devices_off_count", summary.getDevicesOffCount ());
        node.put ("devices_off_no_auto_count", summary.getDevicesOffNoAutomationCount ());
        node.put ("devices_on_automation_count", summary.getDevicesOnAutomationCount ());
        return node;
    }


    private static ObjectNode createTrack (final TrackAnalysis trackAnalysis, final Map<String, Track> byId, final AnalysisSettings settings)
    {
        final Track track = trackAnalysis.getTrack ();
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        node.put ("track_type", track.getType ().getTag ());
        node.put ("track_id", track.getId ().orElse (null));
        node.put ("name", track.getName ().orElse (null));

        final TrackFlags flags = track.getFlags ();
        final ObjectNode flagsNode = node.putObject ("flags");
        putTriState (flagsNode, "muted", flags.getMuted ());
        putTriState (flagsNode, "solo", flags.getSolo ());
        putTriState (flagsNode, "arm", flags.getArmed ());
        putTriState (flagsNode, "active", flags.getActive ());
        putTriState (flagsNode, "deactivated", flags.getDeactivated ());

        final Optional<RoutingImpact> impact = trackAnalysis.getImpact ();
        node.set ("routing", createRouting (track.getRouting (), impact));
        node.set ("mixer", createMixer (track.getMixer ()));
        node.put ("parent_group_id", track.getParentGroupId ().orElse (null));

        final ArrayNode devices = node.putArray ("devices");
        for (final Device device: track.getDevices ())
            devices.add (createDevice (device, settings));

        final QcResult qc = trackAnalysis.getQc ();
        final ObjectNode qcNode = node.putObject ("final_qc");
        qcNode.put ("fail", qc.isFail ());
        qcNode.set ("reasons", createReasons (qc));
        final ArrayNode warnings = qcNode.putArray ("warnings");
        for (final QcWarning warning: qc.getWarnings ())
            warnings.add (warning.getCode ());

        if (impact.isPresent ())
            addImpact (node, impact.get (), byId);
        return node;
    }


    private static void addImpact (final ObjectNode node, final RoutingImpact impact, final Map<String, Track> byId)
    {
        if (impact.isRoutingBreak ())
            node.put ("routing_break", true);
        if (!impact.getMessages ().isEmpty ())
        {
            final ArrayNode messages = node.putArray ("routing_impact");
            impact.getMessages ().forEach (messages::add);
        }

        final OptionalInt depth = impact.getDepth ();
        if (depth.isPresent ())
        {
            node.put ("routing_break_depth", depth.getAsInt ());
            final ArrayNode sources = node.putArray ("routing_break_sources");
            for (final String sourceId: impact.getSources ())
                sources.add (createTrackReference (sourceId, byId));
            final ArrayNode path = node.putArray ("routing_break_path");
            final ArrayNode pathIds = node.putArray ("routing_break_path_ids");
            for (final String id: impact.getPath ())
            {
                path.add (createTrackReference (id, byId));
                pathIds.add (id);
            }
        }

        if (impact.isDeadBus ())
            node.put ("routing_dead_bus", true);
        if (impact.isOrphanBus ())
            node.put ("routing_orphan_bus", true);
    }


    private static ObjectNode createTrackReference (final String id, final Map<String, Track> byId)
    {
        final ObjectNode reference = JsonHelper.FACTORY.objectNode ();
        if (RoutingImpact.ELISION.equals (id))
        {
            reference.put ("id", RoutingImpact.ELISION);
            reference.put ("name", RoutingImpact.ELISION);
            reference.put ("type", RoutingImpact.ELISION);
            return reference;
        }
        final Track track = byId.get (id);
        reference.put ("id", id);
        reference.put ("name", track == null ? null : track.getName ().orElse (null));
        reference.put ("type", track == null ? null : track.getType ().getTag ());
        return reference;
    }


    private static ObjectNode createRouting (final Routing routing, final Optional<RoutingImpact> impact)
    {
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        putEndpoint (node, "audio_in", routing.getAudioIn ());
        putEndpoint (node, "audio_out", routing.getAudioOut ());
        putEndpoint (node, "midi_in", routing.getMidiIn ());
        putEndpoint (node, "midi_out", routing.getMidiOut ());
        if (impact.isPresent ())
            impact.get ().getResolvedGroupId ().ifPresent (groupId -> node.put ("audio_out_resolved_group_id", groupId));
        return node;
    }


    private static void putEndpoint (final ObjectNode node, final String key, final Optional<RoutingEndpoint> endpoint)
    {
        if (endpoint.isPresent ())
            node.put (key, endpoint.get ().getTarget ().orElse (null));
    }


    private static ObjectNode createMixer (final Mixer mixer)
    {
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        node.put ("volume_raw", mixer.getVolumeRaw ().orElse (null));
        node.put ("pan_raw", mixer.getPanRaw ().orElse (null));
        final OptionalDouble volume = mixer.getVolume ();
        final OptionalDouble pan = mixer.getPan ();
        putDouble (node, "volume", volume);
        putDouble (node, "pan", pan);
        putDouble (node, "volume_db", volume.isPresent () ? OptionalDouble.of (Conversions.valueToDb (volume.getAsDouble ())) : volume);
        putTriState (node, "volume_silent_guess", mixer.getVolumeSilent ());
        return node;
    }


    private static ObjectNode createDevice (final Device device, final AnalysisSettings settings)
    {
        final DeviceIdentity identity = device.getIdentity ();
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        node.put ("tag", device.getTag ());
        node.put ("name", device.getName ());
        node.put ("plugin_vendor", identity.getVendor ().orElse (null));
        node.put ("plugin_product", identity.getProduct ().orElse (null));
        node.put ("plugin_format", device.getFormat ().getLabel ());
        node.put ("plugin_identifier", identity.getIdentifier ().orElse (null));
        putTriState (node, "enabled", device.getEnabled ());

        final Optional<PluginState> pluginState = device.getPluginState ();
        if (pluginState.isPresent ())
        {
            final PluginState state = pluginState.get ();
            node.put ("plugin_state_len", state.getLength ());
            node.put ("plugin_state_sha", state.getSha ());
            final ObjectNode meta = node.putObject ("plugin_meta");
            meta.put ("role", state.getRole ().orElse (null));
            if (state.getHintTags ().isEmpty ())
                meta.putNull ("hint_tags");
            else
                state.getHintTags ().forEach (meta.putArray ("hint_tags")::add);
            if (settings.isMixSettings () && !state.getHints ().isEmpty ())
                state.getHints ().forEach (node.putArray ("plugin_state_hints")::add);
            node.set ("plugin_decoded", state.getDecoded ().orElse (null));
        }

        node.put ("has_on_automation", device.hasOnAutomation ());
        node.set ("named_params", createNamedParameters (device));
        node.set ("params", createParameters (device));
        node.set ("settings", device.getSettings ().orElse (null));
        putTriState (node, "noop_guess", device.getNoop ());
        return node;
    }


    private static ArrayNode createReasons (final QcResult qc)
    {
        final ArrayNode reasons = JsonHelper.FACTORY.arrayNode ();
        for (final QcReason reason: qc.getReasons ())
            reasons.add (reason.getCode ());
        return reasons;
    }
}
