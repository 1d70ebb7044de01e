// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.model.Mixer;
import de.mossgrabers.mixchecker.model.Routing;
import de.mossgrabers.mixchecker.model.RoutingEndpoint;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackFlags;
import de.mossgrabers.mixchecker.model.TrackType;
import de.mossgrabers.mixchecker.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/**
 * Creates the tracks of a Live set. The tracks are grouped by their type: audio, MIDI, return,
 * master and group tracks.
 *
 * @author Jürgen Moßgraber
 */
public class TrackBuilder
{
    private final DeviceBuilder deviceBuilder;


    /**
     * Constructor.
     *
     * @param deviceBuilder Creates the devices of a track
     */
    public TrackBuilder (final DeviceBuilder deviceBuilder)
    {
        this.deviceBuilder = deviceBuilder;
    }


    /**
     * Create all tracks below the root node.
     *
     * @param root The root node of the Live set
     * @return The tracks
     */
    public List<Track> buildTracks (final Node root)
    {
        final List<Node> nodes = root.iterate ();
        final List<Track> tracks = new ArrayList<> ();
        for (final TrackType type: TrackType.values ())
        {
            for (final Node node: nodes)
            {
                final Optional<TrackType> nodeType = TrackType.fromTag (node.getName ());
                if (nodeType.isPresent () && nodeType.get () == type)
                    tracks.add (this.buildTrack (node, type));
            }
        }
        return tracks;
    }


    /**
     * Create one track.
     *
     * @param trackNode The track node
     * @param type The type of the track
     * @return The track
     */
    public Track buildTrack (final Node trackNode, final TrackType type)
    {
        final String id = TextUtils.normalize (trackNode.getFirstAttribute (AbletonTags.TRACK_ID, AbletonTags.TRACK_ID_ALTERNATIVE).orElse (null));
        final String name = AttributeResolver.resolveTrackName (trackNode).orElse (null);

        final TrackFlags flags = new TrackFlags (AttributeResolver.resolveMuted (trackNode), AttributeResolver.resolveSolo (trackNode), AttributeResolver.resolveArmed (trackNode), AttributeResolver.resolveActive (trackNode));

        final Routing routing = new Routing (getEndpoint (trackNode, AbletonTags.AUDIO_INPUT_ROUTING), getEndpoint (trackNode, AbletonTags.AUDIO_OUTPUT_ROUTING), getEndpoint (trackNode, AbletonTags.MIDI_INPUT_ROUTING), getEndpoint (trackNode, AbletonTags.MIDI_OUTPUT_ROUTING));

        final Mixer mixer = new Mixer (AttributeResolver.resolveVolume (trackNode).orElse (null), AttributeResolver.resolvePan (trackNode).orElse (null));
        final String parentGroupId = AttributeResolver.resolveParentGroupId (trackNode).orElse (null);

        return new Track (id, type, name, flags, routing, mixer, parentGroupId, this.deviceBuilder.buildDevices (trackNode));
    }


    private static RoutingEndpoint getEndpoint (final Node trackNode, final String routingTag)
    {
        return AttributeResolver.resolveRoutingEndpoint (trackNode, routingTag).orElse (null);
    }
}
