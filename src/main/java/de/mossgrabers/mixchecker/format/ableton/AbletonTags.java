// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import java.util.regex.Pattern;


/**
 * Tags and tag patterns used in Ableton Live project files.
 *
 * @author Jürgen Moßgraber
 */
public class AbletonTags
{
    protected static final String    LIVE_SET                = "LiveSet";

    protected static final String    TRACK_ID                = "Id";
    protected static final String    TRACK_ID_ALTERNATIVE    = "TrackId";
    protected static final String    DEVICE_CHAIN            = "DeviceChain";
    protected static final String    DEVICES                 = "Devices";
    protected static final String    MIXER                   = "Mixer";
    protected static final String    MIXER_PATH              = "DeviceChain/Mixer";
    protected static final String    SPEAKER_PATH            = "DeviceChain/Mixer/Speaker";
    protected static final String    MANUAL                  = "Manual";

    protected static final String    AUDIO_INPUT_ROUTING     = "AudioInputRouting";
    protected static final String    AUDIO_OUTPUT_ROUTING    = "AudioOutputRouting";
    protected static final String    MIDI_INPUT_ROUTING      = "MidiInputRouting";
    protected static final String    MIDI_OUTPUT_ROUTING     = "MidiOutputRouting";

    protected static final String    AUTOMATION_TARGET       = "AutomationTarget";
    protected static final String    POINTEE_ID              = "PointeeId";
    protected static final String    ENVELOPE_TARGET         = "EnvelopeTarget";

    protected static final String    ATTR_VALUE              = "Value";
    protected static final String    ATTR_MANUAL             = "Manual";
    protected static final String    ATTR_AMOUNT             = "Amount";
    protected static final String    ATTR_ID                 = "Id";
    protected static final String    ATTR_NAME               = "Name";
    protected static final String    ATTR_TIME               = "Time";

    protected static final String [] PARENT_GROUP_TAGS       =
    {
        "TrackGroupId",
        "ParentGroupId",
        "ParentGroup",
        "GroupId",
        "GroupTrackId",
        "TrackGroup"
    };

    protected static final String [] DEVICE_ON_TAGS          =
    {
        "DeviceOn",
        "IsOn",
        "On"
    };

    protected static final Pattern   TRACK_EFFECTIVE_NAME    = Pattern.compile ("EffectiveName$");
    protected static final Pattern   TRACK_USER_NAME         = Pattern.compile ("UserName$");
    protected static final Pattern   TRACK_TRACK_NAME        = Pattern.compile ("TrackName$");
    protected static final Pattern   ANY_NAME                = Pattern.compile ("Name$");

    protected static final Pattern   SPEAKER                 = Pattern.compile ("(Speaker)$");
    protected static final Pattern   MUTE                    = Pattern.compile ("(IsMuted|Mute)$");
    protected static final Pattern   MUTE_ALTERNATIVE        = Pattern.compile ("(TrackMute|MuteButton|MuteState)$");
    protected static final Pattern   SOLO                    = Pattern.compile ("(IsSolo|Solo)$");
    protected static final Pattern   ARM                     = Pattern.compile ("(IsArmed|Arm|RecordArm)$");

    protected static final Pattern   VOLUME                  = Pattern.compile ("(Volume|TrackVolume|MixerVolume|MainVolume|OutputVolume|TrackVol)$");
    protected static final Pattern   PAN                     = Pattern.compile ("(Pan|TrackPan|MixerPan|MainPan|OutputPan|TrackPanVal)$");

    protected static final Pattern   ROUTING_TARGET          = Pattern.compile ("(Target|TargetName|DisplayString)$");
    protected static final Pattern   ROUTING_VALUE           = Pattern.compile ("(Enum|Value)$");

    protected static final Pattern   PARENT_GROUP            = Pattern.compile ("(TrackGroupId|ParentGroupId|GroupId|GroupTrackId)$");

    protected static final Pattern   VENDOR                  = Pattern.compile ("(Vendor|Company|Manufacturer)$");
    protected static final Pattern   PRODUCT                 = Pattern.compile ("(Product|Plug(Name|InName)|PluginName|Name)$");
    protected static final Pattern   IDENTIFIER              = Pattern.compile ("(Identifier|UniqueId|PluginId|VstId|AUId|Uid)$");
    protected static final Pattern   PATH                    = Pattern.compile ("(Path|FilePath|FileName)$");

    protected static final Pattern   DEVICE_DISPLAY_NAME     = Pattern.compile ("(UserName|EffectiveName)$");
    protected static final Pattern   DEVICE_PLUGIN_NAME      = Pattern.compile ("(Plug(Name|InName)|PluginName)$");

    protected static final Pattern   ON_CONTAINER            = Pattern.compile ("^(On|DeviceOn|IsOn|Enabled)$", Pattern.CASE_INSENSITIVE);


    /**
     * Private due to constants class.
     */
    private AbletonTags ()
    {
        // Intentionally empty
    }
}
