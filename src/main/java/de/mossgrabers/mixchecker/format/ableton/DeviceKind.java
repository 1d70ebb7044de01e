// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import java.util.List;
import java.util.Locale;


/**
 * The stock device kinds for which key settings are extracted and the parameters which matter for
 * a mix check.
 *
 * @author Jürgen Moßgraber
 */
public enum DeviceKind
{
    /** EQ Eight. */
    EQ8 (List.of ("AdaptiveQFactor", "ChannelMode", "AnalyzeOn", "SelectedBand"), "Eq8"),
    /** Utility. */
    UTILITY (List.of ("Gain", "StereoWidth", "Mono", "BassMono", "BassMonoFrequency", "PhaseInvertL", "PhaseInvertR", "ChannelMode"), "StereoGain"),
    /** Glue Compressor. */
    GLUE_COMPRESSOR (List.of ("Threshold", "Ratio", "Attack", "Release", "Makeup", "DryWet", "Range", "PeakClipIn", "Oversample"), "GlueCompressor"),
    /** Drum Buss. */
    DRUM_BUSS (List.of ("EnableCompression", "DriveAmount", "DriveType", "CrunchAmount", "DampingFrequency", "TransientShaping", "BoomFrequency", "BoomAmount", "BoomDecay", "InputTrim", "OutputGain", "DryWet"), "DrumBuss"),
    /** Auto Pan. */
    AUTO_PAN (List.of ("Mode", "Modulation_Amount", "Modulation_Waveform", "Modulation_Frequency", "Modulation_Time", "Modulation_SyncedRate", "Modulation_Sixteenth", "Modulation_Phase", "Modulation_PhaseOffset", "Modulation_StereoMode", "Modulation_Spin", "AttackTime", "VintageMode", "HarmonicMode"), "AutoPan2"),
    /** Delay. */
    DELAY (List.of ("DelayLine_Link", "DelayLine_PingPong", "DelayLine_SyncL", "DelayLine_SyncR", "DelayLine_TimeL", "DelayLine_TimeR", "DelayLine_SyncedSixteenthL", "DelayLine_SyncedSixteenthR", "Feedback", "Freeze", "Filter_On", "Filter_Frequency", "Filter_Bandwidth", "Modulation_Frequency", "Modulation_AmountTime", "Modulation_AmountFilter", "DryWet", "EcoProcessing"), "Delay"),
    /** Echo. */
    ECHO (List.of ("Delay_TimeLink", "Delay_SyncL", "Delay_TimeL", "Delay_SyncR", "Delay_TimeR", "Feedback", "ChannelMode", "InputGain", "OutputGain", "Gate_On", "Gate_Threshold", "Gate_Release", "Ducking_On", "Ducking_Threshold", "Ducking_Release", "Filter_On", "Filter_HighPassFrequency", "Filter_LowPassFrequency", "Modulation_Waveform", "Modulation_Frequency", "Modulation_AmountDelay", "Modulation_AmountFilter", "Reverb_Level", "Reverb_Decay", "StereoWidth", "DryWet"), "Echo"),
    /** Saturator. */
    SATURATOR (List.of ("PreDrive", "Type", "ColorOn", "BaseDrive", "ColorFrequency", "ColorWidth", "ColorDepth", "PostClip", "PostDrive", "DryWet", "Oversampling"), "Saturator"),
    /** Vocoder. */
    VOCODER (List.of ("LowFrequency", "HighFrequency", "FormantShift", "FilterBandWidth", "Retro", "LevelGate", "OutputGain", "EnvelopeRate", "EnvelopeRelease", "CarrierSource", "CarrierFlatten", "MonoStereo", "DryWet", "ModulatorAmount"), "Vocoder"),
    /** Instrument and drum racks. */
    RACK (List.of (), "InstrumentGroupDevice", "DrumGroupDevice"),
    /** Drum Sampler cell. */
    DRUM_CELL (List.of ("Voice_Gain", "Voice_Transpose", "Voice_Detune", "Voice_Filter_On", "Voice_Filter_Frequency", "Voice_Filter_Resonance", "Voice_Envelope_Attack", "Voice_Envelope_Decay", "Voice_Envelope_Release", "Volume", "Pan"), "DrumCell"),
    /** Wavetable. */
    WAVETABLE (List.of ("Voice_Oscillator1_On", "Voice_Oscillator1_Pitch_Transpose", "Voice_Oscillator1_Pitch_Detune", "Voice_Oscillator1_Wavetables_WavePosition", "Voice_Oscillator1_Gain", "Voice_Oscillator2_On", "Voice_Oscillator2_Pitch_Transpose", "Voice_Oscillator2_Pitch_Detune", "Voice_Oscillator2_Wavetables_WavePosition", "Voice_Oscillator2_Gain", "Voice_Filter1_On", "Voice_Filter1_Type", "Voice_Filter1_Slope", "Voice_Filter1_Frequency", "Voice_Filter1_Resonance", "Voice_Filter1_Drive", "Voice_Filter2_On", "Voice_Filter2_Type", "Voice_Filter2_Slope", "Voice_Filter2_Frequency", "Voice_Filter2_Resonance", "Voice_Filter2_Drive", "Voice_Modulators_AmpEnvelope_Times_Attack", "Voice_Modulators_AmpEnvelope_Times_Decay", "Voice_Modulators_AmpEnvelope_Times_Release", "Voice_Modulators_AmpEnvelope_Sustain"), "InstrumentVector"),
    /** Max for Live devices. */
    MAX_FOR_LIVE (List.of (), "MxDeviceMidiEffect", "MxDeviceAudioEffect"),
    /** All other devices. */
    GENERIC (List.of ());


    private final List<String> keys;
    private final String []    tags;


    private DeviceKind (final List<String> keys, final String... tags)
    {
        this.keys = keys;
        this.tags = tags;
    }


    /**
     * Get the parameters which are extracted for this kind.
     *
     * @return The tags of the parameters
     */
    public List<String> getKeys ()
    {
        return this.keys;
    }


    /**
     * Lookup the kind of a device.
     *
     * @param deviceTag The tag of the device, case is ignored
     * @return The kind, generic if it is not one of the known kinds
     */
    public static DeviceKind fromTag (final String deviceTag)
    {
        final String lowerTag = deviceTag == null ? "" : deviceTag.toLowerCase (Locale.ROOT);
        for (final DeviceKind kind: values ())
        {
            for (final String tag: kind.tags)
            {
                if (tag.toLowerCase (Locale.ROOT).equals (lowerTag))
                    return kind;
            }
        }
        return GENERIC;
    }
}
