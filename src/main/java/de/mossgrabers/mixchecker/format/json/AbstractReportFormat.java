// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.json;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.core.AbstractCoreTask;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.IDestinationFormat;
import de.mossgrabers.mixchecker.core.ProjectAnalysis;
import de.mossgrabers.mixchecker.model.Device;
import de.mossgrabers.mixchecker.model.Parameter;
import de.mossgrabers.mixchecker.model.QcReason;
import de.mossgrabers.mixchecker.model.QcWarning;
import de.mossgrabers.mixchecker.model.TriState;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.OptionalDouble;


/**
 * Base class for the JSON reports.
 *
 * @author Jürgen Moßgraber
 */
public abstract class AbstractReportFormat extends AbstractCoreTask implements IDestinationFormat
{
    /** The version of the report structure. */
    public static final String VERSION = "1.0.0";

    private final String       fileEnding;


    /**
     * Constructor.
     *
     * @param name The name of the format
     * @param fileEnding The ending of the written files
     * @param notifier The notifier
     */
    protected AbstractReportFormat (final String name, final String fileEnding, final INotifier notifier)
    {
        super (name, notifier);
        this.fileEnding = fileEnding;
    }


    /** {@inheritDoc} */
    @Override
    public String getFileEnding ()
    {
        return this.fileEnding;
    }


    /** {@inheritDoc} */
    @Override
    public void write (final ProjectAnalysis analysis, final AnalysisSettings settings, final File outputFile) throws IOException
    {
        JsonHelper.createMapper (settings.isMinify ()).writeValue (outputFile, this.createReport (analysis, settings));
    }


    /**
     * Create the JSON tree of the report.
     *
     * @param analysis The analysis to report
     * @param settings The analysis settings
     * @return The report
     */
    public abstract ObjectNode createReport (ProjectAnalysis analysis, AnalysisSettings settings);


    /**
     * Create the legend of the reason codes.
     *
     * @return The codes mapped to their description
     */
    protected static ObjectNode createReasonLegend ()
    {
        final ObjectNode legend = JsonHelper.FACTORY.objectNode ();
        for (final QcReason reason: QcReason.values ())
            legend.put (reason.getCode (), reason.getDescription ());
        return legend;
    }


    /**
     * Create the legend of the warning codes.
     *
     * @return The codes mapped to their description
     */
    protected static ObjectNode createWarningLegend ()
    {
        final ObjectNode legend = JsonHelper.FACTORY.objectNode ();
        for (final QcWarning warning: QcWarning.values ())
            legend.put (warning.getCode (), warning.getDescription ());
        return legend;
    }


    /**
     * Create the named parameters of a device.
     *
     * @param device The device
     * @return The parameters, null if there are none
     */
    protected static ObjectNode createNamedParameters (final Device device)
    {
        final Map<String, String> namedParameters = device.getNamedParameters ();
        if (namedParameters.isEmpty ())
            return null;
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        for (final Map.Entry<String, String> entry: namedParameters.entrySet ())
            node.put (entry.getKey (), entry.getValue ());
        return node;
    }


    /**
     * Create the raw parameters of a device.
     *
     * @param device The device
     * @return The parameters by their key, null if there are none
     */
    protected static ObjectNode createParameters (final Device device)
    {
        final Map<String, Parameter> parameters = device.getParameters ();
        if (parameters.isEmpty ())
            return null;
        final ObjectNode node = JsonHelper.FACTORY.objectNode ();
        for (final Map.Entry<String, Parameter> entry: parameters.entrySet ())
        {
            final Parameter parameter = entry.getValue ();
            final ObjectNode parameterNode = node.putObject (entry.getKey ());
            parameterNode.put ("id", parameter.getId ().orElse (null));
            parameterNode.put ("name", parameter.getName ().orElse (null));
            parameterNode.put ("value_raw", parameter.getValueRaw ().orElse (null));
            parameterNode.put ("tag", parameter.getTag ());
        }
        return node;
    }


    /**
     * Add a tri-state value. Unknown is stored as null.
     *
     * @param node The node to add to
     * @param key The key
     * @param value The value
     */
    protected static void putTriState (final ObjectNode node, final String key, final TriState value)
    {
        final Boolean bool = value.toBoolean ();
        if (bool == null)
            node.putNull (key);
        else
            node.put (key, bool.booleanValue ());
    }


    /**
     * Add a number. Absent and non-finite values are stored as null since JSON cannot represent
     * infinity.
     *
     * @param node The node to add to
     * @param key The key
     * @param value The value
     */
    protected static void putDouble (final ObjectNode node, final String key, final OptionalDouble value)
    {
        if (value.isPresent () && Double.isFinite (value.getAsDouble ()))
            node.put (key, value.getAsDouble ());
        else
            node.putNull (key);
    }
}
