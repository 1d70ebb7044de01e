// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;


/**
 * The result of the quality check of one track.
 *
 * @author Jürgen Moßgraber
 */
public class QcResult
{
    private final Set<QcReason>  reasons;
    private final Set<QcWarning> warnings;


    /**
     * Constructor.
     *
     * @param reasons The reasons for failing
     * @param warnings The warnings
     */
    public QcResult (final Set<QcReason> reasons, final Set<QcWarning> warnings)
    {
        // Enum sets iterate in declaration order which is the reporting order
        this.reasons = Collections.unmodifiableSet (reasons.isEmpty () ? EnumSet.noneOf (QcReason.class) : EnumSet.copyOf (reasons));
        this.warnings = Collections.unmodifiableSet (warnings.isEmpty () ? EnumSet.noneOf (QcWarning.class) : EnumSet.copyOf (warnings));
    }


    /**
     * Did the track fail?
     *
     * @return True if there is at least one reason
     */
    public boolean isFail ()
    {
        return !this.reasons.isEmpty ();
    }


    /**
     * Get the reasons.
     *
     * @return The reasons in reporting order
     */
    public Set<QcReason> getReasons ()
    {
        return this.reasons;
    }


    /**
     * Get the warnings.
     *
     * @return The warnings in reporting order
     */
    public Set<QcWarning> getWarnings ()
    {
        return this.warnings;
    }


    /**
     * Get the codes of the reasons packed into one string, e.g. "mdo".
     *
     * @return The codes, empty if there are no reasons
     */
    public String getReasonCodes ()
    {
        final StringBuilder sb = new StringBuilder ();
        for (final QcReason reason: this.reasons)
            sb.append (reason.getCode ());
        return sb.toString ();
    }


    /**
     * Get the codes of the warnings packed into one string.
     *
     * @return The codes, empty if there are no warnings
     */
    public String getWarningCodes ()
    {
        final StringBuilder sb = new StringBuilder ();
        for (final QcWarning warning: this.warnings)
            sb.append (warning.getCode ());
        return sb.toString ();
    }


    /** {@inheritDoc} */
    @Override
    public boolean equals (final Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof final QcResult other))
            return false;
        return this.reasons.equals (other.reasons) && this.warnings.equals (other.warnings);
    }


    /** {@inheritDoc} */
    @Override
    public int hashCode ()
    {
        return 31 * this.reasons.hashCode () + this.warnings.hashCode ();
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return "QcResult [reasons=" + this.getReasonCodes () + ", warnings=" + this.getWarningCodes () + "]";
    }
}
