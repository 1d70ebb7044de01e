// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Optional;


/**
 * The identity of a (plug-in) device. None of the values is ever a boolean literal.
 *
 * @author Jürgen Moßgraber
 */
public class DeviceIdentity
{
    private final String vendor;
    private final String product;
    private final String identifier;


    /**
     * Constructor.
     *
     * @param vendor The vendor, might be null
     * @param product The product name, might be null
     * @param identifier The unique ID or file path of the plug-in, might be null
     */
    public DeviceIdentity (final String vendor, final String product, final String identifier)
    {
        this.vendor = vendor;
        this.product = product;
        this.identifier = identifier;
    }


    /**
     * Get the vendor.
     *
     * @return The vendor
     */
    public Optional<String> getVendor ()
    {
        return Optional.ofNullable (this.vendor);
    }


    /**
     * Get the product.
     *
     * @return The product
     */
    public Optional<String> getProduct ()
    {
        return Optional.ofNullable (this.product);
    }


    /**
     * Get the identifier (unique ID or path).
     *
     * @return The identifier
     */
    public Optional<String> getIdentifier ()
    {
        return Optional.ofNullable (this.identifier);
    }
}
