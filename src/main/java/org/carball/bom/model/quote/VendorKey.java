package org.carball.bom.model.quote;

/**
 * Identity of a vendor offer: the vendor plus the vendor's own part number.
 */
public record VendorKey(String vendorName, String vendorPartName) {

    @Override
    public String toString() {
        return vendorName + ":" + vendorPartName;
    }
}
