package com.paymsg.canonical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured postal address of a debtor or creditor.
 *
 * Only created when the source carries at least one address element, so a
 * null address on a record always means "no address in the message".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostalAddress {
    /**
     * ISO 3166-1 alpha-2 country code (Ctry).
     */
    private String country;

    /**
     * Town name (TwnNm).
     */
    private String townName;

    /**
     * Post code (PstCd).
     */
    private String postCode;

    /**
     * Street name (StrtNm).
     */
    private String streetName;

    /**
     * Building number (BldgNb).
     */
    private String buildingNumber;

    /**
     * Unstructured address lines (AdrLine), in document order.
     */
    @Builder.Default
    private List<String> addressLines = new ArrayList<>();

    /**
     * Returns an address only when at least one component is present.
     */
    public static PostalAddress ofNullable(String country, String townName, String postCode,
                                           String streetName, String buildingNumber,
                                           List<String> addressLines) {
        boolean hasLines = addressLines != null && !addressLines.isEmpty();
        if (country == null && townName == null && postCode == null
                && streetName == null && buildingNumber == null && !hasLines) {
            return null;
        }
        return PostalAddress.builder()
            .country(country)
            .townName(townName)
            .postCode(postCode)
            .streetName(streetName)
            .buildingNumber(buildingNumber)
            .addressLines(hasLines ? new ArrayList<>(addressLines) : new ArrayList<>())
            .build();
    }
}
