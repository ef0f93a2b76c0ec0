package com.cred.freestyle.stockcount.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single RFID tag read recorded against a stock count.
 *
 * @author Stock Count Team
 */
@Value
@Builder
public class RfidEvent {

    /**
     * Location reported by the reader. Null when the stock take did not name one.
     */
    Integer locationId;

    String workArea;

    /**
     * Hex-encoded tag value (EPC) as read by the handheld.
     */
    String tagIdHex;
}
