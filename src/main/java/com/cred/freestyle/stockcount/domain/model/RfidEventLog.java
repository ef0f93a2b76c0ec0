package com.cred.freestyle.stockcount.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only log of RFID events owned by one stock count.
 * Events keep the order in which they were reported.
 *
 * @author Stock Count Team
 */
public class RfidEventLog {

    private final List<RfidEvent> rfidEvents;

    public RfidEventLog() {
        this.rfidEvents = new ArrayList<>();
    }

    private RfidEventLog(List<RfidEvent> rfidEvents) {
        this.rfidEvents = new ArrayList<>(rfidEvents);
    }

    public void append(RfidEvent event) {
        rfidEvents.add(event);
    }

    public List<RfidEvent> getRfidEvents() {
        return Collections.unmodifiableList(rfidEvents);
    }

    public int size() {
        return rfidEvents.size();
    }

    RfidEventLog copy() {
        return new RfidEventLog(rfidEvents);
    }
}
