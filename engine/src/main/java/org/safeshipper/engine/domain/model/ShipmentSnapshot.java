package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read-only view of a shipment as supplied by the caller.
 */
public final class ShipmentSnapshot {

    private final String id;
    private final String trackingRef;
    private final List<DgItem> items;

    public ShipmentSnapshot(String id, String trackingRef, List<DgItem> items) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.trackingRef = trackingRef;
        this.items = items != null
                ? Collections.unmodifiableList(new ArrayList<>(items))
                : Collections.emptyList();
    }

    public String getId() {
        return id;
    }

    public String getTrackingRef() {
        return trackingRef;
    }

    public List<DgItem> getItems() {
        return items;
    }

    public List<DgItem> getDangerousItems() {
        return items.stream()
                .filter(DgItem::isDangerousGood)
                .collect(Collectors.toList());
    }

    public boolean containsDangerousGoods() {
        return items.stream().anyMatch(DgItem::isDangerousGood);
    }

    @Override
    public String toString() {
        return String.format("ShipmentSnapshot{id='%s', tracking='%s', items=%d}", id, trackingRef, items.size());
    }
}
