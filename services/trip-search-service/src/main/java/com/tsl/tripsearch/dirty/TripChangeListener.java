package com.tsl.tripsearch.dirty;

/**
 * Write hook for the trip tables. Call it after every committed insert, update or delete that touches a trip,
 * its travelers, activities or transit legs. Usable where database triggers are not available.
 */
public interface TripChangeListener {

    void onTripChanged(long tripId, DirtyReason reason);
}
