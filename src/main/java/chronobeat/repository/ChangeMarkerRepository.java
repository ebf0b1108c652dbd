package chronobeat.repository;

import chronobeat.model.ChangeMarker;

/**
 * Access to the single-row change marker.
 */
public interface ChangeMarkerRepository {

    /**
     * Read the current marker.
     */
    ChangeMarker current();

    /**
     * Bump the marker outside of any schedule mutation, forcing the beat loop
     * to reload on its next cycle.
     *
     * @return the new marker
     */
    ChangeMarker bump();
}
