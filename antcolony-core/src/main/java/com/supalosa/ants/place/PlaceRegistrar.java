package com.supalosa.ants.place;

/**
 * Callback used by a {@link LayoutBuilder} to register the places it creates with the colony.
 */
@FunctionalInterface
public interface PlaceRegistrar {

    /**
     * @param place The place to register. Names must be unique within a colony.
     * @param isBeeEntrance Whether bees released from the hive can enter the colony here.
     */
    void register(Place place, boolean isBeeEntrance);
}
